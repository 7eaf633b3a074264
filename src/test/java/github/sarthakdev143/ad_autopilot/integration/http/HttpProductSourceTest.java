package github.sarthakdev143.ad_autopilot.integration.http;

import github.sarthakdev143.ad_autopilot.config.AdAutopilotProperties;
import github.sarthakdev143.ad_autopilot.exception.ProviderException;
import github.sarthakdev143.ad_autopilot.model.NarrationAudio;
import github.sarthakdev143.ad_autopilot.model.autopilot.ProductListing;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpProductSourceTest {

    private RestTemplate restTemplate;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
    }

    @Test
    void listingAcceptsWrappedProductsWithImageObjects() {
        server.expect(requestTo("https://shop.example/stores/store-1/products"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        {"products": [
                          {"id": "101", "title": "Desk Lamp", "body": "Dimmable",
                           "images": [{"src": "https://cdn.example/1.png"}, "https://cdn.example/2.png", {"alt": "x"}],
                           "price": "29.99"},
                          {"title": "No id here"}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        List<ProductListing> listings = new HttpProductSource(restTemplate, endpoint("products", "https://shop.example"))
                .listActiveProducts("store-1");

        assertThat(listings).singleElement().satisfies(listing -> {
            assertThat(listing.externalId()).isEqualTo("101");
            assertThat(listing.title()).isEqualTo("Desk Lamp");
            assertThat(listing.description()).isEqualTo("Dimmable");
            assertThat(listing.images()).containsExactly("https://cdn.example/1.png", "https://cdn.example/2.png");
            assertThat(listing.price()).isEqualTo("29.99");
        });
    }

    @Test
    void listingThatIsNotAnArrayIsRejected() {
        server.expect(requestTo("https://shop.example/stores/store-1/products"))
                .andRespond(withSuccess("{\"products\": {}}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> new HttpProductSource(restTemplate, endpoint("products", "https://shop.example"))
                .listActiveProducts("store-1"))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("is not an array");
    }

    @Test
    void narrationRequiresUrlAndNumericDuration() {
        server.expect(requestTo("https://tts.example/speech"))
                .andExpect(content().json("{\"text\":\"Hello\",\"voiceId\":\"voice-1\"}"))
                .andRespond(withSuccess("{\"audioUrl\":\"https://cdn.example/hello.mp3\",\"durationSeconds\":1.8}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo("https://tts.example/speech"))
                .andRespond(withSuccess("{\"audioUrl\":\"https://cdn.example/hello.mp3\",\"durationSeconds\":\"long\"}",
                        MediaType.APPLICATION_JSON));
        HttpNarrationSynthesizer synthesizer = new HttpNarrationSynthesizer(restTemplate, endpoint("narration", "https://tts.example"));

        NarrationAudio audio = synthesizer.synthesize("Hello", "voice-1");

        assertThat(audio.audioUrl()).isEqualTo("https://cdn.example/hello.mp3");
        assertThat(audio.durationSeconds()).isEqualTo(1.8);
        assertThatThrownBy(() -> synthesizer.synthesize("Hello", null))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("durationSeconds");
    }

    @Test
    void visionAnalysisSendsTokenLimitAndReadsText() {
        server.expect(requestTo("https://vision.example/analyze"))
                .andExpect(content().json("{\"imageUrl\":\"https://cdn.example/1.png\",\"maxTokens\":500}"))
                .andRespond(withSuccess("{\"analysis\":\"A person holding a lamp\"}", MediaType.APPLICATION_JSON));

        String analysis = new HttpVisionAnalyzer(restTemplate, endpoint("vision", "https://vision.example"))
                .analyze("https://cdn.example/1.png", "Describe it");

        assertThat(analysis).isEqualTo("A person holding a lamp");
        server.verify();
    }

    private static AdAutopilotProperties.Endpoint endpoint(String name, String baseUrl) {
        AdAutopilotProperties.Endpoint endpoint = new AdAutopilotProperties.Endpoint(name);
        endpoint.setBaseUrl(baseUrl);
        return endpoint;
    }
}
