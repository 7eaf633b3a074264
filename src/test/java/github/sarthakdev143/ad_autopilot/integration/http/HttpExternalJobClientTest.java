package github.sarthakdev143.ad_autopilot.integration.http;

import github.sarthakdev143.ad_autopilot.config.AdAutopilotProperties;
import github.sarthakdev143.ad_autopilot.exception.ProviderException;
import github.sarthakdev143.ad_autopilot.model.ProviderJobState;
import github.sarthakdev143.ad_autopilot.model.ProviderJobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpExternalJobClientTest {

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private HttpExternalJobClient client;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new HttpExternalJobClient(restTemplate, endpoint("https://images.example/api/"));
    }

    @Test
    void submitPostsPromptWithBearerTokenAndReadsTaskId() {
        server.expect(requestTo("https://images.example/api/jobs"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer secret-key"))
                .andExpect(content().json("{\"prompt\":\"a selfie\",\"params\":{\"aspectRatio\":\"9:16\"}}"))
                .andRespond(withSuccess("{\"taskId\":\"task-42\"}", MediaType.APPLICATION_JSON));

        String jobId = client.submit("a selfie", Map.of("aspectRatio", "9:16"));

        assertThat(jobId).isEqualTo("task-42");
        assertThat(client.providerName()).isEqualTo("image-provider");
        server.verify();
    }

    @Test
    void submitWithoutJobIdIsAProviderError() {
        server.expect(requestTo("https://images.example/api/jobs"))
                .andRespond(withSuccess("{\"accepted\":true}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.submit("prompt", null))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("returned no job id");
    }

    @Test
    void pollMapsProviderVocabularyAndResultUrls() {
        server.expect(requestTo("https://images.example/api/jobs/job-1"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(
                        "{\"status\":\"succeeded\",\"resultUrls\":[\"https://cdn.example/a.png\",\"https://cdn.example/b.png\"]}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo("https://images.example/api/jobs/job-2"))
                .andRespond(withSuccess("{\"state\":\"completed\",\"url\":\"https://cdn.example/c.png\"}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo("https://images.example/api/jobs/job-3"))
                .andRespond(withSuccess("{\"status\":\"error\",\"message\":\"nsfw prompt\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo("https://images.example/api/jobs/job-4"))
                .andRespond(withSuccess("{\"status\":\"in_queue\"}", MediaType.APPLICATION_JSON));

        ProviderJobStatus ready = client.poll("job-1");
        ProviderJobStatus single = client.poll("job-2");
        ProviderJobStatus failed = client.poll("job-3");
        ProviderJobStatus waiting = client.poll("job-4");

        assertThat(ready.state()).isEqualTo(ProviderJobState.READY);
        assertThat(ready.resultUrls()).containsExactly("https://cdn.example/a.png", "https://cdn.example/b.png");
        assertThat(single.firstResultUrl()).isEqualTo("https://cdn.example/c.png");
        assertThat(failed.state()).isEqualTo(ProviderJobState.FAILED);
        assertThat(failed.error()).isEqualTo("nsfw prompt");
        assertThat(waiting.state()).isEqualTo(ProviderJobState.PROCESSING);
        server.verify();
    }

    @Test
    void transportErrorsBecomeProviderExceptions() {
        server.expect(requestTo("https://images.example/api/jobs/job-1")).andRespond(withServerError());

        assertThatThrownBy(() -> client.poll("job-1"))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("image-provider request GET /jobs/job-1 failed");
    }

    @Test
    void missingBaseUrlFailsWithoutCallingOut() {
        HttpExternalJobClient unconfigured = new HttpExternalJobClient(restTemplate, endpoint(null));

        assertThatThrownBy(() -> unconfigured.poll("job-1"))
                .isInstanceOf(ProviderException.class)
                .hasMessage("No base URL configured for provider image-provider");
        server.verify();
    }

    private static AdAutopilotProperties.Endpoint endpoint(String baseUrl) {
        AdAutopilotProperties.Endpoint endpoint = new AdAutopilotProperties.Endpoint("image-provider");
        endpoint.setBaseUrl(baseUrl);
        endpoint.setApiKey("secret-key");
        return endpoint;
    }
}
