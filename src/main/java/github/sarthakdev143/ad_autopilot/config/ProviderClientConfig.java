package github.sarthakdev143.ad_autopilot.config;

import github.sarthakdev143.ad_autopilot.integration.http.HttpExternalJobClient;
import github.sarthakdev143.ad_autopilot.integration.http.HttpNarrationSynthesizer;
import github.sarthakdev143.ad_autopilot.integration.http.HttpProductSource;
import github.sarthakdev143.ad_autopilot.integration.http.HttpVisionAnalyzer;
import github.sarthakdev143.ad_autopilot.service.GenerationProviders;
import github.sarthakdev143.ad_autopilot.service.NarrationSynthesizer;
import github.sarthakdev143.ad_autopilot.service.ProductSource;
import github.sarthakdev143.ad_autopilot.service.VisionAnalyzer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class ProviderClientConfig {

    @Bean
    public RestTemplate providerRestTemplate(AdAutopilotProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.getHttp().getConnectTimeout());
        factory.setReadTimeout(properties.getHttp().getReadTimeout());
        return new RestTemplate(factory);
    }

    @Bean
    public GenerationProviders generationProviders(RestTemplate providerRestTemplate, AdAutopilotProperties properties) {
        AdAutopilotProperties.Providers providers = properties.getProviders();
        return new GenerationProviders(
                new HttpExternalJobClient(providerRestTemplate, providers.getImage()),
                new HttpExternalJobClient(providerRestTemplate, providers.getVideo()),
                new HttpExternalJobClient(providerRestTemplate, providers.getRender()));
    }

    @Bean
    public VisionAnalyzer visionAnalyzer(RestTemplate providerRestTemplate, AdAutopilotProperties properties) {
        return new HttpVisionAnalyzer(providerRestTemplate, properties.getProviders().getVision());
    }

    @Bean
    public NarrationSynthesizer narrationSynthesizer(RestTemplate providerRestTemplate, AdAutopilotProperties properties) {
        return new HttpNarrationSynthesizer(providerRestTemplate, properties.getProviders().getNarration());
    }

    @Bean
    public ProductSource productSource(RestTemplate providerRestTemplate, AdAutopilotProperties properties) {
        return new HttpProductSource(providerRestTemplate, properties.getProviders().getProducts());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
