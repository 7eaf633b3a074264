package github.sarthakdev143.ad_autopilot.integration.http;

import com.fasterxml.jackson.databind.JsonNode;
import github.sarthakdev143.ad_autopilot.config.AdAutopilotProperties;
import github.sarthakdev143.ad_autopilot.service.VisionAnalyzer;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

public class HttpVisionAnalyzer extends AbstractJsonProviderClient implements VisionAnalyzer {

    static final int MAX_TOKENS = 500;

    public HttpVisionAnalyzer(RestTemplate restTemplate, AdAutopilotProperties.Endpoint endpoint) {
        super(restTemplate, endpoint);
    }

    @Override
    public String analyze(String imageUrl, String instructions) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("imageUrl", imageUrl);
        body.put("instructions", instructions);
        body.put("maxTokens", MAX_TOKENS);

        JsonNode response = postJson("/analyze", body);
        return text(response, "text", "analysis", "description");
    }
}
