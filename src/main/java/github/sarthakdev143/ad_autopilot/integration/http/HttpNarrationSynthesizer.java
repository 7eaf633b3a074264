package github.sarthakdev143.ad_autopilot.integration.http;

import com.fasterxml.jackson.databind.JsonNode;
import github.sarthakdev143.ad_autopilot.config.AdAutopilotProperties;
import github.sarthakdev143.ad_autopilot.exception.ProviderException;
import github.sarthakdev143.ad_autopilot.model.NarrationAudio;
import github.sarthakdev143.ad_autopilot.service.NarrationSynthesizer;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

public class HttpNarrationSynthesizer extends AbstractJsonProviderClient implements NarrationSynthesizer {

    public HttpNarrationSynthesizer(RestTemplate restTemplate, AdAutopilotProperties.Endpoint endpoint) {
        super(restTemplate, endpoint);
    }

    @Override
    public NarrationAudio synthesize(String text, String voiceId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", text);
        if (voiceId != null && !voiceId.isBlank()) {
            body.put("voiceId", voiceId);
        }

        JsonNode response = postJson("/speech", body);
        String audioUrl = text(response, "audioUrl", "url");
        JsonNode duration = response.get("durationSeconds");
        if (audioUrl == null || duration == null || !duration.isNumber()) {
            throw new ProviderException(endpointName(), "Narration response is missing audioUrl or durationSeconds");
        }
        return new NarrationAudio(audioUrl, duration.asDouble());
    }
}
