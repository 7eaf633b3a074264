package github.sarthakdev143.ad_autopilot.integration.http;

import com.fasterxml.jackson.databind.JsonNode;
import github.sarthakdev143.ad_autopilot.config.AdAutopilotProperties;
import github.sarthakdev143.ad_autopilot.exception.ProviderException;
import github.sarthakdev143.ad_autopilot.model.ProviderJobState;
import github.sarthakdev143.ad_autopilot.model.ProviderJobStatus;
import github.sarthakdev143.ad_autopilot.service.ExternalJobClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Job client for providers exposing {@code POST /jobs} and {@code GET /jobs/{id}}.
 */
public class HttpExternalJobClient extends AbstractJsonProviderClient implements ExternalJobClient {

    private static final Logger logger = LoggerFactory.getLogger(HttpExternalJobClient.class);

    public HttpExternalJobClient(RestTemplate restTemplate, AdAutopilotProperties.Endpoint endpoint) {
        super(restTemplate, endpoint);
    }

    @Override
    public String providerName() {
        return endpointName();
    }

    @Override
    public String submit(String prompt, Map<String, Object> params) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("prompt", prompt);
        body.put("params", params == null ? Map.of() : params);

        JsonNode response = postJson("/jobs", body);
        String jobId = text(response, "jobId", "taskId", "id");
        if (jobId == null) {
            throw new ProviderException(providerName(), providerName() + " accepted the job but returned no job id");
        }
        logger.debug("Submitted {} job {}", providerName(), jobId);
        return jobId;
    }

    @Override
    public ProviderJobStatus poll(String jobId) {
        JsonNode response = getJson("/jobs/" + UriUtils.encodePathSegment(jobId, StandardCharsets.UTF_8));
        ProviderJobState state = ProviderJobState.fromProviderValue(text(response, "status", "state"));
        return switch (state) {
            case READY -> ProviderJobStatus.ready(resultUrls(response));
            case FAILED -> ProviderJobStatus.failed(text(response, "error", "errorMessage", "message"));
            case PROCESSING -> ProviderJobStatus.processing();
        };
    }

    private List<String> resultUrls(JsonNode response) {
        List<String> urls = new ArrayList<>();
        JsonNode array = response.get("resultUrls");
        if (array != null && array.isArray()) {
            array.forEach(url -> {
                if (!url.asText().isBlank()) {
                    urls.add(url.asText());
                }
            });
        }
        String single = text(response, "resultUrl", "url");
        if (urls.isEmpty() && single != null) {
            urls.add(single);
        }
        return urls;
    }
}
