package github.sarthakdev143.ad_autopilot.integration.http;

import com.fasterxml.jackson.databind.JsonNode;
import github.sarthakdev143.ad_autopilot.config.AdAutopilotProperties;
import github.sarthakdev143.ad_autopilot.exception.ProviderException;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * JSON-over-HTTP plumbing shared by the provider clients: bearer auth, base URL handling and
 * translation of transport errors into {@link ProviderException}.
 */
abstract class AbstractJsonProviderClient {

    private final RestTemplate restTemplate;
    private final AdAutopilotProperties.Endpoint endpoint;

    protected AbstractJsonProviderClient(RestTemplate restTemplate, AdAutopilotProperties.Endpoint endpoint) {
        this.restTemplate = restTemplate;
        this.endpoint = endpoint;
    }

    protected String endpointName() {
        return endpoint.getName();
    }

    protected JsonNode postJson(String path, Object body) {
        return exchange(HttpMethod.POST, path, body);
    }

    protected JsonNode getJson(String path) {
        return exchange(HttpMethod.GET, path, null);
    }

    protected static String text(JsonNode node, String... candidates) {
        if (node == null) {
            return null;
        }
        for (String field : candidates) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    private JsonNode exchange(HttpMethod method, String path, Object body) {
        String baseUrl = endpoint.getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new ProviderException(endpoint.getName(), "No base URL configured for provider " + endpoint.getName());
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (body != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        if (endpoint.getApiKey() != null && !endpoint.getApiKey().isBlank()) {
            headers.setBearerAuth(endpoint.getApiKey());
        }

        String url = stripTrailingSlash(baseUrl) + path;
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    url,
                    method,
                    new HttpEntity<>(body, headers),
                    JsonNode.class);
            if (response.getBody() == null) {
                throw new ProviderException(endpoint.getName(), "Empty response from " + endpoint.getName() + " " + path);
            }
            return response.getBody();
        } catch (RestClientException e) {
            throw new ProviderException(
                    endpoint.getName(),
                    endpoint.getName() + " request " + method + " " + path + " failed: " + e.getMessage(),
                    e);
        }
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
