package github.sarthakdev143.ad_autopilot.integration.http;

import com.fasterxml.jackson.databind.JsonNode;
import github.sarthakdev143.ad_autopilot.config.AdAutopilotProperties;
import github.sarthakdev143.ad_autopilot.exception.ProviderException;
import github.sarthakdev143.ad_autopilot.model.autopilot.ProductListing;
import github.sarthakdev143.ad_autopilot.service.ProductSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class HttpProductSource extends AbstractJsonProviderClient implements ProductSource {

    private static final Logger logger = LoggerFactory.getLogger(HttpProductSource.class);

    public HttpProductSource(RestTemplate restTemplate, AdAutopilotProperties.Endpoint endpoint) {
        super(restTemplate, endpoint);
    }

    @Override
    public List<ProductListing> listActiveProducts(String storeId) {
        JsonNode response = getJson(
                "/stores/" + UriUtils.encodePathSegment(storeId, StandardCharsets.UTF_8) + "/products");
        JsonNode products = response.isArray() ? response : response.get("products");
        if (products == null || !products.isArray()) {
            throw new ProviderException(endpointName(), "Product listing for store " + storeId + " is not an array");
        }

        List<ProductListing> listings = new ArrayList<>();
        for (JsonNode product : products) {
            String externalId = text(product, "externalId", "id");
            if (externalId == null) {
                logger.warn("Skipping product without an id in store {}", storeId);
                continue;
            }
            List<String> images = new ArrayList<>();
            JsonNode imageNodes = product.get("images");
            if (imageNodes != null && imageNodes.isArray()) {
                imageNodes.forEach(image -> images.add(image.isTextual() ? image.asText() : text(image, "src", "url")));
            }
            images.removeIf(image -> image == null || image.isBlank());
            listings.add(new ProductListing(
                    externalId,
                    text(product, "title", "name"),
                    text(product, "description", "body"),
                    images,
                    text(product, "price")));
        }
        return listings;
    }
}
