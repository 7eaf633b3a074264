package github.sarthakdev143.ad_autopilot.model.autopilot;

import java.util.List;

public record AutopilotVideoRequest(
        String ownerId,
        String productName,
        String productDescription,
        List<String> productImages,
        String price,
        String originalPrice,
        String storeName,
        String logoUrl,
        String voiceId) {

    public AutopilotVideoRequest {
        productImages = productImages == null ? List.of() : List.copyOf(productImages);
    }
}
