package github.sarthakdev143.ad_autopilot.dto;

public record GenerationRequest(
        String ownerId,
        String product,
        String features,
        String icp,
        String scene,
        String productImageUrl) {
}
