package github.sarthakdev143.ad_autopilot.model;

public record PromptVariables(String product, String features, String icp, String scene) {

    public PromptVariables {
        product = product == null ? "" : product.trim();
        features = features == null ? "" : features.trim();
        icp = icp == null ? "" : icp.trim();
        scene = scene == null ? "" : scene.trim();
    }
}
