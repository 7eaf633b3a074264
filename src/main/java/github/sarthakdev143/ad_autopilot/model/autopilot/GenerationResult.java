package github.sarthakdev143.ad_autopilot.model.autopilot;

public record GenerationResult(boolean success, String historyId, String assetId, String error) {

    public static GenerationResult succeeded(String historyId, String assetId) {
        return new GenerationResult(true, historyId, assetId, null);
    }

    public static GenerationResult failed(String historyId, String error) {
        return new GenerationResult(false, historyId, null, error);
    }
}
