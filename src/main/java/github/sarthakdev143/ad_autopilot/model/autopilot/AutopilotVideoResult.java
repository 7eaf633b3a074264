package github.sarthakdev143.ad_autopilot.model.autopilot;

import java.util.List;

public record AutopilotVideoResult(boolean success, String assetId, String error, List<String> warnings) {

    public AutopilotVideoResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static AutopilotVideoResult started(String assetId, List<String> warnings) {
        return new AutopilotVideoResult(true, assetId, null, warnings);
    }

    public static AutopilotVideoResult failed(String error, List<String> warnings) {
        return new AutopilotVideoResult(false, null, error, warnings);
    }
}
