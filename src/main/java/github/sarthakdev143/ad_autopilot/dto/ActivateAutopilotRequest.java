package github.sarthakdev143.ad_autopilot.dto;

public record ActivateAutopilotRequest(String firstVideoAssetId) {
}
