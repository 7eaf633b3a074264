package github.sarthakdev143.ad_autopilot.model.autopilot;

public record AutopilotStore(String id, String name, String logoUrl) {
}
