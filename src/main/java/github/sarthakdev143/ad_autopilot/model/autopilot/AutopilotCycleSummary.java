package github.sarthakdev143.ad_autopilot.model.autopilot;

public record AutopilotCycleSummary(int due, int succeeded, int failed, int skipped) {
}
