package github.sarthakdev143.ad_autopilot.model.publishing;

public record ReconciliationSummary(int checked, int published, int failed, int unchanged) {

    public static ReconciliationSummary empty() {
        return new ReconciliationSummary(0, 0, 0, 0);
    }
}
