package github.sarthakdev143.ad_autopilot.model.publishing;

public enum PublishJobStatus {
    SCHEDULED,
    POSTING,
    PUBLISHED,
    FAILED;

    public boolean isInFlight() {
        return this == SCHEDULED || this == POSTING;
    }
}
