package github.sarthakdev143.ad_autopilot.model.publishing;

public enum PlatformPublishStatus {
    QUEUED,
    PUBLISHED,
    FAILED
}
