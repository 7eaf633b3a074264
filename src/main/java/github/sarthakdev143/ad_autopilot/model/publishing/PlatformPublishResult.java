package github.sarthakdev143.ad_autopilot.model.publishing;

public record PlatformPublishResult(PlatformPublishStatus status, String remoteJobId, String publicUrl, String error) {

    public static PlatformPublishResult queued(String remoteJobId) {
        return new PlatformPublishResult(PlatformPublishStatus.QUEUED, remoteJobId, null, null);
    }

    public static PlatformPublishResult published(String remoteJobId, String publicUrl) {
        return new PlatformPublishResult(PlatformPublishStatus.PUBLISHED, remoteJobId, publicUrl, null);
    }

    public static PlatformPublishResult failed(String remoteJobId, String error) {
        return new PlatformPublishResult(PlatformPublishStatus.FAILED, remoteJobId, null, error);
    }
}
