package github.sarthakdev143.ad_autopilot.model.publishing;

import java.time.Instant;

public record PublishJob(
        String id,
        String assetId,
        String historyId,
        String platform,
        String remoteJobId,
        PublishJobStatus status,
        Instant scheduledFor,
        String publicUrl,
        String errorMessage,
        Instant publishedAt) {

    public PublishJob {
        if (platform == null || platform.isBlank()) {
            throw new IllegalArgumentException("platform is required.");
        }
        status = status == null ? PublishJobStatus.POSTING : status;
    }

    public PublishJob asPublished(String url, Instant now) {
        return new PublishJob(
                id, assetId, historyId, platform, remoteJobId, PublishJobStatus.PUBLISHED, scheduledFor, url, null, now);
    }

    public PublishJob asFailed(String error) {
        return new PublishJob(
                id, assetId, historyId, platform, remoteJobId, PublishJobStatus.FAILED, scheduledFor, publicUrl, error, publishedAt);
    }
}
