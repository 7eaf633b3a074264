package github.sarthakdev143.ad_autopilot.model.publishing;

import java.time.Instant;

public record PublishReceipt(String remoteJobId, String publicUrl, Instant scheduledFor, String warningMessage) {

    public PublishReceipt {
        if (remoteJobId == null || remoteJobId.isBlank()) {
            throw new IllegalArgumentException("remoteJobId is required.");
        }
    }
}
