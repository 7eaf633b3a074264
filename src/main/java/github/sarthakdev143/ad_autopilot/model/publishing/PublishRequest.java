package github.sarthakdev143.ad_autopilot.model.publishing;

import java.time.Instant;
import java.util.List;

public record PublishRequest(
        String assetId,
        String videoUrl,
        String title,
        String caption,
        List<String> hashtags,
        Instant publishAt) {

    public PublishRequest {
        if (videoUrl == null || videoUrl.isBlank()) {
            throw new IllegalArgumentException("videoUrl is required to publish asset " + assetId);
        }
        hashtags = hashtags == null ? List.of() : List.copyOf(hashtags);
    }
}
