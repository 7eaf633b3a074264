package github.sarthakdev143.ad_autopilot.model.publishing;

import java.time.Instant;
import java.util.List;

/**
 * Upload metadata for a single platform video. A scheduled publish time forces the video to stay
 * private until then.
 */
public record PublishOptions(
        PrivacyStatus privacyStatus,
        List<String> tags,
        String categoryId,
        Instant publishAt) {

    public PublishOptions {
        privacyStatus = publishAt != null
                ? PrivacyStatus.PRIVATE
                : privacyStatus == null ? PrivacyStatus.PUBLIC : privacyStatus;
        tags = tags == null ? List.of() : List.copyOf(tags);
        categoryId = categoryId == null || categoryId.isBlank() ? null : categoryId;
    }

    public boolean isScheduled() {
        return publishAt != null;
    }

    public PublishOptions withoutCategory() {
        return new PublishOptions(privacyStatus, tags, null, publishAt);
    }
}
