package github.sarthakdev143.ad_autopilot.model.autopilot;

import github.sarthakdev143.ad_autopilot.model.publishing.PlatformPublishResult;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record GenerationHistoryRecord(
        String id,
        String configId,
        String productId,
        String mediaAssetId,
        HistoryStatus status,
        String errorMessage,
        Map<String, PlatformPublishResult> publishedPlatforms,
        Instant createdAt,
        Instant completedAt) {

    public GenerationHistoryRecord {
        status = status == null ? HistoryStatus.PENDING : status;
        publishedPlatforms = publishedPlatforms == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(publishedPlatforms));
    }

    public static GenerationHistoryRecord pending(String id, String configId, String productId, Instant now) {
        return new GenerationHistoryRecord(id, configId, productId, null, HistoryStatus.PENDING, null, Map.of(), now, null);
    }

    public static GenerationHistoryRecord failed(String id, String configId, String productId, String error, Instant now) {
        return new GenerationHistoryRecord(id, configId, productId, null, HistoryStatus.FAILED, error, Map.of(), now, now);
    }

    public GenerationHistoryRecord generating(String assetId) {
        requireNotTerminal();
        return new GenerationHistoryRecord(
                id, configId, productId, assetId, HistoryStatus.GENERATING, null, publishedPlatforms, createdAt, null);
    }

    public GenerationHistoryRecord ready(Instant now) {
        requireNotTerminal();
        return new GenerationHistoryRecord(
                id, configId, productId, mediaAssetId, HistoryStatus.READY, null, publishedPlatforms, createdAt, now);
    }

    public GenerationHistoryRecord asFailed(String error, Instant now) {
        requireNotTerminal();
        return new GenerationHistoryRecord(
                id, configId, productId, mediaAssetId, HistoryStatus.FAILED, error, publishedPlatforms, createdAt, now);
    }

    public GenerationHistoryRecord withPublishResult(String platform, PlatformPublishResult result) {
        Map<String, PlatformPublishResult> updated = new LinkedHashMap<>(publishedPlatforms);
        updated.put(platform, result);
        return new GenerationHistoryRecord(
                id, configId, productId, mediaAssetId, status, errorMessage, updated, createdAt, completedAt);
    }

    private void requireNotTerminal() {
        if (status.isTerminal()) {
            throw new IllegalStateException("History record " + id + " is already " + status);
        }
    }
}
