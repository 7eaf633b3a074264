package github.sarthakdev143.ad_autopilot.dto;

import github.sarthakdev143.ad_autopilot.model.AssetStatus;
import github.sarthakdev143.ad_autopilot.model.GenerationJob;
import github.sarthakdev143.ad_autopilot.model.MediaKind;

import java.time.Instant;
import java.util.List;

/**
 * Read-only projection of a generation job for API callers.
 */
public record GenerationJobResponse(
        String jobId,
        MediaKind kind,
        AssetStatus status,
        String stage,
        String resultUrl,
        List<String> resultUrls,
        String imageUrl,
        String errorMessage,
        Instant createdAt,
        Instant completedAt) {

    public static GenerationJobResponse from(GenerationJob job) {
        return new GenerationJobResponse(
                job.id(),
                job.kind(),
                job.status(),
                job.chainState().stage().label(),
                job.resultUrl(),
                job.resultUrls(),
                job.chainState().imageUrl(),
                job.errorMessage(),
                job.createdAt(),
                job.completedAt());
    }
}
