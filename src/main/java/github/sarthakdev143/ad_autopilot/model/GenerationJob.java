package github.sarthakdev143.ad_autopilot.model;

import github.sarthakdev143.ad_autopilot.model.chain.ChainState;
import github.sarthakdev143.ad_autopilot.model.timing.SceneDurations;

import java.time.Instant;
import java.util.List;

public record GenerationJob(
        String id,
        String ownerId,
        String provider,
        MediaKind kind,
        String externalJobId,
        AssetStatus status,
        ChainState chainState,
        PromptVariables promptVariables,
        String referenceImageUrl,
        SceneDurations sceneDurations,
        String resultUrl,
        List<String> resultUrls,
        String errorMessage,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt) {

    public GenerationJob {
        status = status == null ? AssetStatus.PROCESSING : status;
        chainState = chainState == null ? ChainState.queued() : chainState;
        resultUrls = resultUrls == null ? List.of() : List.copyOf(resultUrls);
    }

    public static GenerationJob queued(
            String id,
            String ownerId,
            MediaKind kind,
            PromptVariables promptVariables,
            String referenceImageUrl,
            SceneDurations sceneDurations,
            Instant now) {
        return new GenerationJob(
                id,
                ownerId,
                null,
                kind,
                null,
                AssetStatus.PROCESSING,
                ChainState.queued(),
                promptVariables,
                referenceImageUrl,
                sceneDurations,
                null,
                List.of(),
                null,
                now,
                now,
                null);
    }

    public GenerationJob withChainState(ChainState state, Instant now) {
        return new GenerationJob(
                id,
                ownerId,
                provider,
                kind,
                externalJobId,
                status,
                state,
                promptVariables,
                referenceImageUrl,
                sceneDurations,
                resultUrl,
                resultUrls,
                errorMessage,
                createdAt,
                now,
                completedAt);
    }

    public GenerationJob withProviderJob(String providerName, MediaKind mediaKind, String jobId, ChainState state, Instant now) {
        return new GenerationJob(
                id,
                ownerId,
                providerName,
                mediaKind,
                jobId,
                status,
                state,
                promptVariables,
                referenceImageUrl,
                sceneDurations,
                resultUrl,
                resultUrls,
                errorMessage,
                createdAt,
                now,
                completedAt);
    }

    public GenerationJob asCompleted(List<String> urls, ChainState state, Instant now) {
        List<String> normalizedUrls = urls == null ? List.of() : List.copyOf(urls);
        return new GenerationJob(
                id,
                ownerId,
                provider,
                kind,
                externalJobId,
                AssetStatus.READY,
                state,
                promptVariables,
                referenceImageUrl,
                sceneDurations,
                normalizedUrls.isEmpty() ? null : normalizedUrls.get(0),
                normalizedUrls,
                null,
                createdAt,
                now,
                now);
    }

    public GenerationJob asFailed(String message, ChainState state, Instant now) {
        return new GenerationJob(
                id,
                ownerId,
                provider,
                kind,
                externalJobId,
                AssetStatus.ERROR,
                state,
                promptVariables,
                referenceImageUrl,
                sceneDurations,
                resultUrl,
                resultUrls,
                message,
                createdAt,
                now,
                now);
    }
}
