package github.sarthakdev143.ad_autopilot.model.chain;

import java.time.Instant;

public record ChainState(
        ChainStage stage,
        ChainTimestamps timestamps,
        String imageJobId,
        String imageUrl,
        String imageAnalysis,
        String videoPrompt,
        String videoJobId,
        ChainStage failedStage,
        String error,
        SubmissionIntent pendingSubmission) {

    public ChainState {
        stage = stage == null ? ChainStage.QUEUED : stage;
        timestamps = timestamps == null ? ChainTimestamps.empty() : timestamps;
    }

    public static ChainState queued() {
        return new ChainState(ChainStage.QUEUED, ChainTimestamps.empty(), null, null, null, null, null, null, null, null);
    }

    public ChainState withPendingSubmission(ChainStage targetStage, Instant now) {
        stage.transitionTo(targetStage);
        return new ChainState(
                stage,
                timestamps,
                imageJobId,
                imageUrl,
                imageAnalysis,
                videoPrompt,
                videoJobId,
                failedStage,
                error,
                new SubmissionIntent(targetStage, now));
    }

    public ChainState imageSubmitted(String jobId, Instant now) {
        return new ChainState(
                stage.transitionTo(ChainStage.GENERATING_IMAGE),
                timestamps.withImageStarted(now),
                jobId,
                imageUrl,
                imageAnalysis,
                videoPrompt,
                videoJobId,
                failedStage,
                error,
                null);
    }

    public ChainState imageReady(String url, Instant now) {
        return new ChainState(
                stage.transitionTo(ChainStage.ANALYZING_IMAGE),
                timestamps.withImageCompleted(now),
                imageJobId,
                url,
                imageAnalysis,
                videoPrompt,
                videoJobId,
                failedStage,
                error,
                pendingSubmission);
    }

    public ChainState analysisCompleted(String analysis, String prompt, Instant now) {
        if (stage != ChainStage.ANALYZING_IMAGE) {
            throw new IllegalStateException("Image analysis can only complete while analyzing, stage is " + stage.label());
        }
        return new ChainState(
                stage,
                timestamps.withAnalysisCompleted(now),
                imageJobId,
                imageUrl,
                analysis,
                prompt,
                videoJobId,
                failedStage,
                error,
                pendingSubmission);
    }

    public ChainState videoSubmitted(String jobId, String prompt, Instant now) {
        return new ChainState(
                stage.transitionTo(ChainStage.GENERATING_VIDEO),
                timestamps.withVideoStarted(now),
                imageJobId,
                imageUrl,
                imageAnalysis,
                prompt,
                jobId,
                failedStage,
                error,
                null);
    }

    public ChainState completed(Instant now) {
        return new ChainState(
                stage.transitionTo(ChainStage.COMPLETED),
                timestamps.withVideoCompleted(now),
                imageJobId,
                imageUrl,
                imageAnalysis,
                videoPrompt,
                videoJobId,
                null,
                null,
                null);
    }

    /**
     * Moves the chain to error. A chain that has already failed keeps its original failed stage.
     */
    public ChainState failed(ChainStage stageAtFailure, String message) {
        return new ChainState(
                stage.transitionTo(ChainStage.ERROR),
                timestamps,
                imageJobId,
                imageUrl,
                imageAnalysis,
                videoPrompt,
                videoJobId,
                stage == ChainStage.ERROR && failedStage != null ? failedStage : stageAtFailure,
                message,
                null);
    }
}
