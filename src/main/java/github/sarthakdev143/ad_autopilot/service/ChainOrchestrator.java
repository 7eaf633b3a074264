package github.sarthakdev143.ad_autopilot.service;

import github.sarthakdev143.ad_autopilot.model.GenerationJob;
import github.sarthakdev143.ad_autopilot.model.chain.ChainStage;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Drives a generation job through image generation, image analysis and video generation.
 * All chain state changes go through this interface.
 */
public interface ChainOrchestrator {

    /**
     * Submits the image stage of a freshly queued job.
     *
     * @throws github.sarthakdev143.ad_autopilot.exception.ChainStepException if the provider rejects the
     *         submission; the job is already in error when this is thrown
     */
    GenerationJob startImageGeneration(GenerationJob job);

    /**
     * @return {@code true} when the poll moved the chain forward
     */
    boolean checkImageStatus(String jobId);

    void analyzeImage(String jobId, String imageUrl);

    void startVideoGeneration(String jobId, String videoPrompt, String referenceImageUrl);

    boolean checkVideoStatus(String jobId);

    /**
     * Submits a queued job straight to the render provider, skipping the image and analysis stages.
     */
    GenerationJob startSingleStageVideo(GenerationJob job, String prompt, Map<String, Object> params);

    void handleChainError(String jobId, ChainStage stage, String message);

    /**
     * Fails jobs whose submission was never confirmed or whose provider stage outlived its timeout.
     *
     * @return number of jobs moved to error
     */
    int sweepStalledJobs(Instant now);

    Optional<GenerationJob> findJob(String jobId);
}
