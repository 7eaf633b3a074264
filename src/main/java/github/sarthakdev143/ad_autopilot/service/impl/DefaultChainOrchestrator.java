package github.sarthakdev143.ad_autopilot.service.impl;

import github.sarthakdev143.ad_autopilot.config.AdAutopilotProperties;
import github.sarthakdev143.ad_autopilot.exception.ChainStepException;
import github.sarthakdev143.ad_autopilot.exception.ProviderException;
import github.sarthakdev143.ad_autopilot.model.AssetStatus;
import github.sarthakdev143.ad_autopilot.model.GenerationJob;
import github.sarthakdev143.ad_autopilot.model.MediaKind;
import github.sarthakdev143.ad_autopilot.model.ProviderJobState;
import github.sarthakdev143.ad_autopilot.model.ProviderJobStatus;
import github.sarthakdev143.ad_autopilot.model.chain.ChainStage;
import github.sarthakdev143.ad_autopilot.model.chain.ChainState;
import github.sarthakdev143.ad_autopilot.model.chain.SubmissionIntent;
import github.sarthakdev143.ad_autopilot.repository.GenerationJobRepository;
import github.sarthakdev143.ad_autopilot.service.ChainOrchestrator;
import github.sarthakdev143.ad_autopilot.service.ExternalJobClient;
import github.sarthakdev143.ad_autopilot.service.GenerationProviders;
import github.sarthakdev143.ad_autopilot.service.VisionAnalyzer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class DefaultChainOrchestrator implements ChainOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(DefaultChainOrchestrator.class);

    private final GenerationJobRepository jobRepository;
    private final GenerationProviders providers;
    private final VisionAnalyzer visionAnalyzer;
    private final UgcPromptBuilder promptBuilder;
    private final Clock clock;
    private final Duration submissionTimeout;
    private final Duration stageTimeout;
    private final String imageAspectRatio;
    private final String videoAspectRatio;
    private final InFlightGuard jobGuard = new InFlightGuard();
    private final Counter chainCompletedCounter;
    private final Counter chainFailedCounter;
    private final Counter pollTransportFailureCounter;
    private final Counter stalledJobCounter;

    public DefaultChainOrchestrator(
            GenerationJobRepository jobRepository,
            GenerationProviders providers,
            VisionAnalyzer visionAnalyzer,
            UgcPromptBuilder promptBuilder,
            AdAutopilotProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.jobRepository = jobRepository;
        this.providers = providers;
        this.visionAnalyzer = visionAnalyzer;
        this.promptBuilder = promptBuilder;
        this.clock = clock;
        this.submissionTimeout = properties.getChain().getSubmissionTimeout();
        this.stageTimeout = properties.getChain().getStageTimeout();
        this.imageAspectRatio = properties.getChain().getImageAspectRatio();
        this.videoAspectRatio = properties.getChain().getVideoAspectRatio();
        this.chainCompletedCounter = meterRegistry.counter("ad_autopilot.chain.completed");
        this.chainFailedCounter = meterRegistry.counter("ad_autopilot.chain.failures");
        this.pollTransportFailureCounter = meterRegistry.counter("ad_autopilot.provider.failures", "phase", "poll");
        this.stalledJobCounter = meterRegistry.counter("ad_autopilot.chain.stalled");
    }

    @Override
    public GenerationJob startImageGeneration(GenerationJob job) {
        ExternalJobClient imageClient = providers.image();
        String prompt = promptBuilder.imagePrompt(job.promptVariables());
        Instant now = clock.instant();

        GenerationJob pending = jobRepository.save(job.withProviderJob(
                imageClient.providerName(),
                MediaKind.IMAGE,
                null,
                job.chainState().withPendingSubmission(ChainStage.GENERATING_IMAGE, now),
                now));

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("aspectRatio", imageAspectRatio);
        if (job.referenceImageUrl() != null) {
            params.put("referenceImageUrl", job.referenceImageUrl());
        }

        String externalJobId;
        try {
            externalJobId = imageClient.submit(prompt, params);
        } catch (RuntimeException e) {
            logger.error("Image submission failed for job {}", job.id(), e);
            handleChainError(job.id(), ChainStage.GENERATING_IMAGE, e.getMessage());
            throw new ChainStepException(job.id(), ChainStage.GENERATING_IMAGE, e.getMessage(), e);
        }

        Instant submittedAt = clock.instant();
        GenerationJob submitted = jobRepository.save(pending.withProviderJob(
                imageClient.providerName(),
                MediaKind.IMAGE,
                externalJobId,
                pending.chainState().imageSubmitted(externalJobId, submittedAt),
                submittedAt));
        logger.info("Started image stage for job {} provider={} externalJobId={}",
                job.id(), imageClient.providerName(), externalJobId);
        return submitted;
    }

    @Override
    public boolean checkImageStatus(String jobId) {
        if (!jobGuard.tryAcquire(jobId)) {
            logger.debug("Job {} is already being advanced, skipping image check", jobId);
            return false;
        }
        try {
            return advanceImageStage(jobId);
        } finally {
            jobGuard.release(jobId);
        }
    }

    private boolean advanceImageStage(String jobId) {
        GenerationJob job = requireJob(jobId);
        if (job.chainState().stage() != ChainStage.GENERATING_IMAGE) {
            return false;
        }
        if (job.externalJobId() == null) {
            handleChainError(jobId, ChainStage.GENERATING_IMAGE, "Image submission was never confirmed by the provider");
            return true;
        }

        Optional<ProviderJobStatus> polled = poll(providers.image(), job);
        if (polled.isEmpty()) {
            return false;
        }

        ProviderJobStatus status = polled.get();
        if (status.state() == ProviderJobState.FAILED) {
            handleChainError(jobId, ChainStage.GENERATING_IMAGE,
                    status.error() != null ? status.error() : "Image generation failed");
            return true;
        }
        if (status.state() == ProviderJobState.READY && status.firstResultUrl() != null) {
            return analyzeAndContinue(jobId, status.firstResultUrl());
        }
        return false;
    }

    @Override
    public void analyzeImage(String jobId, String imageUrl) {
        if (!jobGuard.tryAcquire(jobId)) {
            logger.info("Job {} is already being advanced, analysis not started", jobId);
            return;
        }
        try {
            analyzeAndContinue(jobId, imageUrl);
        } finally {
            jobGuard.release(jobId);
        }
    }

    private boolean analyzeAndContinue(String jobId, String imageUrl) {
        GenerationJob job = requireJob(jobId);
        if (job.chainState().stage() != ChainStage.GENERATING_IMAGE) {
            logger.info("Job {} already left {} (now {}), analysis not repeated",
                    jobId, ChainStage.GENERATING_IMAGE.label(), job.chainState().stage().label());
            return false;
        }
        GenerationJob analyzing = jobRepository.save(job.withChainState(
                job.chainState().imageReady(imageUrl, clock.instant()),
                clock.instant()));
        logger.info("Image ready for job {}, analyzing {}", jobId, imageUrl);

        String videoPrompt;
        try {
            String analysis = visionAnalyzer.analyze(imageUrl, promptBuilder.analysisInstructions());
            if (analysis == null || analysis.isBlank()) {
                throw new ProviderException("vision", "Image analysis returned no description");
            }
            videoPrompt = promptBuilder.chainedVideoPrompt(analyzing.promptVariables(), analysis);
            GenerationJob current = requireJob(jobId);
            if (current.chainState().stage() != ChainStage.ANALYZING_IMAGE) {
                logger.warn("Job {} moved to {} during analysis, video not submitted",
                        jobId, current.chainState().stage().label());
                return true;
            }
            Instant now = clock.instant();
            jobRepository.save(current.withChainState(
                    current.chainState().analysisCompleted(analysis, videoPrompt, now),
                    now));
        } catch (RuntimeException e) {
            logger.error("Image analysis failed for job {}", jobId, e);
            handleChainError(jobId, ChainStage.ANALYZING_IMAGE, e.getMessage());
            return true;
        }

        submitChainedVideo(jobId, videoPrompt, imageUrl);
        return true;
    }

    @Override
    public void startVideoGeneration(String jobId, String videoPrompt, String referenceImageUrl) {
        if (!jobGuard.tryAcquire(jobId)) {
            logger.info("Job {} is already being advanced, video not submitted", jobId);
            return;
        }
        try {
            submitChainedVideo(jobId, videoPrompt, referenceImageUrl);
        } finally {
            jobGuard.release(jobId);
        }
    }

    private void submitChainedVideo(String jobId, String videoPrompt, String referenceImageUrl) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("aspectRatio", videoAspectRatio);
        params.put("imageUrls", List.of(referenceImageUrl));
        submitVideo(requireJob(jobId), providers.video(), videoPrompt, params);
    }

    @Override
    public GenerationJob startSingleStageVideo(GenerationJob job, String prompt, Map<String, Object> params) {
        jobRepository.save(job);
        GenerationJob result = submitVideo(job, providers.render(), prompt, params);
        if (result.status() == AssetStatus.ERROR) {
            throw new ChainStepException(job.id(), ChainStage.GENERATING_VIDEO, result.errorMessage(), null);
        }
        return result;
    }

    private GenerationJob submitVideo(
            GenerationJob job,
            ExternalJobClient client,
            String prompt,
            Map<String, Object> params) {
        Instant now = clock.instant();
        GenerationJob pending = jobRepository.save(job.withChainState(
                job.chainState().withPendingSubmission(ChainStage.GENERATING_VIDEO, now),
                now));

        String externalJobId;
        try {
            externalJobId = client.submit(prompt, params);
        } catch (RuntimeException e) {
            logger.error("Video submission to {} failed for job {}", client.providerName(), job.id(), e);
            handleChainError(job.id(), ChainStage.GENERATING_VIDEO, e.getMessage());
            return requireJob(job.id());
        }

        Instant submittedAt = clock.instant();
        GenerationJob submitted = jobRepository.save(pending.withProviderJob(
                client.providerName(),
                MediaKind.VIDEO,
                externalJobId,
                pending.chainState().videoSubmitted(externalJobId, prompt, submittedAt),
                submittedAt));
        logger.info("Started video stage for job {} provider={} externalJobId={}",
                job.id(), client.providerName(), externalJobId);
        return submitted;
    }

    @Override
    public boolean checkVideoStatus(String jobId) {
        if (!jobGuard.tryAcquire(jobId)) {
            logger.debug("Job {} is already being advanced, skipping video check", jobId);
            return false;
        }
        try {
            return advanceVideoStage(jobId);
        } finally {
            jobGuard.release(jobId);
        }
    }

    private boolean advanceVideoStage(String jobId) {
        GenerationJob job = requireJob(jobId);
        if (job.chainState().stage() != ChainStage.GENERATING_VIDEO) {
            return false;
        }
        if (job.externalJobId() == null) {
            handleChainError(jobId, ChainStage.GENERATING_VIDEO, "Video submission was never confirmed by the provider");
            return true;
        }

        Optional<ProviderJobStatus> polled = poll(providers.videoClientFor(job.provider()), job);
        if (polled.isEmpty()) {
            return false;
        }

        ProviderJobStatus status = polled.get();
        if (status.state() == ProviderJobState.FAILED) {
            handleChainError(jobId, ChainStage.GENERATING_VIDEO,
                    status.error() != null ? status.error() : "Video generation failed");
            return true;
        }
        if (status.state() == ProviderJobState.READY && status.firstResultUrl() != null) {
            GenerationJob current = requireJob(jobId);
            if (current.chainState().stage() != ChainStage.GENERATING_VIDEO
                    || !job.externalJobId().equals(current.externalJobId())) {
                logger.warn("Job {} changed while polling (now {}), result ignored",
                        jobId, current.chainState().stage().label());
                return false;
            }
            Instant now = clock.instant();
            ChainState completed = current.chainState().completed(now);
            jobRepository.save(current.asCompleted(status.resultUrls(), completed, now));
            chainCompletedCounter.increment();
            logger.info("Chain completed for job {} in {} resultUrl={}",
                    jobId, completed.timestamps().formattedDuration(), status.firstResultUrl());
            return true;
        }
        return false;
    }

    @Override
    public void handleChainError(String jobId, ChainStage stage, String message) {
        Optional<GenerationJob> existing = jobRepository.findById(jobId);
        if (existing.isEmpty()) {
            logger.warn("Ignoring chain error for unknown job {} at {}: {}", jobId, stage.label(), message);
            return;
        }

        GenerationJob job = existing.get();
        String detail = message == null || message.isBlank() ? "Unknown error" : message;
        ChainState failed = job.chainState().failed(stage, detail);
        String errorMessage = "Chain failed at " + failed.failedStage().label() + ": " + detail;
        jobRepository.save(job.asFailed(errorMessage, failed, clock.instant()));
        chainFailedCounter.increment();
        logger.warn("Chain failed for job {} at {}: {}", jobId, stage.label(), detail);
    }

    @Override
    public int sweepStalledJobs(Instant now) {
        int swept = 0;
        for (GenerationJob job : jobRepository.findByStatus(AssetStatus.PROCESSING)) {
            ChainState state = job.chainState();
            if (state.stage().isTerminal() || !jobGuard.tryAcquire(job.id())) {
                continue;
            }
            try {
                if (sweepIfStalled(job.id(), now)) {
                    swept++;
                }
            } finally {
                jobGuard.release(job.id());
            }
        }

        if (swept > 0) {
            stalledJobCounter.increment(swept);
            logger.warn("Moved {} stalled generation job(s) to error", swept);
        }
        return swept;
    }

    private boolean sweepIfStalled(String jobId, Instant now) {
        GenerationJob job = requireJob(jobId);
        ChainState state = job.chainState();
        if (state.stage().isTerminal()) {
            return false;
        }

        SubmissionIntent intent = state.pendingSubmission();
        if (intent != null) {
            if (intent.recordedAt().plus(submissionTimeout).isBefore(now)) {
                handleChainError(jobId, intent.targetStage(), "Provider submission was never confirmed");
                return true;
            }
            return false;
        }

        Instant stageStartedAt = stageStartedAt(job);
        Duration allowed = state.stage().isAwaitingProvider() ? stageTimeout : submissionTimeout;
        if (stageStartedAt != null && stageStartedAt.plus(allowed).isBefore(now)) {
            handleChainError(jobId, state.stage(), "No progress within " + allowed.toMinutes() + " minutes");
            return true;
        }
        return false;
    }

    @Override
    public Optional<GenerationJob> findJob(String jobId) {
        return jobRepository.findById(jobId);
    }

    private Instant stageStartedAt(GenerationJob job) {
        ChainState state = job.chainState();
        return switch (state.stage()) {
            case QUEUED -> job.createdAt();
            case GENERATING_IMAGE -> state.timestamps().imageStartedAt();
            case ANALYZING_IMAGE -> state.timestamps().imageCompletedAt();
            case GENERATING_VIDEO -> state.timestamps().videoStartedAt();
            case COMPLETED, ERROR -> null;
        };
    }

    private Optional<ProviderJobStatus> poll(ExternalJobClient client, GenerationJob job) {
        try {
            return Optional.ofNullable(client.poll(job.externalJobId()));
        } catch (RuntimeException e) {
            pollTransportFailureCounter.increment();
            logger.warn("Polling {} for job {} failed, will retry on the next tick: {}",
                    client.providerName(), job.id(), e.getMessage());
            return Optional.empty();
        }
    }

    private GenerationJob requireJob(String jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Generation job not found: " + jobId));
    }
}
