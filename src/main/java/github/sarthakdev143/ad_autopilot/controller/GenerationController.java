package github.sarthakdev143.ad_autopilot.controller;

import github.sarthakdev143.ad_autopilot.dto.GenerationJobResponse;
import github.sarthakdev143.ad_autopilot.dto.GenerationRequest;
import github.sarthakdev143.ad_autopilot.dto.JobSubmissionResponse;
import github.sarthakdev143.ad_autopilot.exception.ChainStepException;
import github.sarthakdev143.ad_autopilot.model.GenerationJob;
import github.sarthakdev143.ad_autopilot.model.MediaKind;
import github.sarthakdev143.ad_autopilot.model.PromptVariables;
import github.sarthakdev143.ad_autopilot.service.ChainOrchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

@RestController
@RequestMapping("/api/generation")
public class GenerationController {

    private static final Logger logger = LoggerFactory.getLogger(GenerationController.class);
    private static final int MAX_PRODUCT_LENGTH = 200;
    private static final int MAX_TEXT_LENGTH = 2000;

    private final ChainOrchestrator chainOrchestrator;
    private final Clock clock;

    public GenerationController(ChainOrchestrator chainOrchestrator, Clock clock) {
        this.chainOrchestrator = chainOrchestrator;
        this.clock = clock;
    }

    @PostMapping
    public ResponseEntity<?> startChain(@RequestBody GenerationRequest request) {
        try {
            validate(request);
            PromptVariables variables = new PromptVariables(
                    request.product(),
                    request.features(),
                    request.icp(),
                    request.scene());
            GenerationJob queued = GenerationJob.queued(
                    UUID.randomUUID().toString(),
                    request.ownerId().trim(),
                    MediaKind.IMAGE,
                    variables,
                    normalizeReferenceUrl(request.productImageUrl()),
                    null,
                    clock.instant());

            GenerationJob started = chainOrchestrator.startImageGeneration(queued);
            return ResponseEntity.accepted()
                    .body(new JobSubmissionResponse(
                            started.id(),
                            started.status(),
                            started.chainState().stage().label(),
                            "Generation chain started. Poll /api/generation/{jobId} for progress."));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (ChainStepException e) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body("Image provider rejected the job " + e.getJobId() + ": " + e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to start generation chain", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to start generation. Please try again.");
        }
    }

    /**
     * Returns the job after giving the chain one chance to advance.
     */
    @GetMapping("/{jobId}")
    public ResponseEntity<?> getJob(@PathVariable String jobId) {
        if (chainOrchestrator.findJob(jobId).isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Job not found for id: " + jobId);
        }
        try {
            chainOrchestrator.checkImageStatus(jobId);
            chainOrchestrator.checkVideoStatus(jobId);
        } catch (RuntimeException e) {
            logger.warn("Status refresh failed for job {}: {}", jobId, e.getMessage());
        }
        Optional<GenerationJob> job = chainOrchestrator.findJob(jobId);
        return job.<ResponseEntity<?>>map(value -> ResponseEntity.ok(GenerationJobResponse.from(value)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("Job not found for id: " + jobId));
    }

    private void validate(GenerationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required.");
        }
        if (request.ownerId() == null || request.ownerId().isBlank()) {
            throw new IllegalArgumentException("Owner id is required.");
        }
        if (request.product() == null || request.product().isBlank()) {
            throw new IllegalArgumentException("Product is required.");
        }
        if (request.product().length() > MAX_PRODUCT_LENGTH) {
            throw new IllegalArgumentException("Product must be at most " + MAX_PRODUCT_LENGTH + " characters.");
        }
        if (request.icp() == null || request.icp().isBlank()) {
            throw new IllegalArgumentException("Target customer (icp) is required.");
        }
        checkLength("Features", request.features());
        checkLength("Target customer (icp)", request.icp());
        checkLength("Scene", request.scene());
    }

    private static void checkLength(String field, String value) {
        if (value != null && value.length() > MAX_TEXT_LENGTH) {
            throw new IllegalArgumentException(field + " must be at most " + MAX_TEXT_LENGTH + " characters.");
        }
    }

    private static String normalizeReferenceUrl(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String trimmed = input.trim();
        URI uri;
        try {
            uri = URI.create(trimmed);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Product image URL is not a valid URL.");
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new IllegalArgumentException("Product image URL must use http or https.");
        }
        return trimmed;
    }
}
