package github.sarthakdev143.ad_autopilot.controller;

import github.sarthakdev143.ad_autopilot.dto.ActivateAutopilotRequest;
import github.sarthakdev143.ad_autopilot.dto.AutopilotConfigRequest;
import github.sarthakdev143.ad_autopilot.dto.PoolSyncResponse;
import github.sarthakdev143.ad_autopilot.dto.StoreRequest;
import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotConfig;
import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotConfigDraft;
import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotStore;
import github.sarthakdev143.ad_autopilot.repository.StoreRepository;
import github.sarthakdev143.ad_autopilot.service.AutopilotScheduler;
import github.sarthakdev143.ad_autopilot.service.ProductRotationService;
import github.sarthakdev143.ad_autopilot.service.PublishStatusReconciler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.function.Supplier;

@RestController
@RequestMapping("/api/autopilot")
public class AutopilotController {

    private static final Logger logger = LoggerFactory.getLogger(AutopilotController.class);
    private static final int MAX_VIDEOS_PER_WEEK = 21;

    private final AutopilotScheduler autopilotScheduler;
    private final ProductRotationService rotationService;
    private final PublishStatusReconciler publishStatusReconciler;
    private final StoreRepository storeRepository;
    private final Clock clock;

    public AutopilotController(
            AutopilotScheduler autopilotScheduler,
            ProductRotationService rotationService,
            PublishStatusReconciler publishStatusReconciler,
            StoreRepository storeRepository,
            Clock clock) {
        this.autopilotScheduler = autopilotScheduler;
        this.rotationService = rotationService;
        this.publishStatusReconciler = publishStatusReconciler;
        this.storeRepository = storeRepository;
        this.clock = clock;
    }

    @PostMapping("/stores")
    public ResponseEntity<?> registerStore(@RequestBody StoreRequest request) {
        return handle("register store", () -> {
            if (request == null || request.name() == null || request.name().isBlank()) {
                throw new IllegalArgumentException("Store name is required.");
            }
            AutopilotStore store = storeRepository.save(new AutopilotStore(
                    UUID.randomUUID().toString(),
                    request.name().trim(),
                    request.logoUrl()));
            return ResponseEntity.status(HttpStatus.CREATED).body(store);
        });
    }

    @PostMapping("/configs")
    public ResponseEntity<?> createConfig(@RequestBody AutopilotConfigRequest request) {
        return handle("create autopilot config", () -> {
            if (request == null) {
                throw new IllegalArgumentException("Request body is required.");
            }
            if (request.storeId() == null || storeRepository.findById(request.storeId()).isEmpty()) {
                throw new IllegalArgumentException("Unknown store: " + request.storeId());
            }
            int videosPerWeek = request.videosPerWeek() == null ? 0 : request.videosPerWeek();
            if (videosPerWeek > MAX_VIDEOS_PER_WEEK) {
                throw new IllegalArgumentException("videosPerWeek must be at most " + MAX_VIDEOS_PER_WEEK + ".");
            }
            AutopilotConfig config = autopilotScheduler.createConfig(new AutopilotConfigDraft(
                    request.storeId(),
                    request.ownerId(),
                    request.tone(),
                    request.voiceId(),
                    videosPerWeek,
                    request.platforms()));
            return ResponseEntity.status(HttpStatus.CREATED).body(config);
        });
    }

    @GetMapping("/configs/{configId}")
    public ResponseEntity<?> getConfig(@PathVariable String configId) {
        return autopilotScheduler.findConfig(configId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body("Autopilot config not found: " + configId));
    }

    @PostMapping("/configs/{configId}/activate")
    public ResponseEntity<?> activate(
            @PathVariable String configId,
            @RequestBody(required = false) ActivateAutopilotRequest request) {
        return handle("activate autopilot", () -> {
            String assetId = request == null ? null : request.firstVideoAssetId();
            if (assetId == null || assetId.isBlank()) {
                throw new IllegalArgumentException("firstVideoAssetId is required.");
            }
            return ResponseEntity.ok(autopilotScheduler.activateAutopilot(configId, assetId.trim()));
        });
    }

    @PostMapping("/configs/{configId}/pause")
    public ResponseEntity<?> pause(@PathVariable String configId) {
        return handle("pause autopilot", () -> ResponseEntity.ok(autopilotScheduler.pauseAutopilot(configId)));
    }

    @PostMapping("/configs/{configId}/resume")
    public ResponseEntity<?> resume(@PathVariable String configId) {
        return handle("resume autopilot", () -> ResponseEntity.ok(autopilotScheduler.resumeAutopilot(configId)));
    }

    @GetMapping("/configs/{configId}/history")
    public ResponseEntity<?> history(@PathVariable String configId) {
        return handle("load generation history", () -> ResponseEntity.ok(autopilotScheduler.getHistory(configId)));
    }

    @GetMapping("/stores/{storeId}/pool")
    public ResponseEntity<?> poolStats(@PathVariable String storeId) {
        return ResponseEntity.ok(rotationService.getPoolStats(storeId));
    }

    @PostMapping("/stores/{storeId}/pool/sync")
    public ResponseEntity<?> syncPool(@PathVariable String storeId) {
        return handle("sync product pool", () -> {
            int deactivated = rotationService.syncProducts(storeId);
            return ResponseEntity.ok(new PoolSyncResponse(deactivated, rotationService.getPoolStats(storeId)));
        });
    }

    @PostMapping("/stores/{storeId}/pool/reset")
    public ResponseEntity<?> resetPool(@PathVariable String storeId) {
        return handle("reset product usage", () ->
                ResponseEntity.ok(Map.of("reset", rotationService.resetProductUsage(storeId))));
    }

    @PostMapping("/products/{productId}/active")
    public ResponseEntity<?> setProductActive(
            @PathVariable String productId,
            @RequestParam("active") boolean active) {
        return handle("toggle product", () -> ResponseEntity.ok(rotationService.setProductActive(productId, active)));
    }

    @PostMapping("/run")
    public ResponseEntity<?> runDue() {
        return handle("run due generations",
                () -> ResponseEntity.ok(autopilotScheduler.runDueGenerations(clock.instant())));
    }

    @PostMapping("/publish-jobs/reconcile")
    public ResponseEntity<?> reconcile() {
        return handle("reconcile publish jobs", () -> ResponseEntity.ok(publishStatusReconciler.reconcile()));
    }

    private ResponseEntity<?> handle(String action, Supplier<ResponseEntity<?>> call) {
        try {
            return call.get();
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (NoSuchElementException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to {}", action, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to " + action + ". Please try again.");
        }
    }
}
