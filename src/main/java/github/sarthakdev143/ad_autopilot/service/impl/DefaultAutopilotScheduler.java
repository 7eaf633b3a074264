package github.sarthakdev143.ad_autopilot.service.impl;

import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotConfig;
import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotConfigDraft;
import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotCycleSummary;
import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotStore;
import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotVideoRequest;
import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotVideoResult;
import github.sarthakdev143.ad_autopilot.model.autopilot.GenerationHistoryRecord;
import github.sarthakdev143.ad_autopilot.model.autopilot.GenerationResult;
import github.sarthakdev143.ad_autopilot.model.autopilot.PoolStats;
import github.sarthakdev143.ad_autopilot.model.autopilot.RotationPoolEntry;
import github.sarthakdev143.ad_autopilot.repository.AutopilotConfigRepository;
import github.sarthakdev143.ad_autopilot.repository.GenerationHistoryRepository;
import github.sarthakdev143.ad_autopilot.repository.StoreRepository;
import github.sarthakdev143.ad_autopilot.service.AutopilotScheduler;
import github.sarthakdev143.ad_autopilot.service.AutopilotVideoService;
import github.sarthakdev143.ad_autopilot.service.ProductRotationService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.UnaryOperator;

@Service
public class DefaultAutopilotScheduler implements AutopilotScheduler {

    private static final Logger logger = LoggerFactory.getLogger(DefaultAutopilotScheduler.class);
    private static final Duration WEEK = Duration.ofDays(7);

    private final AutopilotConfigRepository configRepository;
    private final StoreRepository storeRepository;
    private final GenerationHistoryRepository historyRepository;
    private final ProductRotationService rotationService;
    private final AutopilotVideoService videoService;
    private final Clock clock;
    private final InFlightGuard inFlightGuard = new InFlightGuard();
    private final Counter generationSuccessCounter;
    private final Counter generationFailureCounter;
    private final Counter productDeactivatedCounter;
    private final Counter overlappingTriggerCounter;

    public DefaultAutopilotScheduler(
            AutopilotConfigRepository configRepository,
            StoreRepository storeRepository,
            GenerationHistoryRepository historyRepository,
            ProductRotationService rotationService,
            AutopilotVideoService videoService,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.configRepository = configRepository;
        this.storeRepository = storeRepository;
        this.historyRepository = historyRepository;
        this.rotationService = rotationService;
        this.videoService = videoService;
        this.clock = clock;
        this.generationSuccessCounter = meterRegistry.counter("ad_autopilot.generations", "outcome", "started");
        this.generationFailureCounter = meterRegistry.counter("ad_autopilot.generations", "outcome", "failed");
        this.productDeactivatedCounter = meterRegistry.counter("ad_autopilot.pool.deactivated");
        this.overlappingTriggerCounter = meterRegistry.counter("ad_autopilot.generations", "outcome", "skipped");
    }

    @Override
    public AutopilotConfig createConfig(AutopilotConfigDraft draft) {
        if (draft.storeId() == null || draft.storeId().isBlank()) {
            throw new IllegalArgumentException("storeId is required.");
        }
        if (draft.videosPerWeek() <= 0) {
            throw new IllegalArgumentException("videosPerWeek must be greater than 0.");
        }

        Set<String> platforms = new LinkedHashSet<>();
        for (String platform : draft.platforms()) {
            if (platform != null && !platform.isBlank()) {
                platforms.add(platform.trim().toLowerCase(Locale.ROOT));
            }
        }

        AutopilotConfig config = configRepository.save(new AutopilotConfig(
                UUID.randomUUID().toString(),
                draft.storeId(),
                draft.ownerId(),
                draft.tone(),
                draft.voiceId(),
                draft.videosPerWeek(),
                List.copyOf(platforms),
                false,
                false,
                null,
                null,
                null,
                0,
                0,
                clock.instant()));
        logger.info("Created autopilot config {} for store {} videosPerWeek={} platforms={}",
                config.id(), config.storeId(), config.videosPerWeek(), config.platforms());
        return config;
    }

    @Override
    public Optional<AutopilotConfig> findConfig(String configId) {
        return configRepository.findById(configId);
    }

    @Override
    public List<AutopilotConfig> getDueConfigs(Instant now) {
        return configRepository.findAll()
                .stream()
                .filter(config -> config.isDue(now))
                .toList();
    }

    @Override
    public Instant calculateNextScheduled(int videosPerWeek, Instant from) {
        if (videosPerWeek <= 0) {
            throw new IllegalArgumentException("videosPerWeek must be greater than 0.");
        }
        Duration interval = Duration.ofMillis(WEEK.toMillis() / videosPerWeek);
        Instant next = from.plus(interval).truncatedTo(ChronoUnit.HOURS);
        if (!next.isAfter(from)) {
            next = next.plus(1, ChronoUnit.HOURS);
        }
        return next;
    }

    @Override
    public GenerationResult executeGeneration(AutopilotConfig config) {
        Instant attemptStartedAt = clock.instant();
        try {
            return generate(config, attemptStartedAt);
        } catch (RuntimeException e) {
            logger.error("Autopilot generation for config {} failed unexpectedly", config.id(), e);
            generationFailureCounter.increment();
            try {
                advanceSchedule(config.id(), attemptStartedAt, false);
            } catch (NoSuchElementException missing) {
                logger.warn("Autopilot config {} no longer exists, schedule not advanced", config.id());
            } catch (RuntimeException scheduleError) {
                logger.error("Could not advance schedule for autopilot config {}", config.id(), scheduleError);
            }
            return GenerationResult.failed(null, "Unexpected error: " + e.getMessage());
        }
    }

    private GenerationResult generate(AutopilotConfig config, Instant attemptStartedAt) {
        Optional<AutopilotStore> store = storeRepository.findById(config.storeId());
        if (store.isEmpty()) {
            return reject(config, attemptStartedAt, null, "Store not found");
        }

        Optional<RotationPoolEntry> next = rotationService.getNextProduct(config.storeId());
        if (next.isEmpty()) {
            return reject(config, attemptStartedAt, null, "No active products available");
        }

        RotationPoolEntry product = next.get();
        if (!product.hasEnoughImages()) {
            rotationService.setProductActive(product.id(), false);
            productDeactivatedCounter.increment();
            GenerationHistoryRecord rejected = historyRepository.save(GenerationHistoryRecord.failed(
                    UUID.randomUUID().toString(),
                    config.id(),
                    product.id(),
                    "Product has insufficient images",
                    attemptStartedAt));
            logger.warn("Deactivated product {} in store {}: only {} image(s)",
                    product.id(), config.storeId(), product.images().size());
            return reject(config, attemptStartedAt, rejected.id(), "Product has insufficient images");
        }

        GenerationHistoryRecord history = historyRepository.save(GenerationHistoryRecord.pending(
                UUID.randomUUID().toString(),
                config.id(),
                product.id(),
                attemptStartedAt));

        AutopilotVideoResult video;
        try {
            video = videoService.generateAutopilotVideo(new AutopilotVideoRequest(
                    config.ownerId(),
                    product.title(),
                    product.description(),
                    product.images(),
                    product.price(),
                    null,
                    store.get().name(),
                    store.get().logoUrl(),
                    config.voiceId()));
        } catch (RuntimeException e) {
            logger.error("Video planning failed for config {} product {}", config.id(), product.id(), e);
            video = AutopilotVideoResult.failed(e.getMessage(), List.of());
        }

        if (!video.success()) {
            historyRepository.save(history.asFailed(video.error(), clock.instant()));
            return reject(config, attemptStartedAt, history.id(), video.error());
        }

        historyRepository.save(history.generating(video.assetId()));
        rotationService.markProductUsed(product.id());
        incrementStats(config.id(), config.storeId());
        advanceSchedule(config.id(), attemptStartedAt, true);
        generationSuccessCounter.increment();
        logger.info("Autopilot config {} started asset {} for product {} warnings={}",
                config.id(), video.assetId(), product.id(), video.warnings().size());
        return GenerationResult.succeeded(history.id(), video.assetId());
    }

    private GenerationResult reject(AutopilotConfig config, Instant attemptStartedAt, String historyId, String error) {
        advanceSchedule(config.id(), attemptStartedAt, false);
        generationFailureCounter.increment();
        logger.warn("Autopilot generation for config {} failed: {}", config.id(), error);
        return GenerationResult.failed(historyId, error);
    }

    @Override
    public AutopilotConfig incrementStats(String configId, String storeId) {
        PoolStats stats = rotationService.getPoolStats(storeId);
        return updateConfig(configId, current -> {
            int cycles = current.poolCycles();
            if (stats.isPassComplete()) {
                cycles++;
                logger.info("Autopilot config {} completed rotation cycle {}", configId, cycles);
            }
            return current.withStats(current.videosGenerated() + 1, cycles, clock.instant());
        });
    }

    @Override
    public AutopilotCycleSummary runDueGenerations(Instant now) {
        List<AutopilotConfig> due = getDueConfigs(now);
        int succeeded = 0;
        int failed = 0;
        int skipped = 0;

        for (AutopilotConfig config : due) {
            if (!inFlightGuard.tryAcquire(config.id())) {
                overlappingTriggerCounter.increment();
                logger.info("Skipping autopilot config {}: a generation is already running", config.id());
                skipped++;
                continue;
            }
            try {
                if (executeGeneration(config).success()) {
                    succeeded++;
                } else {
                    failed++;
                }
            } catch (RuntimeException e) {
                failed++;
                logger.error("Autopilot generation for config {} aborted", config.id(), e);
            } finally {
                inFlightGuard.release(config.id());
            }
        }

        if (!due.isEmpty()) {
            logger.info("Autopilot cycle finished due={} succeeded={} failed={} skipped={}",
                    due.size(), succeeded, failed, skipped);
        }
        return new AutopilotCycleSummary(due.size(), succeeded, failed, skipped);
    }

    @Override
    public AutopilotConfig activateAutopilot(String configId, String firstVideoAssetId) {
        Instant now = clock.instant();
        AutopilotConfig activated = updateConfig(configId, current -> current.activated(
                firstVideoAssetId,
                calculateNextScheduled(current.videosPerWeek(), now),
                now));
        logger.info("Activated autopilot config {} nextScheduledAt={}", configId, activated.nextScheduledAt());
        return activated;
    }

    @Override
    public AutopilotConfig pauseAutopilot(String configId) {
        AutopilotConfig paused = updateConfig(configId, current -> current.withActive(
                false,
                current.nextScheduledAt(),
                clock.instant()));
        logger.info("Paused autopilot config {}", configId);
        return paused;
    }

    @Override
    public AutopilotConfig resumeAutopilot(String configId) {
        Instant now = clock.instant();
        AutopilotConfig resumed = updateConfig(configId, current -> {
            if (!current.approved()) {
                throw new IllegalArgumentException("Autopilot config " + configId + " has not been approved yet.");
            }
            return current.withActive(true, calculateNextScheduled(current.videosPerWeek(), now), now);
        });
        logger.info("Resumed autopilot config {} nextScheduledAt={}", configId, resumed.nextScheduledAt());
        return resumed;
    }

    @Override
    public List<GenerationHistoryRecord> getHistory(String configId) {
        requireConfig(configId);
        return new ArrayList<>(historyRepository.findByConfigId(configId));
    }

    private void advanceSchedule(String configId, Instant attemptStartedAt, boolean generated) {
        updateConfig(configId, current -> current.rescheduled(
                calculateNextScheduled(current.videosPerWeek(), attemptStartedAt),
                generated ? attemptStartedAt : null,
                clock.instant()));
    }

    private AutopilotConfig updateConfig(String configId, UnaryOperator<AutopilotConfig> update) {
        return configRepository.save(update.apply(requireConfig(configId)));
    }

    private AutopilotConfig requireConfig(String configId) {
        return configRepository.findById(configId)
                .orElseThrow(() -> new NoSuchElementException("Autopilot config not found: " + configId));
    }
}
