package github.sarthakdev143.ad_autopilot.service.impl;

import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotConfig;
import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotConfigDraft;
import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotCycleSummary;
import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotStore;
import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotVideoRequest;
import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotVideoResult;
import github.sarthakdev143.ad_autopilot.model.autopilot.GenerationHistoryRecord;
import github.sarthakdev143.ad_autopilot.model.autopilot.GenerationResult;
import github.sarthakdev143.ad_autopilot.model.autopilot.HistoryStatus;
import github.sarthakdev143.ad_autopilot.model.autopilot.RotationPoolEntry;
import github.sarthakdev143.ad_autopilot.repository.memory.InMemoryAutopilotConfigRepository;
import github.sarthakdev143.ad_autopilot.repository.memory.InMemoryGenerationHistoryRepository;
import github.sarthakdev143.ad_autopilot.repository.memory.InMemoryRotationPoolRepository;
import github.sarthakdev143.ad_autopilot.repository.memory.InMemoryStoreRepository;
import github.sarthakdev143.ad_autopilot.service.AutopilotVideoService;
import github.sarthakdev143.ad_autopilot.service.ProductSource;
import github.sarthakdev143.ad_autopilot.testsupport.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultAutopilotSchedulerTest {

    private static final String STORE = "store-1";
    private static final Instant MONDAY_0917 = Instant.parse("2026-03-02T09:17:00Z");

    @Mock
    private AutopilotVideoService videoService;

    @Mock
    private ProductSource productSource;

    private final MutableClock clock = new MutableClock(MONDAY_0917);
    private final InMemoryAutopilotConfigRepository configRepository = new InMemoryAutopilotConfigRepository();
    private final InMemoryStoreRepository storeRepository = new InMemoryStoreRepository();
    private final InMemoryGenerationHistoryRepository historyRepository = new InMemoryGenerationHistoryRepository();
    private final InMemoryRotationPoolRepository poolRepository = new InMemoryRotationPoolRepository();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private DefaultAutopilotScheduler scheduler;
    private int productSequence;

    @BeforeEach
    void setUp() {
        scheduler = new DefaultAutopilotScheduler(
                configRepository,
                storeRepository,
                historyRepository,
                new DefaultProductRotationService(poolRepository, productSource, clock),
                videoService,
                clock,
                meterRegistry);
        storeRepository.save(new AutopilotStore(STORE, "Lumen Goods", "https://cdn.example/logo.png"));
    }

    @Test
    void nextRunIsOnTheHourAndStrictlyInTheFuture() {
        assertThat(scheduler.calculateNextScheduled(7, MONDAY_0917)).isEqualTo(Instant.parse("2026-03-03T09:00:00Z"));
        assertThat(scheduler.calculateNextScheduled(1, MONDAY_0917)).isEqualTo(Instant.parse("2026-03-09T09:00:00Z"));
        assertThat(scheduler.calculateNextScheduled(168, MONDAY_0917)).isEqualTo(Instant.parse("2026-03-02T10:00:00Z"));
        assertThat(scheduler.calculateNextScheduled(1000, MONDAY_0917)).isEqualTo(Instant.parse("2026-03-02T10:00:00Z"));
        assertThatThrownBy(() -> scheduler.calculateNextScheduled(0, MONDAY_0917))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void createConfigStartsInactiveWithNormalizedPlatforms() {
        AutopilotConfig config = scheduler.createConfig(new AutopilotConfigDraft(
                STORE, "owner-1", "playful", "voice-1", 3, List.of("YouTube", " youtube ", "TikTok", "")));

        assertThat(config.active()).isFalse();
        assertThat(config.approved()).isFalse();
        assertThat(config.nextScheduledAt()).isNull();
        assertThat(config.platforms()).containsExactly("youtube", "tiktok");
        assertThat(scheduler.getDueConfigs(MONDAY_0917.plus(Duration.ofDays(30)))).isEmpty();

        assertThatThrownBy(() -> scheduler.createConfig(new AutopilotConfigDraft(STORE, "o", null, null, 0, null)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void successfulRunMarksProductUsedAndAdvancesSchedule() {
        addProduct("p1", 3);
        AutopilotConfig config = activeConfig(7);
        when(videoService.generateAutopilotVideo(any(AutopilotVideoRequest.class)))
                .thenReturn(AutopilotVideoResult.started("asset-1", List.of()));

        GenerationResult result = scheduler.executeGeneration(config);

        assertThat(result.success()).isTrue();
        assertThat(result.assetId()).isEqualTo("asset-1");

        GenerationHistoryRecord history = historyRepository.findById(result.historyId()).orElseThrow();
        assertThat(history.status()).isEqualTo(HistoryStatus.GENERATING);
        assertThat(history.mediaAssetId()).isEqualTo("asset-1");
        assertThat(history.productId()).isEqualTo("p1");
        assertThat(poolRepository.findById("p1").orElseThrow().useCount()).isEqualTo(1);

        AutopilotConfig updated = configRepository.findById(config.id()).orElseThrow();
        assertThat(updated.videosGenerated()).isEqualTo(2);
        assertThat(updated.lastGeneratedAt()).isEqualTo(MONDAY_0917);
        assertThat(updated.nextScheduledAt()).isEqualTo(Instant.parse("2026-03-03T09:00:00Z"));

        ArgumentCaptor<AutopilotVideoRequest> requestCaptor = ArgumentCaptor.forClass(AutopilotVideoRequest.class);
        verify(videoService).generateAutopilotVideo(requestCaptor.capture());
        assertThat(requestCaptor.getValue().storeName()).isEqualTo("Lumen Goods");
        assertThat(requestCaptor.getValue().productImages()).hasSize(3);
        assertThat(requestCaptor.getValue().voiceId()).isEqualTo("voice-1");
    }

    @Test
    void failedVideoStillAdvancesScheduleButLeavesProductUnused() {
        addProduct("p1", 3);
        AutopilotConfig config = activeConfig(7);
        when(videoService.generateAutopilotVideo(any(AutopilotVideoRequest.class)))
                .thenReturn(AutopilotVideoResult.failed("Render provider rejected the job", List.of()));

        GenerationResult result = scheduler.executeGeneration(config);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Render provider rejected the job");

        GenerationHistoryRecord history = historyRepository.findById(result.historyId()).orElseThrow();
        assertThat(history.status()).isEqualTo(HistoryStatus.FAILED);
        assertThat(history.errorMessage()).isEqualTo("Render provider rejected the job");
        assertThat(history.completedAt()).isEqualTo(MONDAY_0917);

        RotationPoolEntry product = poolRepository.findById("p1").orElseThrow();
        assertThat(product.useCount()).isZero();
        assertThat(product.lastUsedAt()).isNull();

        AutopilotConfig updated = configRepository.findById(config.id()).orElseThrow();
        assertThat(updated.nextScheduledAt()).isEqualTo(Instant.parse("2026-03-03T09:00:00Z"));
        assertThat(updated.lastGeneratedAt()).isNull();
        assertThat(updated.videosGenerated()).isEqualTo(1);
        assertThat(meterRegistry.counter("ad_autopilot.generations", "outcome", "failed").count()).isEqualTo(1.0);
    }

    @Test
    void exceptionFromVideoServiceIsReportedAsFailure() {
        addProduct("p1", 2);
        AutopilotConfig config = activeConfig(7);
        when(videoService.generateAutopilotVideo(any(AutopilotVideoRequest.class)))
                .thenThrow(new IllegalStateException("narration backend offline"));

        GenerationResult result = scheduler.executeGeneration(config);

        assertThat(result.success()).isFalse();
        assertThat(historyRepository.findById(result.historyId()).orElseThrow().status()).isEqualTo(HistoryStatus.FAILED);
        assertThat(configRepository.findById(config.id()).orElseThrow().nextScheduledAt())
                .isEqualTo(Instant.parse("2026-03-03T09:00:00Z"));
    }

    @Test
    void productWithTooFewImagesIsDeactivatedAndRecorded() {
        addProduct("p1", 1);
        AutopilotConfig config = activeConfig(7);

        GenerationResult result = scheduler.executeGeneration(config);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Product has insufficient images");
        assertThat(poolRepository.findById("p1").orElseThrow().active()).isFalse();
        GenerationHistoryRecord history = historyRepository.findById(result.historyId()).orElseThrow();
        assertThat(history.status()).isEqualTo(HistoryStatus.FAILED);
        assertThat(history.productId()).isEqualTo("p1");
        assertThat(meterRegistry.counter("ad_autopilot.pool.deactivated").count()).isEqualTo(1.0);
        verifyNoInteractions(videoService);
    }

    @Test
    void emptyPoolAndMissingStoreAreReportedWithoutHistory() {
        AutopilotConfig config = activeConfig(7);

        GenerationResult noProducts = scheduler.executeGeneration(config);
        assertThat(noProducts.error()).isEqualTo("No active products available");
        assertThat(noProducts.historyId()).isNull();

        AutopilotConfig orphan = scheduler.createConfig(new AutopilotConfigDraft(
                "gone", "owner-1", null, null, 7, List.of()));
        GenerationResult noStore = scheduler.executeGeneration(orphan);
        assertThat(noStore.error()).isEqualTo("Store not found");
        assertThat(configRepository.findById(orphan.id()).orElseThrow().nextScheduledAt())
                .isEqualTo(Instant.parse("2026-03-03T09:00:00Z"));
        assertThat(historyRepository.findByConfigId(config.id())).isEmpty();
        verifyNoInteractions(videoService);
    }

    @Test
    void poolCycleCountsOnlyWhenEveryActiveProductHasCaughtUp() {
        addProduct("p1", 2);
        addProduct("p2", 2);
        AutopilotConfig config = activeConfig(7);
        when(videoService.generateAutopilotVideo(any(AutopilotVideoRequest.class)))
                .thenReturn(AutopilotVideoResult.started("asset", List.of()));

        List<Integer> cycles = new ArrayList<>();
        for (int run = 0; run < 4; run++) {
            AutopilotConfig current = configRepository.findById(config.id()).orElseThrow();
            clock.set(current.nextScheduledAt());
            scheduler.runDueGenerations(clock.instant());
            cycles.add(configRepository.findById(config.id()).orElseThrow().poolCycles());
        }

        assertThat(cycles).containsExactly(0, 1, 1, 2);
        assertThat(configRepository.findById(config.id()).orElseThrow().videosGenerated()).isEqualTo(5);
    }

    @Test
    void poolCyclesKeepCountingAfterUsageReset() {
        addProduct("p1", 2);
        addProduct("p2", 2);
        AutopilotConfig config = activeConfig(7);
        when(videoService.generateAutopilotVideo(any(AutopilotVideoRequest.class)))
                .thenReturn(AutopilotVideoResult.started("asset", List.of()));
        DefaultProductRotationService rotation = new DefaultProductRotationService(poolRepository, productSource, clock);

        List<Integer> cycles = new ArrayList<>();
        for (int run = 0; run < 8; run++) {
            if (run == 4) {
                rotation.resetProductUsage(STORE);
            }
            AutopilotConfig current = configRepository.findById(config.id()).orElseThrow();
            clock.set(current.nextScheduledAt());
            scheduler.runDueGenerations(clock.instant());
            cycles.add(configRepository.findById(config.id()).orElseThrow().poolCycles());
        }

        assertThat(cycles).containsExactly(0, 1, 1, 2, 2, 3, 3, 4);
    }

    @Test
    void oneConfigFailingUnexpectedlyDoesNotStopTheBatch() {
        AtomicReference<String> brokenConfigId = new AtomicReference<>();
        InMemoryAutopilotConfigRepository flakyConfigs = new InMemoryAutopilotConfigRepository() {
            @Override
            public AutopilotConfig save(AutopilotConfig config) {
                if (config.id().equals(brokenConfigId.get())) {
                    throw new IllegalStateException("config store unavailable");
                }
                return super.save(config);
            }
        };
        DefaultAutopilotScheduler batchScheduler = new DefaultAutopilotScheduler(
                flakyConfigs,
                storeRepository,
                historyRepository,
                new DefaultProductRotationService(poolRepository, productSource, clock),
                videoService,
                clock,
                meterRegistry);
        addProduct("p1", 2);
        addProduct("p2", 2);
        AutopilotConfig broken = batchScheduler.activateAutopilot(batchScheduler.createConfig(new AutopilotConfigDraft(
                STORE, "owner-1", null, null, 7, List.of())).id(), "first-asset");
        AutopilotConfig healthy = batchScheduler.activateAutopilot(batchScheduler.createConfig(new AutopilotConfigDraft(
                STORE, "owner-2", null, null, 7, List.of())).id(), "first-asset");
        brokenConfigId.set(broken.id());
        when(videoService.generateAutopilotVideo(any(AutopilotVideoRequest.class)))
                .thenReturn(AutopilotVideoResult.started("asset", List.of()));

        clock.set(healthy.nextScheduledAt());
        AutopilotCycleSummary summary = batchScheduler.runDueGenerations(clock.instant());

        assertThat(summary).isEqualTo(new AutopilotCycleSummary(2, 1, 1, 0));
        assertThat(flakyConfigs.findById(healthy.id()).orElseThrow().videosGenerated()).isEqualTo(2);
    }

    @Test
    void runDueGenerationsOnlyRunsDueConfigs() {
        addProduct("p1", 2);
        AutopilotConfig due = activeConfig(7);
        AutopilotConfig paused = activeConfig(7);
        scheduler.pauseAutopilot(paused.id());
        when(videoService.generateAutopilotVideo(any(AutopilotVideoRequest.class)))
                .thenReturn(AutopilotVideoResult.started("asset", List.of()));

        AutopilotCycleSummary early = scheduler.runDueGenerations(clock.instant());
        clock.set(due.nextScheduledAt());
        AutopilotCycleSummary onTime = scheduler.runDueGenerations(clock.instant());

        assertThat(early.due()).isZero();
        assertThat(onTime).isEqualTo(new AutopilotCycleSummary(1, 1, 0, 0));
    }

    @Test
    void overlappingTriggerSkipsConfigAlreadyGenerating() {
        addProduct("p1", 2);
        AutopilotConfig config = activeConfig(7);
        clock.set(config.nextScheduledAt());
        AtomicReference<AutopilotCycleSummary> nested = new AtomicReference<>();
        when(videoService.generateAutopilotVideo(any(AutopilotVideoRequest.class))).thenAnswer(invocation -> {
            nested.set(scheduler.runDueGenerations(clock.instant()));
            return AutopilotVideoResult.started("asset", List.of());
        });

        AutopilotCycleSummary outer = scheduler.runDueGenerations(clock.instant());

        assertThat(outer).isEqualTo(new AutopilotCycleSummary(1, 1, 0, 0));
        assertThat(nested.get()).isEqualTo(new AutopilotCycleSummary(1, 0, 0, 1));
        assertThat(meterRegistry.counter("ad_autopilot.generations", "outcome", "skipped").count()).isEqualTo(1.0);
    }

    @Test
    void pauseKeepsScheduleAndResumeRecomputesIt() {
        AutopilotConfig config = activeConfig(7);

        AutopilotConfig paused = scheduler.pauseAutopilot(config.id());
        assertThat(paused.active()).isFalse();
        assertThat(paused.nextScheduledAt()).isEqualTo(config.nextScheduledAt());

        clock.advance(Duration.ofDays(3));
        AutopilotConfig resumed = scheduler.resumeAutopilot(config.id());
        assertThat(resumed.active()).isTrue();
        assertThat(resumed.nextScheduledAt()).isEqualTo(Instant.parse("2026-03-06T09:00:00Z"));
    }

    @Test
    void unapprovedConfigCannotResumeAndUnknownConfigIsNotFound() {
        AutopilotConfig config = scheduler.createConfig(new AutopilotConfigDraft(STORE, "owner-1", null, null, 7, null));

        assertThatThrownBy(() -> scheduler.resumeAutopilot(config.id()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("has not been approved");
        assertThatThrownBy(() -> scheduler.getHistory("missing"))
                .isInstanceOf(NoSuchElementException.class)
                .hasMessage("Autopilot config not found: missing");
    }

    private AutopilotConfig activeConfig(int videosPerWeek) {
        AutopilotConfig created = scheduler.createConfig(new AutopilotConfigDraft(
                STORE, "owner-1", "friendly", "voice-1", videosPerWeek, List.of()));
        return scheduler.activateAutopilot(created.id(), "first-asset");
    }

    private void addProduct(String id, int imageCount) {
        List<String> images = new ArrayList<>();
        for (int i = 0; i < imageCount; i++) {
            images.add("https://cdn.example/" + id + "/" + i + ".png");
        }
        Instant createdAt = MONDAY_0917.minus(Duration.ofDays(1)).plusSeconds(productSequence++);
        poolRepository.save(new RotationPoolEntry(
                id, STORE, "ext-" + id, "Product " + id, "Great product", images, "24.99", true, 0, null, createdAt));
    }
}
