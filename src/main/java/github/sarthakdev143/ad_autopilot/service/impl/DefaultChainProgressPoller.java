package github.sarthakdev143.ad_autopilot.service.impl;

import github.sarthakdev143.ad_autopilot.model.AssetStatus;
import github.sarthakdev143.ad_autopilot.model.GenerationJob;
import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotConfig;
import github.sarthakdev143.ad_autopilot.model.autopilot.GenerationHistoryRecord;
import github.sarthakdev143.ad_autopilot.model.autopilot.HistoryStatus;
import github.sarthakdev143.ad_autopilot.model.autopilot.RotationPoolEntry;
import github.sarthakdev143.ad_autopilot.model.chain.ChainPollSummary;
import github.sarthakdev143.ad_autopilot.repository.AutopilotConfigRepository;
import github.sarthakdev143.ad_autopilot.repository.GenerationHistoryRepository;
import github.sarthakdev143.ad_autopilot.repository.GenerationJobRepository;
import github.sarthakdev143.ad_autopilot.repository.RotationPoolRepository;
import github.sarthakdev143.ad_autopilot.service.ChainOrchestrator;
import github.sarthakdev143.ad_autopilot.service.ChainProgressPoller;
import github.sarthakdev143.ad_autopilot.service.PublicationService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

@Service
public class DefaultChainProgressPoller implements ChainProgressPoller {

    private static final Logger logger = LoggerFactory.getLogger(DefaultChainProgressPoller.class);

    private final ChainOrchestrator chainOrchestrator;
    private final GenerationJobRepository jobRepository;
    private final GenerationHistoryRepository historyRepository;
    private final AutopilotConfigRepository configRepository;
    private final RotationPoolRepository poolRepository;
    private final PublicationService publicationService;
    private final Clock clock;
    private final Counter pollFailureCounter;

    public DefaultChainProgressPoller(
            ChainOrchestrator chainOrchestrator,
            GenerationJobRepository jobRepository,
            GenerationHistoryRepository historyRepository,
            AutopilotConfigRepository configRepository,
            RotationPoolRepository poolRepository,
            PublicationService publicationService,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.chainOrchestrator = chainOrchestrator;
        this.jobRepository = jobRepository;
        this.historyRepository = historyRepository;
        this.configRepository = configRepository;
        this.poolRepository = poolRepository;
        this.publicationService = publicationService;
        this.clock = clock;
        this.pollFailureCounter = meterRegistry.counter("ad_autopilot.chain.poll_failures");
    }

    @Override
    public ChainPollSummary pollInFlightJobs() {
        int swept = chainOrchestrator.sweepStalledJobs(clock.instant());

        List<GenerationJob> inFlight = jobRepository.findByStatus(AssetStatus.PROCESSING);
        int checked = 0;
        for (GenerationJob job : inFlight) {
            try {
                chainOrchestrator.checkImageStatus(job.id());
                chainOrchestrator.checkVideoStatus(job.id());
                checked++;
            } catch (RuntimeException e) {
                pollFailureCounter.increment();
                logger.error("Advancing generation job {} failed", job.id(), e);
            }
        }

        int ready = 0;
        int failed = 0;
        for (GenerationHistoryRecord history : historyRepository.findByStatus(HistoryStatus.GENERATING)) {
            try {
                HistoryStatus settled = settle(history);
                if (settled == HistoryStatus.READY) {
                    ready++;
                } else if (settled == HistoryStatus.FAILED) {
                    failed++;
                }
            } catch (RuntimeException e) {
                pollFailureCounter.increment();
                logger.error("Settling autopilot history {} failed", history.id(), e);
            }
        }

        return new ChainPollSummary(swept, checked, ready, failed);
    }

    private HistoryStatus settle(GenerationHistoryRecord history) {
        if (history.mediaAssetId() == null) {
            return null;
        }
        Optional<GenerationJob> asset = chainOrchestrator.findJob(history.mediaAssetId());
        if (asset.isEmpty()) {
            logger.warn("Autopilot history {} points at unknown asset {}", history.id(), history.mediaAssetId());
            return null;
        }

        GenerationJob job = asset.get();
        if (job.status() == AssetStatus.ERROR) {
            historyRepository.save(history.asFailed(job.errorMessage(), clock.instant()));
            logger.warn("Autopilot history {} failed: {}", history.id(), job.errorMessage());
            return HistoryStatus.FAILED;
        }
        if (job.status() != AssetStatus.READY) {
            return null;
        }

        GenerationHistoryRecord ready = historyRepository.save(history.ready(clock.instant()));
        logger.info("Autopilot history {} ready with asset {}", history.id(), job.id());

        Optional<AutopilotConfig> config = configRepository.findById(history.configId());
        if (config.isEmpty() || config.get().platforms().isEmpty()) {
            return HistoryStatus.READY;
        }
        String productTitle = poolRepository.findById(history.productId())
                .map(RotationPoolEntry::title)
                .orElse("our latest product");
        publicationService.publish(job, config.get(), ready, productTitle);
        return HistoryStatus.READY;
    }
}
