package github.sarthakdev143.ad_autopilot.service.impl;

import github.sarthakdev143.ad_autopilot.config.AdAutopilotProperties;
import github.sarthakdev143.ad_autopilot.model.publishing.PlatformPublishResult;
import github.sarthakdev143.ad_autopilot.model.publishing.PublishJob;
import github.sarthakdev143.ad_autopilot.model.publishing.PublishJobStatus;
import github.sarthakdev143.ad_autopilot.model.publishing.ReconciliationSummary;
import github.sarthakdev143.ad_autopilot.model.publishing.RemotePublishStatus;
import github.sarthakdev143.ad_autopilot.repository.GenerationHistoryRepository;
import github.sarthakdev143.ad_autopilot.repository.PublishJobRepository;
import github.sarthakdev143.ad_autopilot.service.PublishStatusReconciler;
import github.sarthakdev143.ad_autopilot.service.PublishingProvider;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Service
public class DefaultPublishStatusReconciler implements PublishStatusReconciler {

    private static final Logger logger = LoggerFactory.getLogger(DefaultPublishStatusReconciler.class);
    private static final String DEFAULT_FAILURE_MESSAGE = "Publishing failed";

    private final PublishJobRepository publishJobRepository;
    private final GenerationHistoryRepository historyRepository;
    private final Map<String, PublishingProvider> providers = new HashMap<>();
    private final Clock clock;
    private final int batchSize;
    private final InFlightGuard inFlightGuard = new InFlightGuard();
    private final Counter publishedCounter;
    private final Counter failedCounter;
    private final Counter lookupFailureCounter;

    public DefaultPublishStatusReconciler(
            PublishJobRepository publishJobRepository,
            GenerationHistoryRepository historyRepository,
            List<PublishingProvider> publishingProviders,
            AdAutopilotProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.publishJobRepository = publishJobRepository;
        this.historyRepository = historyRepository;
        publishingProviders.forEach(provider -> providers.put(provider.platform().toLowerCase(Locale.ROOT), provider));
        this.clock = clock;
        this.batchSize = properties.getPublishing().getReconcileBatchSize();
        this.publishedCounter = meterRegistry.counter("ad_autopilot.reconcile", "outcome", "published");
        this.failedCounter = meterRegistry.counter("ad_autopilot.reconcile", "outcome", "failed");
        this.lookupFailureCounter = meterRegistry.counter("ad_autopilot.reconcile", "outcome", "lookup_error");
    }

    @Override
    public ReconciliationSummary reconcile() {
        List<PublishJob> inFlight = publishJobRepository.findInFlight(batchSize);
        int published = 0;
        int failed = 0;
        int unchanged = 0;

        for (PublishJob job : inFlight) {
            if (!inFlightGuard.tryAcquire(job.id())) {
                unchanged++;
                continue;
            }
            try {
                PublishJobStatus outcome = reconcileOne(job);
                if (outcome == PublishJobStatus.PUBLISHED) {
                    published++;
                } else if (outcome == PublishJobStatus.FAILED) {
                    failed++;
                } else {
                    unchanged++;
                }
            } finally {
                inFlightGuard.release(job.id());
            }
        }

        if (!inFlight.isEmpty()) {
            logger.info("Reconciled {} publish job(s): published={} failed={} unchanged={}",
                    inFlight.size(), published, failed, unchanged);
        }
        return new ReconciliationSummary(inFlight.size(), published, failed, unchanged);
    }

    /**
     * @return the new local status, or {@code null} when nothing was written
     */
    private PublishJobStatus reconcileOne(PublishJob job) {
        PublishingProvider provider = providers.get(job.platform().toLowerCase(Locale.ROOT));
        if (provider == null) {
            logger.warn("No publisher registered for platform {} (publish job {})", job.platform(), job.id());
            return null;
        }

        Optional<RemotePublishStatus> remote;
        try {
            remote = provider.getStatus(job.remoteJobId());
        } catch (Exception e) {
            lookupFailureCounter.increment();
            logger.warn("Status lookup for publish job {} on {} failed, retrying next tick: {}",
                    job.id(), job.platform(), e.getMessage());
            return null;
        }

        if (remote.isEmpty()) {
            logger.warn("Platform {} does not know remote job {} (publish job {})",
                    job.platform(), job.remoteJobId(), job.id());
            return null;
        }

        PublishJobStatus mapped = mapRemoteStatus(remote.get().status());
        if (mapped == null) {
            logger.warn("Unrecognised remote status '{}' for publish job {}", remote.get().status(), job.id());
            return null;
        }
        if (mapped == job.status() || mapped.isInFlight()) {
            return null;
        }

        if (mapped == PublishJobStatus.PUBLISHED) {
            PublishJob updated = publishJobRepository.save(job.asPublished(remote.get().publicUrl(), clock.instant()));
            recordOnHistory(updated, PlatformPublishResult.published(updated.remoteJobId(), updated.publicUrl()));
            publishedCounter.increment();
            logger.info("Publish job {} is live on {} at {}", job.id(), job.platform(), updated.publicUrl());
        } else {
            String error = remote.get().error() != null ? remote.get().error() : DEFAULT_FAILURE_MESSAGE;
            PublishJob updated = publishJobRepository.save(job.asFailed(error));
            recordOnHistory(updated, PlatformPublishResult.failed(updated.remoteJobId(), error));
            failedCounter.increment();
            logger.warn("Publish job {} failed on {}: {}", job.id(), job.platform(), error);
        }
        return mapped;
    }

    static PublishJobStatus mapRemoteStatus(String remoteStatus) {
        if (remoteStatus == null) {
            return null;
        }
        return switch (remoteStatus.trim().toLowerCase(Locale.ROOT)) {
            case RemotePublishStatus.PUBLISHED -> PublishJobStatus.PUBLISHED;
            case RemotePublishStatus.FAILED -> PublishJobStatus.FAILED;
            case RemotePublishStatus.POSTING -> PublishJobStatus.POSTING;
            case RemotePublishStatus.SCHEDULED -> PublishJobStatus.SCHEDULED;
            default -> null;
        };
    }

    private void recordOnHistory(PublishJob job, PlatformPublishResult result) {
        if (job.historyId() == null) {
            return;
        }
        historyRepository.findById(job.historyId())
                .ifPresent(history -> historyRepository.save(history.withPublishResult(job.platform(), result)));
    }
}
