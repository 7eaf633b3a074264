package github.sarthakdev143.ad_autopilot.service.impl;

import github.sarthakdev143.ad_autopilot.config.AdAutopilotProperties;
import github.sarthakdev143.ad_autopilot.model.GenerationJob;
import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotConfig;
import github.sarthakdev143.ad_autopilot.model.autopilot.GenerationHistoryRecord;
import github.sarthakdev143.ad_autopilot.model.publishing.PlatformPublishResult;
import github.sarthakdev143.ad_autopilot.model.publishing.PublishJob;
import github.sarthakdev143.ad_autopilot.model.publishing.PublishJobStatus;
import github.sarthakdev143.ad_autopilot.model.publishing.PublishReceipt;
import github.sarthakdev143.ad_autopilot.model.publishing.PublishRequest;
import github.sarthakdev143.ad_autopilot.repository.GenerationHistoryRepository;
import github.sarthakdev143.ad_autopilot.repository.PublishJobRepository;
import github.sarthakdev143.ad_autopilot.service.PublicationService;
import github.sarthakdev143.ad_autopilot.service.PublishingProvider;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
public class DefaultPublicationService implements PublicationService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultPublicationService.class);

    private final Map<String, PublishingProvider> providers = new LinkedHashMap<>();
    private final PublishJobRepository publishJobRepository;
    private final GenerationHistoryRepository historyRepository;
    private final List<String> hashtags;
    private final Counter publishQueuedCounter;
    private final Counter publishFailureCounter;

    public DefaultPublicationService(
            List<PublishingProvider> publishingProviders,
            PublishJobRepository publishJobRepository,
            GenerationHistoryRepository historyRepository,
            AdAutopilotProperties properties,
            MeterRegistry meterRegistry) {
        publishingProviders.forEach(provider -> providers.put(provider.platform().toLowerCase(Locale.ROOT), provider));
        this.publishJobRepository = publishJobRepository;
        this.historyRepository = historyRepository;
        this.hashtags = List.copyOf(properties.getPublishing().getHashtags());
        this.publishQueuedCounter = meterRegistry.counter("ad_autopilot.publish", "outcome", "queued");
        this.publishFailureCounter = meterRegistry.counter("ad_autopilot.publish", "outcome", "failed");
    }

    @Override
    public GenerationHistoryRecord publish(
            GenerationJob asset,
            AutopilotConfig config,
            GenerationHistoryRecord history,
            String productTitle) {
        GenerationHistoryRecord current = history;
        for (String platform : config.platforms()) {
            String key = platform.toLowerCase(Locale.ROOT);
            PlatformPublishResult result = publishTo(key, asset, history, productTitle);
            current = current.withPublishResult(key, result);
        }
        return historyRepository.save(current);
    }

    String buildCaption(String productTitle) {
        String tags = hashtags.stream()
                .map(tag -> "#" + tag)
                .collect(Collectors.joining(" "));
        return "Check out " + productTitle + "! Link in bio.\n\n" + tags;
    }

    private PlatformPublishResult publishTo(
            String platform,
            GenerationJob asset,
            GenerationHistoryRecord history,
            String productTitle) {
        PublishingProvider provider = providers.get(platform);
        if (provider == null) {
            publishFailureCounter.increment();
            logger.warn("No publisher configured for platform {} (asset {})", platform, asset.id());
            return PlatformPublishResult.failed(null, "No publisher configured for platform " + platform);
        }

        try {
            PublishReceipt receipt = provider.publish(new PublishRequest(
                    asset.id(),
                    asset.resultUrl(),
                    productTitle,
                    buildCaption(productTitle),
                    hashtags,
                    null));
            publishJobRepository.save(new PublishJob(
                    UUID.randomUUID().toString(),
                    asset.id(),
                    history.id(),
                    platform,
                    receipt.remoteJobId(),
                    receipt.scheduledFor() != null ? PublishJobStatus.SCHEDULED : PublishJobStatus.POSTING,
                    receipt.scheduledFor(),
                    receipt.publicUrl(),
                    null,
                    null));
            publishQueuedCounter.increment();
            logger.info("Queued asset {} on {} remoteJobId={}", asset.id(), platform, receipt.remoteJobId());
            return PlatformPublishResult.queued(receipt.remoteJobId());
        } catch (Exception e) {
            publishFailureCounter.increment();
            logger.error("Publishing asset {} to {} failed", asset.id(), platform, e);
            return PlatformPublishResult.failed(null, e.getMessage());
        }
    }
}
