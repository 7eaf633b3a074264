package github.sarthakdev143.ad_autopilot.service.impl;

import github.sarthakdev143.ad_autopilot.config.AdAutopilotProperties;
import github.sarthakdev143.ad_autopilot.model.GenerationJob;
import github.sarthakdev143.ad_autopilot.model.MediaKind;
import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotConfig;
import github.sarthakdev143.ad_autopilot.model.autopilot.GenerationHistoryRecord;
import github.sarthakdev143.ad_autopilot.model.publishing.PlatformPublishStatus;
import github.sarthakdev143.ad_autopilot.model.publishing.PublishJob;
import github.sarthakdev143.ad_autopilot.model.publishing.PublishJobStatus;
import github.sarthakdev143.ad_autopilot.model.publishing.PublishReceipt;
import github.sarthakdev143.ad_autopilot.model.publishing.PublishRequest;
import github.sarthakdev143.ad_autopilot.repository.memory.InMemoryGenerationHistoryRepository;
import github.sarthakdev143.ad_autopilot.repository.memory.InMemoryPublishJobRepository;
import github.sarthakdev143.ad_autopilot.service.PublishingProvider;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultPublicationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

    @Mock
    private PublishingProvider youtube;

    private final InMemoryPublishJobRepository publishJobRepository = new InMemoryPublishJobRepository();
    private final InMemoryGenerationHistoryRepository historyRepository = new InMemoryGenerationHistoryRepository();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private DefaultPublicationService service;

    @BeforeEach
    void setUp() {
        when(youtube.platform()).thenReturn("youtube");
        service = new DefaultPublicationService(
                List.of(youtube),
                publishJobRepository,
                historyRepository,
                new AdAutopilotProperties(),
                meterRegistry);
    }

    @Test
    void captionNamesTheProductAndAppendsHashtags() {
        assertThat(service.buildCaption("Desk Lamp"))
                .isEqualTo("Check out Desk Lamp! Link in bio.\n\n#product #shopping #musthave");
    }

    @Test
    void publishesToKnownPlatformAndRecordsUnsupportedOnes() throws Exception {
        when(youtube.publish(any(PublishRequest.class)))
                .thenReturn(new PublishReceipt("yt-123", "https://www.youtube.com/watch?v=yt-123", null, null));
        GenerationHistoryRecord history = historyRepository.save(readyHistory());

        GenerationHistoryRecord updated = service.publish(readyAsset(), config("youtube", "TikTok"), history, "Desk Lamp");

        assertThat(updated.publishedPlatforms()).containsOnlyKeys("youtube", "tiktok");
        assertThat(updated.publishedPlatforms().get("youtube").status()).isEqualTo(PlatformPublishStatus.QUEUED);
        assertThat(updated.publishedPlatforms().get("youtube").remoteJobId()).isEqualTo("yt-123");
        assertThat(updated.publishedPlatforms().get("tiktok").status()).isEqualTo(PlatformPublishStatus.FAILED);
        assertThat(updated.publishedPlatforms().get("tiktok").error()).isEqualTo("No publisher configured for platform tiktok");
        assertThat(historyRepository.findById("history-1").orElseThrow()).isEqualTo(updated);

        List<PublishJob> jobs = publishJobRepository.findInFlight(10);
        assertThat(jobs).singleElement().satisfies(job -> {
            assertThat(job.platform()).isEqualTo("youtube");
            assertThat(job.status()).isEqualTo(PublishJobStatus.POSTING);
            assertThat(job.historyId()).isEqualTo("history-1");
            assertThat(job.assetId()).isEqualTo("asset-1");
        });

        ArgumentCaptor<PublishRequest> requestCaptor = ArgumentCaptor.forClass(PublishRequest.class);
        verify(youtube).publish(requestCaptor.capture());
        assertThat(requestCaptor.getValue().videoUrl()).isEqualTo("https://cdn.example/asset-1.mp4");
        assertThat(requestCaptor.getValue().title()).isEqualTo("Desk Lamp");
        assertThat(requestCaptor.getValue().caption()).startsWith("Check out Desk Lamp!");
        assertThat(meterRegistry.counter("ad_autopilot.publish", "outcome", "queued").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("ad_autopilot.publish", "outcome", "failed").count()).isEqualTo(1.0);
    }

    @Test
    void scheduledReceiptCreatesScheduledJob() throws Exception {
        Instant publishAt = NOW.plusSeconds(3600);
        when(youtube.publish(any(PublishRequest.class)))
                .thenReturn(new PublishReceipt("yt-9", null, publishAt, null));

        service.publish(readyAsset(), config("youtube"), historyRepository.save(readyHistory()), "Lamp");

        assertThat(publishJobRepository.findInFlight(10)).singleElement().satisfies(job -> {
            assertThat(job.status()).isEqualTo(PublishJobStatus.SCHEDULED);
            assertThat(job.scheduledFor()).isEqualTo(publishAt);
        });
    }

    @Test
    void publisherExceptionIsRecordedAsFailedResult() throws Exception {
        when(youtube.publish(any(PublishRequest.class))).thenThrow(new IOException("quota exceeded"));

        GenerationHistoryRecord updated = service.publish(
                readyAsset(), config("youtube"), historyRepository.save(readyHistory()), "Lamp");

        assertThat(updated.publishedPlatforms().get("youtube").status()).isEqualTo(PlatformPublishStatus.FAILED);
        assertThat(updated.publishedPlatforms().get("youtube").error()).isEqualTo("quota exceeded");
        assertThat(publishJobRepository.findInFlight(10)).isEmpty();
    }

    private static GenerationJob readyAsset() {
        GenerationJob queued = GenerationJob.queued("asset-1", "owner-1", MediaKind.VIDEO, null, null, null, NOW);
        return queued.asCompleted(List.of("https://cdn.example/asset-1.mp4"), queued.chainState(), NOW);
    }

    private static GenerationHistoryRecord readyHistory() {
        return GenerationHistoryRecord.pending("history-1", "config-1", "p1", NOW).generating("asset-1").ready(NOW);
    }

    private static AutopilotConfig config(String... platforms) {
        return new AutopilotConfig(
                "config-1", "store-1", "owner-1", null, null, 7, List.of(platforms),
                true, true, "first", NOW, null, 1, 0, NOW);
    }
}
