package github.sarthakdev143.ad_autopilot.integration.youtube;

import com.google.api.services.youtube.YouTube;
import github.sarthakdev143.ad_autopilot.config.AdAutopilotProperties;
import github.sarthakdev143.ad_autopilot.model.publishing.PrivacyStatus;
import github.sarthakdev143.ad_autopilot.model.publishing.PublishOptions;
import github.sarthakdev143.ad_autopilot.model.publishing.PublishReceipt;
import github.sarthakdev143.ad_autopilot.model.publishing.PublishRequest;
import github.sarthakdev143.ad_autopilot.model.publishing.RemotePublishStatus;
import github.sarthakdev143.ad_autopilot.model.publishing.UploadResult;
import github.sarthakdev143.ad_autopilot.service.PublishingProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Optional;
import java.util.function.Function;

@Component
@ConditionalOnProperty(name = "ad-autopilot.youtube.enabled", havingValue = "true", matchIfMissing = true)
public class YouTubePublisher implements PublishingProvider {

    private static final Logger logger = LoggerFactory.getLogger(YouTubePublisher.class);
    static final String PLATFORM = "youtube";
    static final int MAX_TITLE_LENGTH = 100;
    static final int MAX_DESCRIPTION_LENGTH = 5000;

    private final YouTubeServiceProvider serviceProvider;
    private final Function<YouTube, YouTubeUploader> uploaderFactory;
    private final RestTemplate restTemplate;
    private final Clock clock;
    private final PrivacyStatus privacyStatus;
    private final String categoryId;

    @Autowired
    public YouTubePublisher(
            YouTubeServiceProvider serviceProvider,
            RestTemplate providerRestTemplate,
            AdAutopilotProperties properties,
            Clock clock) {
        this(serviceProvider, YouTubeUploader::new, providerRestTemplate, properties, clock);
    }

    YouTubePublisher(
            YouTubeServiceProvider serviceProvider,
            Function<YouTube, YouTubeUploader> uploaderFactory,
            RestTemplate restTemplate,
            AdAutopilotProperties properties,
            Clock clock) {
        this.serviceProvider = serviceProvider;
        this.uploaderFactory = uploaderFactory;
        this.restTemplate = restTemplate;
        this.clock = clock;
        this.privacyStatus = PrivacyStatus.fromInput(properties.getYoutube().getPrivacyStatus());
        this.categoryId = properties.getYoutube().getCategoryId();
    }

    @Override
    public String platform() {
        return PLATFORM;
    }

    @Override
    public PublishReceipt publish(PublishRequest request) throws Exception {
        PublishOptions options = new PublishOptions(privacyStatus, request.hashtags(), categoryId, request.publishAt());
        Path videoPath = null;
        try {
            videoPath = downloadAsset(request.videoUrl());
            UploadResult result = uploaderFactory.apply(serviceProvider.getService()).upload(
                    videoPath.toString(),
                    truncate(request.title(), MAX_TITLE_LENGTH),
                    truncate(request.caption(), MAX_DESCRIPTION_LENGTH),
                    options);
            logger.info("Asset {} uploaded to YouTube as {} privacyStatus={} scheduled={}",
                    request.assetId(), result.videoId(), options.privacyStatus(), options.isScheduled());
            return new PublishReceipt(result.videoId(), result.watchUrl(), options.publishAt(), result.warningMessage());
        } finally {
            deleteTempFile(videoPath);
        }
    }

    @Override
    public Optional<RemotePublishStatus> getStatus(String remoteJobId) throws Exception {
        return uploaderFactory.apply(serviceProvider.getService()).fetchStatus(remoteJobId, clock.instant());
    }

    Path downloadAsset(String videoUrl) throws IOException {
        Path target = Files.createTempFile("ad-autopilot-upload-", ".mp4");
        try {
            restTemplate.execute(URI.create(videoUrl), HttpMethod.GET, null, response ->
                    Files.copy(response.getBody(), target, StandardCopyOption.REPLACE_EXISTING));
            return target;
        } catch (RestClientException e) {
            deleteTempFile(target);
            throw new IOException("Could not download asset " + videoUrl + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            deleteTempFile(target);
            throw e;
        }
    }

    private String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    private void deleteTempFile(Path filePath) {
        if (filePath == null) {
            return;
        }
        try {
            Files.deleteIfExists(filePath);
        } catch (Exception ignored) {
            // Cleanup failures are non-fatal.
        }
    }
}
