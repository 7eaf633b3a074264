package github.sarthakdev143.ad_autopilot.integration.youtube;

import com.google.api.client.googleapis.json.GoogleJsonError;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.FileContent;
import com.google.api.client.util.DateTime;
import com.google.api.services.youtube.YouTube;
import com.google.api.services.youtube.model.Video;
import com.google.api.services.youtube.model.VideoListResponse;
import com.google.api.services.youtube.model.VideoSnippet;
import com.google.api.services.youtube.model.VideoStatus;
import github.sarthakdev143.ad_autopilot.model.publishing.PrivacyStatus;
import github.sarthakdev143.ad_autopilot.model.publishing.PublishOptions;
import github.sarthakdev143.ad_autopilot.model.publishing.RemotePublishStatus;
import github.sarthakdev143.ad_autopilot.model.publishing.UploadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class YouTubeUploader {

    private static final Logger logger = LoggerFactory.getLogger(YouTubeUploader.class);

    private final YouTube youtubeService;

    public YouTubeUploader(YouTube youtubeService) {
        this.youtubeService = youtubeService;
    }

    /**
     * Uploads a local video file. When YouTube rejects the category the upload is retried once without it.
     * @param videoPath path to the mp4
     * @param title video title
     * @param description video description
     * @param publishOptions privacy, tags, category and optional scheduled publish time
     * @return upload result containing the new video id
     * @throws IOException when the upload is rejected or cannot be sent
     */
    public UploadResult upload(
            String videoPath,
            String title,
            String description,
            PublishOptions publishOptions) throws IOException {
        File videoFile = new File(videoPath);
        PublishOptions resolvedOptions = publishOptions == null
                ? new PublishOptions(PrivacyStatus.PUBLIC, List.of(), null, null)
                : publishOptions;

        try {
            Video response = executeUpload(videoFile, title, description, resolvedOptions);
            logger.info("Uploaded YouTube video {}", response.getId());
            return new UploadResult(response.getId());
        } catch (GoogleJsonResponseException categoryError) {
            if (resolvedOptions.categoryId() == null || !isInvalidCategoryError(categoryError)) {
                throw categoryError;
            }

            Video fallbackResponse = executeUpload(videoFile, title, description, resolvedOptions.withoutCategory());
            logger.warn("YouTube rejected category {}, uploaded video {} without it",
                    resolvedOptions.categoryId(), fallbackResponse.getId());
            return new UploadResult(
                    fallbackResponse.getId(),
                    "Invalid categoryId was ignored. Video uploaded without category.");
        }
    }

    /**
     * Translates YouTube's upload and privacy state into the publishing vocabulary.
     * Values YouTube may add later are passed through untouched.
     */
    public Optional<RemotePublishStatus> fetchStatus(String videoId, Instant now) throws IOException {
        YouTube.Videos.List request = youtubeService.videos()
                .list(List.of("status"))
                .setId(List.of(videoId));
        VideoListResponse response = request.execute();
        if (response == null || response.getItems() == null || response.getItems().isEmpty()) {
            return Optional.empty();
        }

        VideoStatus status = response.getItems().get(0).getStatus();
        if (status == null || status.getUploadStatus() == null) {
            return Optional.of(new RemotePublishStatus(RemotePublishStatus.POSTING, null, null));
        }

        String watchUrl = new UploadResult(videoId).watchUrl();
        return Optional.of(switch (status.getUploadStatus()) {
            case "processed" -> isWaitingForPublishTime(status, now)
                    ? new RemotePublishStatus(RemotePublishStatus.SCHEDULED, null, null)
                    : new RemotePublishStatus(RemotePublishStatus.PUBLISHED, watchUrl, null);
            case "uploaded" -> new RemotePublishStatus(RemotePublishStatus.POSTING, null, null);
            case "failed" -> new RemotePublishStatus(
                    RemotePublishStatus.FAILED, null, "Upload failed: " + status.getFailureReason());
            case "rejected" -> new RemotePublishStatus(
                    RemotePublishStatus.FAILED, null, "Video rejected: " + status.getRejectionReason());
            case "deleted" -> new RemotePublishStatus(RemotePublishStatus.FAILED, null, "Video was deleted");
            default -> new RemotePublishStatus(status.getUploadStatus(), null, null);
        });
    }

    private boolean isWaitingForPublishTime(VideoStatus status, Instant now) {
        DateTime publishAt = status.getPublishAt();
        return PrivacyStatus.fromApiValue(status.getPrivacyStatus()) == PrivacyStatus.PRIVATE
                && publishAt != null
                && publishAt.getValue() > now.toEpochMilli();
    }

    private Video executeUpload(
            File videoFile,
            String title,
            String description,
            PublishOptions publishOptions) throws IOException {
        Video metadata = new Video();
        VideoStatus status = new VideoStatus();
        status.setPrivacyStatus(publishOptions.privacyStatus().toApiValue());
        if (publishOptions.publishAt() != null) {
            status.setPublishAt(new DateTime(publishOptions.publishAt().toEpochMilli()));
        }
        metadata.setStatus(status);

        VideoSnippet snippet = new VideoSnippet();
        snippet.setTitle(title);
        snippet.setDescription(description);
        if (!publishOptions.tags().isEmpty()) {
            snippet.setTags(publishOptions.tags());
        }
        if (publishOptions.categoryId() != null) {
            snippet.setCategoryId(publishOptions.categoryId());
        }
        metadata.setSnippet(snippet);

        FileContent mediaContent = new FileContent("video/mp4", videoFile);
        YouTube.Videos.Insert request = youtubeService.videos()
                .insert(List.of("snippet", "status"), metadata, mediaContent);
        return request.execute();
    }

    private boolean isInvalidCategoryError(GoogleJsonResponseException exception) {
        GoogleJsonError details = exception.getDetails();
        if (details == null || details.getErrors() == null) {
            return false;
        }
        return details.getErrors()
                .stream()
                .map(GoogleJsonError.ErrorInfo::getReason)
                .filter(Objects::nonNull)
                .anyMatch("invalidCategoryId"::equals);
    }
}
