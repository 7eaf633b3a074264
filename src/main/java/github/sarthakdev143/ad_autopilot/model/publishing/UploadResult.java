package github.sarthakdev143.ad_autopilot.model.publishing;

public record UploadResult(String videoId, String warningMessage) {

    public UploadResult(String videoId) {
        this(videoId, null);
    }

    public String watchUrl() {
        if (videoId == null || videoId.isBlank()) {
            return null;
        }
        return "https://www.youtube.com/watch?v=" + videoId;
    }
}
