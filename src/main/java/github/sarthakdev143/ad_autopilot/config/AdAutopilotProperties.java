package github.sarthakdev143.ad_autopilot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "ad-autopilot")
public class AdAutopilotProperties {

    private Providers providers = new Providers();
    private Chain chain = new Chain();
    private Http http = new Http();
    private Autopilot autopilot = new Autopilot();
    private Publishing publishing = new Publishing();
    private Youtube youtube = new Youtube();

    public Providers getProviders() { return providers; }
    public void setProviders(Providers providers) { this.providers = providers; }
    public Chain getChain() { return chain; }
    public void setChain(Chain chain) { this.chain = chain; }
    public Http getHttp() { return http; }
    public void setHttp(Http http) { this.http = http; }
    public Autopilot getAutopilot() { return autopilot; }
    public void setAutopilot(Autopilot autopilot) { this.autopilot = autopilot; }
    public Publishing getPublishing() { return publishing; }
    public void setPublishing(Publishing publishing) { this.publishing = publishing; }
    public Youtube getYoutube() { return youtube; }
    public void setYoutube(Youtube youtube) { this.youtube = youtube; }

    public static class Providers {
        private Endpoint image = new Endpoint("image");
        private Endpoint video = new Endpoint("video");
        private Endpoint render = new Endpoint("render");
        private Endpoint vision = new Endpoint("vision");
        private Endpoint narration = new Endpoint("narration");
        private Endpoint products = new Endpoint("products");

        public Endpoint getImage() { return image; }
        public void setImage(Endpoint image) { this.image = image; }
        public Endpoint getVideo() { return video; }
        public void setVideo(Endpoint video) { this.video = video; }
        public Endpoint getRender() { return render; }
        public void setRender(Endpoint render) { this.render = render; }
        public Endpoint getVision() { return vision; }
        public void setVision(Endpoint vision) { this.vision = vision; }
        public Endpoint getNarration() { return narration; }
        public void setNarration(Endpoint narration) { this.narration = narration; }
        public Endpoint getProducts() { return products; }
        public void setProducts(Endpoint products) { this.products = products; }

        public List<Endpoint> all() {
            return List.of(image, video, render, vision, narration, products);
        }
    }

    public static class Endpoint {
        private String name;
        private String baseUrl;
        private String apiKey;

        public Endpoint() {
        }

        public Endpoint(String name) {
            this.name = name;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    }

    public static class Chain {
        private Duration submissionTimeout = Duration.ofMinutes(10);
        private Duration stageTimeout = Duration.ofMinutes(60);
        private String imageAspectRatio = "9:16";
        private String videoAspectRatio = "9:16";

        public Duration getSubmissionTimeout() { return submissionTimeout; }
        public void setSubmissionTimeout(Duration submissionTimeout) { this.submissionTimeout = submissionTimeout; }
        public Duration getStageTimeout() { return stageTimeout; }
        public void setStageTimeout(Duration stageTimeout) { this.stageTimeout = stageTimeout; }
        public String getImageAspectRatio() { return imageAspectRatio; }
        public void setImageAspectRatio(String imageAspectRatio) { this.imageAspectRatio = imageAspectRatio; }
        public String getVideoAspectRatio() { return videoAspectRatio; }
        public void setVideoAspectRatio(String videoAspectRatio) { this.videoAspectRatio = videoAspectRatio; }
    }

    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
        public Duration getReadTimeout() { return readTimeout; }
        public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }
    }

    public static class Autopilot {
        private double targetSeconds = 65;
        private boolean includeAvatar = false;
        private double avatarSeconds = 8;

        public double getTargetSeconds() { return targetSeconds; }
        public void setTargetSeconds(double targetSeconds) { this.targetSeconds = targetSeconds; }
        public boolean isIncludeAvatar() { return includeAvatar; }
        public void setIncludeAvatar(boolean includeAvatar) { this.includeAvatar = includeAvatar; }
        public double getAvatarSeconds() { return avatarSeconds; }
        public void setAvatarSeconds(double avatarSeconds) { this.avatarSeconds = avatarSeconds; }
    }

    public static class Publishing {
        private List<String> hashtags = new ArrayList<>(List.of("product", "shopping", "musthave"));
        private int reconcileBatchSize = 50;

        public List<String> getHashtags() { return hashtags; }
        public void setHashtags(List<String> hashtags) { this.hashtags = hashtags; }
        public int getReconcileBatchSize() { return reconcileBatchSize; }
        public void setReconcileBatchSize(int reconcileBatchSize) { this.reconcileBatchSize = reconcileBatchSize; }
    }

    public static class Youtube {
        private boolean enabled = true;
        private String credentialsPath = "credentials.json";
        private String tokensDirectory = ".youtube-tokens";
        private String applicationName = "ad-autopilot";
        private String privacyStatus = "PUBLIC";
        private String categoryId;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getCredentialsPath() { return credentialsPath; }
        public void setCredentialsPath(String credentialsPath) { this.credentialsPath = credentialsPath; }
        public String getTokensDirectory() { return tokensDirectory; }
        public void setTokensDirectory(String tokensDirectory) { this.tokensDirectory = tokensDirectory; }
        public String getApplicationName() { return applicationName; }
        public void setApplicationName(String applicationName) { this.applicationName = applicationName; }
        public String getPrivacyStatus() { return privacyStatus; }
        public void setPrivacyStatus(String privacyStatus) { this.privacyStatus = privacyStatus; }
        public String getCategoryId() { return categoryId; }
        public void setCategoryId(String categoryId) { this.categoryId = categoryId; }
    }
}
