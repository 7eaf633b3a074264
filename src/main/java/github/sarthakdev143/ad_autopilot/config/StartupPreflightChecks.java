package github.sarthakdev143.ad_autopilot.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Component
@ConditionalOnProperty(name = "ad-autopilot.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupPreflightChecks.class);

    private final AdAutopilotProperties properties;

    public StartupPreflightChecks(AdAutopilotProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkProviderEndpoints();
        checkChainTimeouts();
        if (properties.getYoutube().isEnabled()) {
            checkYouTubeCredentials();
        }
        logger.info("Preflight checks passed");
    }

    private void checkProviderEndpoints() {
        List<String> problems = new ArrayList<>();
        for (AdAutopilotProperties.Endpoint endpoint : properties.getProviders().all()) {
            String baseUrl = endpoint.getBaseUrl();
            if (baseUrl == null || baseUrl.isBlank()) {
                problems.add(endpoint.getName() + " has no base-url");
                continue;
            }
            try {
                URI uri = URI.create(baseUrl);
                if (uri.getScheme() == null || !uri.getScheme().startsWith("http")) {
                    problems.add(endpoint.getName() + " base-url must be http(s): " + baseUrl);
                }
            } catch (IllegalArgumentException e) {
                problems.add(endpoint.getName() + " base-url is not a valid URI: " + baseUrl);
            }
        }

        if (!problems.isEmpty()) {
            throw new IllegalStateException(
                    "Provider configuration is incomplete (ad-autopilot.providers.*): " + String.join("; ", problems));
        }
    }

    private void checkChainTimeouts() {
        AdAutopilotProperties.Chain chain = properties.getChain();
        if (chain.getSubmissionTimeout().isNegative() || chain.getSubmissionTimeout().isZero()
                || chain.getStageTimeout().isNegative() || chain.getStageTimeout().isZero()) {
            throw new IllegalStateException("ad-autopilot.chain timeouts must be positive durations.");
        }
    }

    private void checkYouTubeCredentials() {
        Path credentialsPath = Path.of(properties.getYoutube().getCredentialsPath());
        if (!Files.isRegularFile(credentialsPath)) {
            throw new IllegalStateException(
                    "YouTube credentials file not found at " + credentialsPath.toAbsolutePath()
                            + ". Set YOUTUBE_CREDENTIALS_PATH or disable ad-autopilot.youtube.enabled.");
        }

        if (!Files.isReadable(credentialsPath)) {
            throw new IllegalStateException(
                    "YouTube credentials file is not readable at " + credentialsPath.toAbsolutePath() + ".");
        }
    }
}
