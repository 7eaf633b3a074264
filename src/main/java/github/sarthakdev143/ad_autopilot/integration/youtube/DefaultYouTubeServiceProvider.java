package github.sarthakdev143.ad_autopilot.integration.youtube;

import com.google.api.services.youtube.YouTube;
import github.sarthakdev143.ad_autopilot.config.AdAutopilotProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Authorises lazily on first use and reuses the client afterwards.
 */
@Component
@ConditionalOnProperty(name = "ad-autopilot.youtube.enabled", havingValue = "true", matchIfMissing = true)
public class DefaultYouTubeServiceProvider implements YouTubeServiceProvider {

    private final YouTubeServiceFactory serviceFactory;
    private volatile YouTube service;

    public DefaultYouTubeServiceProvider(AdAutopilotProperties properties) {
        this.serviceFactory = new YouTubeServiceFactory(properties.getYoutube());
    }

    @Override
    public YouTube getService() throws Exception {
        YouTube current = service;
        if (current == null) {
            synchronized (this) {
                current = service;
                if (current == null) {
                    current = serviceFactory.createService();
                    service = current;
                }
            }
        }
        return current;
    }
}
