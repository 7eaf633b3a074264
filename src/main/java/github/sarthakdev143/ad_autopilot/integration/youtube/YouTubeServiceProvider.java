package github.sarthakdev143.ad_autopilot.integration.youtube;

import com.google.api.services.youtube.YouTube;

public interface YouTubeServiceProvider {

    YouTube getService() throws Exception;
}
