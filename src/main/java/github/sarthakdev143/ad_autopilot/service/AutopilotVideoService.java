package github.sarthakdev143.ad_autopilot.service;

import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotVideoRequest;
import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotVideoResult;

/**
 * Plans a scene-timed product video and submits it to the render provider.
 */
public interface AutopilotVideoService {

    AutopilotVideoResult generateAutopilotVideo(AutopilotVideoRequest request);
}
