package github.sarthakdev143.ad_autopilot.service;

import github.sarthakdev143.ad_autopilot.model.publishing.PublishReceipt;
import github.sarthakdev143.ad_autopilot.model.publishing.PublishRequest;
import github.sarthakdev143.ad_autopilot.model.publishing.RemotePublishStatus;

import java.util.Optional;

public interface PublishingProvider {

    /**
     * Lower-case platform name as it appears in an autopilot config, e.g. {@code youtube}.
     */
    String platform();

    PublishReceipt publish(PublishRequest request) throws Exception;

    /**
     * @return empty when the platform no longer knows the remote id
     */
    Optional<RemotePublishStatus> getStatus(String remoteJobId) throws Exception;
}
