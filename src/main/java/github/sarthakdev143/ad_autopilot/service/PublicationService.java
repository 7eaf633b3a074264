package github.sarthakdev143.ad_autopilot.service;

import github.sarthakdev143.ad_autopilot.model.GenerationJob;
import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotConfig;
import github.sarthakdev143.ad_autopilot.model.autopilot.GenerationHistoryRecord;

public interface PublicationService {

    /**
     * Hands a finished asset to every platform the config targets and records each outcome on the history row.
     *
     * @return the history row with its publish results
     */
    GenerationHistoryRecord publish(
            GenerationJob asset,
            AutopilotConfig config,
            GenerationHistoryRecord history,
            String productTitle);
}
