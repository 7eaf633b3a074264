package github.sarthakdev143.ad_autopilot.service;

import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotConfig;
import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotConfigDraft;
import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotCycleSummary;
import github.sarthakdev143.ad_autopilot.model.autopilot.GenerationHistoryRecord;
import github.sarthakdev143.ad_autopilot.model.autopilot.GenerationResult;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface AutopilotScheduler {

    AutopilotConfig createConfig(AutopilotConfigDraft draft);

    Optional<AutopilotConfig> findConfig(String configId);

    List<AutopilotConfig> getDueConfigs(Instant now);

    /**
     * Next run time for the cadence, on the hour and strictly after {@code from}.
     */
    Instant calculateNextScheduled(int videosPerWeek, Instant from);

    /**
     * Runs one generation attempt for the config. Failures are reported in the result, never thrown.
     */
    GenerationResult executeGeneration(AutopilotConfig config);

    AutopilotConfig incrementStats(String configId, String storeId);

    AutopilotCycleSummary runDueGenerations(Instant now);

    AutopilotConfig activateAutopilot(String configId, String firstVideoAssetId);

    AutopilotConfig pauseAutopilot(String configId);

    AutopilotConfig resumeAutopilot(String configId);

    List<GenerationHistoryRecord> getHistory(String configId);
}
