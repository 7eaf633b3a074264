package github.sarthakdev143.ad_autopilot.repository;

import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotConfig;

import java.util.List;
import java.util.Optional;

public interface AutopilotConfigRepository {

    AutopilotConfig save(AutopilotConfig config);

    Optional<AutopilotConfig> findById(String id);

    List<AutopilotConfig> findAll();
}
