package github.sarthakdev143.ad_autopilot.repository.memory;

import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotConfig;
import github.sarthakdev143.ad_autopilot.repository.AutopilotConfigRepository;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryAutopilotConfigRepository implements AutopilotConfigRepository {

    private final Map<String, AutopilotConfig> configs = new ConcurrentHashMap<>();

    @Override
    public AutopilotConfig save(AutopilotConfig config) {
        configs.put(config.id(), config);
        return config;
    }

    @Override
    public Optional<AutopilotConfig> findById(String id) {
        return Optional.ofNullable(configs.get(id));
    }

    @Override
    public List<AutopilotConfig> findAll() {
        return new ArrayList<>(configs.values());
    }
}
