package github.sarthakdev143.ad_autopilot.repository.memory;

import github.sarthakdev143.ad_autopilot.model.autopilot.GenerationHistoryRecord;
import github.sarthakdev143.ad_autopilot.model.autopilot.HistoryStatus;
import github.sarthakdev143.ad_autopilot.repository.GenerationHistoryRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryGenerationHistoryRepository implements GenerationHistoryRepository {

    private final Map<String, GenerationHistoryRecord> records = new ConcurrentHashMap<>();

    @Override
    public GenerationHistoryRecord save(GenerationHistoryRecord record) {
        records.put(record.id(), record);
        return record;
    }

    @Override
    public Optional<GenerationHistoryRecord> findById(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public List<GenerationHistoryRecord> findByConfigId(String configId) {
        return records.values()
                .stream()
                .filter(record -> Objects.equals(record.configId(), configId))
                .sorted(Comparator.comparing(GenerationHistoryRecord::createdAt).reversed())
                .toList();
    }

    @Override
    public List<GenerationHistoryRecord> findByStatus(HistoryStatus status) {
        return records.values()
                .stream()
                .filter(record -> record.status() == status)
                .sorted(Comparator.comparing(GenerationHistoryRecord::createdAt))
                .toList();
    }
}
