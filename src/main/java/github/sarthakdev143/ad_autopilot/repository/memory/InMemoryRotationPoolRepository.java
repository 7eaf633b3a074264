package github.sarthakdev143.ad_autopilot.repository.memory;

import github.sarthakdev143.ad_autopilot.model.autopilot.RotationPoolEntry;
import github.sarthakdev143.ad_autopilot.repository.RotationPoolRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryRotationPoolRepository implements RotationPoolRepository {

    private final Map<String, RotationPoolEntry> entries = new ConcurrentHashMap<>();

    @Override
    public RotationPoolEntry save(RotationPoolEntry entry) {
        entries.put(entry.id(), entry);
        return entry;
    }

    @Override
    public Optional<RotationPoolEntry> findById(String id) {
        return Optional.ofNullable(entries.get(id));
    }

    @Override
    public List<RotationPoolEntry> findByStoreId(String storeId) {
        return entries.values()
                .stream()
                .filter(entry -> Objects.equals(entry.storeId(), storeId))
                .toList();
    }
}
