package github.sarthakdev143.ad_autopilot.repository.memory;

import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotStore;
import github.sarthakdev143.ad_autopilot.repository.StoreRepository;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryStoreRepository implements StoreRepository {

    private final Map<String, AutopilotStore> stores = new ConcurrentHashMap<>();

    @Override
    public AutopilotStore save(AutopilotStore store) {
        stores.put(store.id(), store);
        return store;
    }

    @Override
    public Optional<AutopilotStore> findById(String id) {
        return Optional.ofNullable(stores.get(id));
    }
}
