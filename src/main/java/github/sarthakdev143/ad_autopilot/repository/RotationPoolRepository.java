package github.sarthakdev143.ad_autopilot.repository;

import github.sarthakdev143.ad_autopilot.model.autopilot.RotationPoolEntry;

import java.util.List;
import java.util.Optional;

public interface RotationPoolRepository {

    RotationPoolEntry save(RotationPoolEntry entry);

    Optional<RotationPoolEntry> findById(String id);

    List<RotationPoolEntry> findByStoreId(String storeId);
}
