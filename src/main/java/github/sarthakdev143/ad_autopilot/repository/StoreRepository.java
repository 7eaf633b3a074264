package github.sarthakdev143.ad_autopilot.repository;

import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotStore;

import java.util.Optional;

public interface StoreRepository {

    AutopilotStore save(AutopilotStore store);

    Optional<AutopilotStore> findById(String id);
}
