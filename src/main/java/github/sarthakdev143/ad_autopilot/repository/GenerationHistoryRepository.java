package github.sarthakdev143.ad_autopilot.repository;

import github.sarthakdev143.ad_autopilot.model.autopilot.GenerationHistoryRecord;
import github.sarthakdev143.ad_autopilot.model.autopilot.HistoryStatus;

import java.util.List;
import java.util.Optional;

public interface GenerationHistoryRepository {

    GenerationHistoryRecord save(GenerationHistoryRecord record);

    Optional<GenerationHistoryRecord> findById(String id);

    /**
     * Newest first.
     */
    List<GenerationHistoryRecord> findByConfigId(String configId);

    List<GenerationHistoryRecord> findByStatus(HistoryStatus status);
}
