package github.sarthakdev143.ad_autopilot.repository;

import github.sarthakdev143.ad_autopilot.model.AssetStatus;
import github.sarthakdev143.ad_autopilot.model.GenerationJob;

import java.util.List;
import java.util.Optional;

public interface GenerationJobRepository {

    GenerationJob save(GenerationJob job);

    Optional<GenerationJob> findById(String id);

    List<GenerationJob> findByStatus(AssetStatus status);
}
