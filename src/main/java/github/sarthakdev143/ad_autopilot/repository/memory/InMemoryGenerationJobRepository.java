package github.sarthakdev143.ad_autopilot.repository.memory;

import github.sarthakdev143.ad_autopilot.model.AssetStatus;
import github.sarthakdev143.ad_autopilot.model.GenerationJob;
import github.sarthakdev143.ad_autopilot.repository.GenerationJobRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryGenerationJobRepository implements GenerationJobRepository {

    private final Map<String, GenerationJob> jobs = new ConcurrentHashMap<>();

    @Override
    public GenerationJob save(GenerationJob job) {
        jobs.put(job.id(), job);
        return job;
    }

    @Override
    public Optional<GenerationJob> findById(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public List<GenerationJob> findByStatus(AssetStatus status) {
        return jobs.values()
                .stream()
                .filter(job -> job.status() == status)
                .sorted(Comparator.comparing(GenerationJob::createdAt))
                .toList();
    }
}
