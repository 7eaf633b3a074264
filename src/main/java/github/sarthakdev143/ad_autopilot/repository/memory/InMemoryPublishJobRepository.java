package github.sarthakdev143.ad_autopilot.repository.memory;

import github.sarthakdev143.ad_autopilot.model.publishing.PublishJob;
import github.sarthakdev143.ad_autopilot.repository.PublishJobRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryPublishJobRepository implements PublishJobRepository {

    private static final Comparator<PublishJob> BY_SCHEDULED_FOR = Comparator.comparing(
            PublishJob::scheduledFor,
            Comparator.nullsLast(Comparator.naturalOrder()));

    private final Map<String, PublishJob> jobs = new ConcurrentHashMap<>();

    @Override
    public PublishJob save(PublishJob job) {
        jobs.put(job.id(), job);
        return job;
    }

    @Override
    public Optional<PublishJob> findById(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public List<PublishJob> findInFlight(int limit) {
        return jobs.values()
                .stream()
                .filter(job -> job.status().isInFlight())
                .filter(job -> job.remoteJobId() != null && !job.remoteJobId().isBlank())
                .sorted(BY_SCHEDULED_FOR)
                .limit(limit)
                .toList();
    }
}
