package github.sarthakdev143.ad_autopilot.repository;

import github.sarthakdev143.ad_autopilot.model.publishing.PublishJob;

import java.util.List;
import java.util.Optional;

public interface PublishJobRepository {

    PublishJob save(PublishJob job);

    Optional<PublishJob> findById(String id);

    /**
     * Scheduled or posting jobs that carry a remote id, earliest {@code scheduledFor} first.
     */
    List<PublishJob> findInFlight(int limit);
}
