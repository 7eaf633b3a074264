package github.sarthakdev143.ad_autopilot.testsupport;

import github.sarthakdev143.ad_autopilot.model.ProviderJobStatus;
import github.sarthakdev143.ad_autopilot.service.ExternalJobClient;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Scripted job client: each submit hands out the next queued id (or throws), each poll the next queued status.
 */
public class FakeJobClient implements ExternalJobClient {

    public record Submission(String prompt, Map<String, Object> params) {
    }

    private final String name;
    private final Deque<Object> submitOutcomes = new ArrayDeque<>();
    private final Deque<Object> pollOutcomes = new ArrayDeque<>();
    private final List<Submission> submissions = new ArrayList<>();
    private final List<String> polledIds = new ArrayList<>();

    public FakeJobClient(String name) {
        this.name = name;
    }

    public FakeJobClient acceptWith(String jobId) {
        submitOutcomes.add(jobId);
        return this;
    }

    public FakeJobClient rejectWith(RuntimeException error) {
        submitOutcomes.add(error);
        return this;
    }

    public FakeJobClient reportStatus(ProviderJobStatus status) {
        pollOutcomes.add(status);
        return this;
    }

    public FakeJobClient failPollWith(RuntimeException error) {
        pollOutcomes.add(error);
        return this;
    }

    public List<Submission> submissions() {
        return submissions;
    }

    public List<String> polledIds() {
        return polledIds;
    }

    @Override
    public String providerName() {
        return name;
    }

    @Override
    public String submit(String prompt, Map<String, Object> params) {
        submissions.add(new Submission(prompt, params));
        return next(submitOutcomes, String.class, "submit");
    }

    @Override
    public ProviderJobStatus poll(String jobId) {
        polledIds.add(jobId);
        if (pollOutcomes.isEmpty()) {
            return ProviderJobStatus.processing();
        }
        return next(pollOutcomes, ProviderJobStatus.class, "poll");
    }

    private <T> T next(Deque<Object> outcomes, Class<T> type, String call) {
        Object outcome = outcomes.poll();
        if (outcome == null) {
            throw new IllegalStateException(name + " has no scripted " + call + " outcome");
        }
        if (outcome instanceof RuntimeException) {
            throw (RuntimeException) outcome;
        }
        return type.cast(outcome);
    }
}
