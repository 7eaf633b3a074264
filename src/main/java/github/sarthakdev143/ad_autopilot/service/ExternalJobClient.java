package github.sarthakdev143.ad_autopilot.service;

import github.sarthakdev143.ad_autopilot.model.ProviderJobStatus;

import java.util.Map;

/**
 * An asynchronous generation provider: submit returns a provider job id, poll reports progress for it.
 */
public interface ExternalJobClient {

    String providerName();

    String submit(String prompt, Map<String, Object> params);

    ProviderJobStatus poll(String jobId);
}
