package github.sarthakdev143.ad_autopilot.model;

import java.util.List;

public record ProviderJobStatus(ProviderJobState state, List<String> resultUrls, String error) {

    public ProviderJobStatus {
        state = state == null ? ProviderJobState.PROCESSING : state;
        resultUrls = resultUrls == null ? List.of() : List.copyOf(resultUrls);
        error = error == null || error.isBlank() ? null : error;
    }

    public static ProviderJobStatus processing() {
        return new ProviderJobStatus(ProviderJobState.PROCESSING, List.of(), null);
    }

    public static ProviderJobStatus ready(List<String> resultUrls) {
        return new ProviderJobStatus(ProviderJobState.READY, resultUrls, null);
    }

    public static ProviderJobStatus failed(String error) {
        return new ProviderJobStatus(ProviderJobState.FAILED, List.of(), error);
    }

    public String firstResultUrl() {
        return resultUrls.isEmpty() ? null : resultUrls.get(0);
    }
}
