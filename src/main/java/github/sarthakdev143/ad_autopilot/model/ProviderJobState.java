package github.sarthakdev143.ad_autopilot.model;

import java.util.Locale;

public enum ProviderJobState {
    PROCESSING,
    READY,
    FAILED;

    /**
     * Maps the loose status vocabulary used by generation providers onto the three states the chain cares about.
     * Anything unrecognised is treated as still running.
     */
    public static ProviderJobState fromProviderValue(String value) {
        if (value == null || value.isBlank()) {
            return PROCESSING;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "ready", "success", "succeeded", "completed", "done" -> READY;
            case "failed", "failure", "error", "cancelled", "canceled" -> FAILED;
            default -> PROCESSING;
        };
    }
}
