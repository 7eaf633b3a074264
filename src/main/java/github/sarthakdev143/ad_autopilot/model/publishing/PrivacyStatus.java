package github.sarthakdev143.ad_autopilot.model.publishing;

import java.util.Locale;

public enum PrivacyStatus {
    PRIVATE,
    UNLISTED,
    PUBLIC;

    public static PrivacyStatus fromInput(String input) {
        if (input == null || input.isBlank()) {
            return PUBLIC;
        }

        try {
            return PrivacyStatus.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("privacyStatus must be one of PRIVATE, UNLISTED, PUBLIC.");
        }
    }

    public static PrivacyStatus fromApiValue(String apiValue) {
        if (apiValue == null) {
            return null;
        }
        for (PrivacyStatus candidate : values()) {
            if (candidate.toApiValue().equals(apiValue)) {
                return candidate;
            }
        }
        return null;
    }

    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
