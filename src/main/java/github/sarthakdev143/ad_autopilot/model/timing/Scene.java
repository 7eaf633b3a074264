package github.sarthakdev143.ad_autopilot.model.timing;

import java.util.Locale;

/**
 * The fixed scene sequence of an autopilot ad, with each scene's allowed and default length in seconds.
 */
public enum Scene {
    HOOK(3, 5, 4, false),
    PROBLEM(8, 10, 9, true),
    REVEAL(8, 12, 10, true),
    FEATURES(12, 15, 14, true),
    SOCIAL_PROOF(8, 10, 9, true),
    AVATAR(0, 10, 0, false),
    OFFER(5, 8, 6, true),
    CTA(5, 8, 6, true);

    private final int minSeconds;
    private final int maxSeconds;
    private final int defaultSeconds;
    private final boolean narrated;

    Scene(int minSeconds, int maxSeconds, int defaultSeconds, boolean narrated) {
        this.minSeconds = minSeconds;
        this.maxSeconds = maxSeconds;
        this.defaultSeconds = defaultSeconds;
        this.narrated = narrated;
    }

    public int minSeconds() {
        return minSeconds;
    }

    public int maxSeconds() {
        return maxSeconds;
    }

    public int defaultSeconds() {
        return defaultSeconds;
    }

    public boolean isNarrated() {
        return narrated;
    }

    public double clamp(double seconds) {
        return Math.max(minSeconds, Math.min(maxSeconds, seconds));
    }

    public String key() {
        String[] parts = name().toLowerCase(Locale.ROOT).split("_");
        StringBuilder key = new StringBuilder(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            key.append(Character.toUpperCase(parts[i].charAt(0))).append(parts[i].substring(1));
        }
        return key.toString();
    }
}
