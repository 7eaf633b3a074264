package github.sarthakdev143.ad_autopilot.model;

public record NarrationAudio(String audioUrl, double durationSeconds) {

    public NarrationAudio {
        if (durationSeconds < 0) {
            throw new IllegalArgumentException("durationSeconds must not be negative.");
        }
    }
}
