package github.sarthakdev143.ad_autopilot.model.chain;

import java.time.Duration;
import java.time.Instant;

public record ChainTimestamps(
        Instant imageStartedAt,
        Instant imageCompletedAt,
        Instant analysisCompletedAt,
        Instant videoStartedAt,
        Instant videoCompletedAt) {

    public static ChainTimestamps empty() {
        return new ChainTimestamps(null, null, null, null, null);
    }

    public ChainTimestamps withImageStarted(Instant at) {
        return new ChainTimestamps(at, imageCompletedAt, analysisCompletedAt, videoStartedAt, videoCompletedAt);
    }

    public ChainTimestamps withImageCompleted(Instant at) {
        return new ChainTimestamps(imageStartedAt, at, analysisCompletedAt, videoStartedAt, videoCompletedAt);
    }

    public ChainTimestamps withAnalysisCompleted(Instant at) {
        return new ChainTimestamps(imageStartedAt, imageCompletedAt, at, videoStartedAt, videoCompletedAt);
    }

    public ChainTimestamps withVideoStarted(Instant at) {
        return new ChainTimestamps(imageStartedAt, imageCompletedAt, analysisCompletedAt, at, videoCompletedAt);
    }

    public ChainTimestamps withVideoCompleted(Instant at) {
        return new ChainTimestamps(imageStartedAt, imageCompletedAt, analysisCompletedAt, videoStartedAt, at);
    }

    /**
     * Elapsed time from the first provider submission to video completion, formatted as {@code Xm Ys}.
     * Returns {@code null} while either end is unknown.
     */
    public String formattedDuration() {
        Instant start = imageStartedAt != null ? imageStartedAt : videoStartedAt;
        if (start == null || videoCompletedAt == null) {
            return null;
        }
        long seconds = Math.max(0, Duration.between(start, videoCompletedAt).getSeconds());
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
