package github.sarthakdev143.ad_autopilot.model.autopilot;

import java.time.Instant;
import java.util.List;

public record AutopilotConfig(
        String id,
        String storeId,
        String ownerId,
        String tone,
        String voiceId,
        int videosPerWeek,
        List<String> platforms,
        boolean active,
        boolean approved,
        String firstVideoAssetId,
        Instant nextScheduledAt,
        Instant lastGeneratedAt,
        int videosGenerated,
        int poolCycles,
        Instant updatedAt) {

    public AutopilotConfig {
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
    }

    public boolean isDue(Instant now) {
        return active && approved && nextScheduledAt != null && !nextScheduledAt.isAfter(now);
    }

    public AutopilotConfig activated(String firstAssetId, Instant nextRun, Instant now) {
        return new AutopilotConfig(
                id,
                storeId,
                ownerId,
                tone,
                voiceId,
                videosPerWeek,
                platforms,
                true,
                true,
                firstAssetId,
                nextRun,
                lastGeneratedAt,
                1,
                poolCycles,
                now);
    }

    public AutopilotConfig withActive(boolean isActive, Instant nextRun, Instant now) {
        return new AutopilotConfig(
                id,
                storeId,
                ownerId,
                tone,
                voiceId,
                videosPerWeek,
                platforms,
                isActive,
                approved,
                firstVideoAssetId,
                nextRun,
                lastGeneratedAt,
                videosGenerated,
                poolCycles,
                now);
    }

    public AutopilotConfig rescheduled(Instant nextRun, Instant generatedAt, Instant now) {
        return new AutopilotConfig(
                id,
                storeId,
                ownerId,
                tone,
                voiceId,
                videosPerWeek,
                platforms,
                active,
                approved,
                firstVideoAssetId,
                nextRun,
                generatedAt != null ? generatedAt : lastGeneratedAt,
                videosGenerated,
                poolCycles,
                now);
    }

    public AutopilotConfig withStats(int generated, int cycles, Instant now) {
        return new AutopilotConfig(
                id,
                storeId,
                ownerId,
                tone,
                voiceId,
                videosPerWeek,
                platforms,
                active,
                approved,
                firstVideoAssetId,
                nextScheduledAt,
                lastGeneratedAt,
                generated,
                cycles,
                now);
    }
}
