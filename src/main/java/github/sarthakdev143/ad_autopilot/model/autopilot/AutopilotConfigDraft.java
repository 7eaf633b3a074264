package github.sarthakdev143.ad_autopilot.model.autopilot;

import java.util.List;

public record AutopilotConfigDraft(
        String storeId,
        String ownerId,
        String tone,
        String voiceId,
        int videosPerWeek,
        List<String> platforms) {

    public AutopilotConfigDraft {
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
    }
}
