package github.sarthakdev143.ad_autopilot.dto;

import java.util.List;

public record AutopilotConfigRequest(
        String storeId,
        String ownerId,
        String tone,
        String voiceId,
        Integer videosPerWeek,
        List<String> platforms) {
}
