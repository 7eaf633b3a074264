package github.sarthakdev143.ad_autopilot.model.autopilot;

import github.sarthakdev143.ad_autopilot.model.timing.Scene;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * On-screen text and voiceover lines for one autopilot video.
 */
public record AutopilotScripts(
        String hook,
        Map<Scene, String> narration,
        List<String> features,
        String socialProofText,
        String socialProofName,
        String avatarScript) {

    public AutopilotScripts {
        EnumMap<Scene, String> copy = new EnumMap<>(Scene.class);
        if (narration != null) {
            narration.forEach((scene, text) -> {
                if (text != null && !text.isBlank()) {
                    copy.put(scene, text);
                }
            });
        }
        narration = Collections.unmodifiableMap(copy);
        features = features == null ? List.of() : List.copyOf(features);
    }

    public String narrationFor(Scene scene) {
        return narration.get(scene);
    }
}
