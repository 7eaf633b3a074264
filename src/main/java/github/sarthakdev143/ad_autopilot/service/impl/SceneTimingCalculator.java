package github.sarthakdev143.ad_autopilot.service.impl;

import github.sarthakdev143.ad_autopilot.model.NarrationAudio;
import github.sarthakdev143.ad_autopilot.model.timing.DurationValidation;
import github.sarthakdev143.ad_autopilot.model.timing.Scene;
import github.sarthakdev143.ad_autopilot.model.timing.SceneDurations;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

@Component
public class SceneTimingCalculator {

    public static final double AUDIO_PADDING_SECONDS = 1.5;
    public static final double MIN_TOTAL_SECONDS = 57;
    public static final double MAX_TOTAL_SECONDS = 78;
    public static final double DEFAULT_TARGET_SECONDS = 65;
    public static final double TARGET_TOLERANCE_SECONDS = 2;
    public static final double WORDS_PER_SECOND = 2.5;

    /**
     * Scene that absorbs the difference when the total has to be nudged toward the target.
     */
    static final Scene FLEXIBLE_SCENE = Scene.FEATURES;

    public SceneDurations calculate(Map<Scene, NarrationAudio> narration, double avatarSeconds) {
        Map<Scene, NarrationAudio> audio = narration == null ? Map.of() : narration;
        EnumMap<Scene, Integer> frames = new EnumMap<>(Scene.class);

        for (Scene scene : Scene.values()) {
            if (scene == Scene.AVATAR) {
                if (avatarSeconds > 0) {
                    frames.put(scene, SceneDurations.toFrames(scene.clamp(avatarSeconds)));
                }
                continue;
            }

            double seconds = scene.defaultSeconds();
            NarrationAudio sceneAudio = audio.get(scene);
            if (scene.isNarrated() && sceneAudio != null) {
                seconds = sceneAudio.durationSeconds() + AUDIO_PADDING_SECONDS;
            }
            frames.put(scene, SceneDurations.toFrames(scene.clamp(seconds)));
        }

        return new SceneDurations(frames);
    }

    public double totalSeconds(SceneDurations durations) {
        return durations.totalSeconds();
    }

    public DurationValidation validateTotalDuration(SceneDurations durations) {
        double total = durations.totalSeconds();
        if (total < MIN_TOTAL_SECONDS) {
            return DurationValidation.rejected(
                    total,
                    String.format(Locale.ROOT, "Video too short: %.1fs (target 60-75s)", total));
        }
        if (total > MAX_TOTAL_SECONDS) {
            return DurationValidation.rejected(
                    total,
                    String.format(Locale.ROOT, "Video too long: %.1fs (target 60-75s)", total));
        }
        return DurationValidation.ok(total);
    }

    public SceneDurations adjustToTarget(SceneDurations durations, double targetSeconds) {
        double difference = targetSeconds - durations.totalSeconds();
        if (Math.abs(difference) < TARGET_TOLERANCE_SECONDS) {
            return durations;
        }

        int minFrames = FLEXIBLE_SCENE.minSeconds() * SceneDurations.FPS;
        int maxFrames = FLEXIBLE_SCENE.maxSeconds() * SceneDurations.FPS;
        int adjusted = durations.framesFor(FLEXIBLE_SCENE) + SceneDurations.toFrames(difference);
        return durations.withFrames(FLEXIBLE_SCENE, Math.max(minFrames, Math.min(maxFrames, adjusted)));
    }

    public double estimateSpeechSeconds(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        int words = text.trim().split("\\s+").length;
        return Math.ceil(words / WORDS_PER_SECOND);
    }
}
