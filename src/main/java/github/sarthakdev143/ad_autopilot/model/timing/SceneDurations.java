package github.sarthakdev143.ad_autopilot.model.timing;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-scene lengths in frames at {@link #FPS}. Scenes that are not part of the video are absent.
 */
public record SceneDurations(Map<Scene, Integer> frames) {

    public static final int FPS = 30;

    public SceneDurations {
        EnumMap<Scene, Integer> copy = new EnumMap<>(Scene.class);
        if (frames != null) {
            frames.forEach((scene, value) -> {
                if (value != null && value > 0) {
                    copy.put(scene, value);
                }
            });
        }
        frames = Collections.unmodifiableMap(copy);
    }

    public static int toFrames(double seconds) {
        return (int) Math.round(seconds * FPS);
    }

    public int framesFor(Scene scene) {
        return frames.getOrDefault(scene, 0);
    }

    public double secondsFor(Scene scene) {
        return framesFor(scene) / (double) FPS;
    }

    public boolean includes(Scene scene) {
        return frames.containsKey(scene);
    }

    public int totalFrames() {
        return frames.values().stream().mapToInt(Integer::intValue).sum();
    }

    public double totalSeconds() {
        return totalFrames() / (double) FPS;
    }

    public SceneDurations withFrames(Scene scene, int sceneFrames) {
        EnumMap<Scene, Integer> copy = new EnumMap<>(Scene.class);
        copy.putAll(frames);
        copy.put(scene, sceneFrames);
        return new SceneDurations(copy);
    }

    /**
     * Frame counts keyed the way the render composition expects them, e.g. {@code socialProof}.
     */
    public Map<String, Integer> asRenderProps() {
        Map<String, Integer> props = new LinkedHashMap<>();
        frames.forEach((scene, value) -> props.put(scene.key(), value));
        return props;
    }
}
