package github.sarthakdev143.ad_autopilot.service.impl;

import github.sarthakdev143.ad_autopilot.config.AdAutopilotProperties;
import github.sarthakdev143.ad_autopilot.exception.ChainStepException;
import github.sarthakdev143.ad_autopilot.model.GenerationJob;
import github.sarthakdev143.ad_autopilot.model.MediaKind;
import github.sarthakdev143.ad_autopilot.model.NarrationAudio;
import github.sarthakdev143.ad_autopilot.model.PromptVariables;
import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotScripts;
import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotVideoRequest;
import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotVideoResult;
import github.sarthakdev143.ad_autopilot.model.timing.DurationValidation;
import github.sarthakdev143.ad_autopilot.model.timing.Scene;
import github.sarthakdev143.ad_autopilot.model.timing.SceneDurations;
import github.sarthakdev143.ad_autopilot.service.AutopilotVideoService;
import github.sarthakdev143.ad_autopilot.service.ChainOrchestrator;
import github.sarthakdev143.ad_autopilot.service.NarrationSynthesizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class DefaultAutopilotVideoService implements AutopilotVideoService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultAutopilotVideoService.class);

    static final int MIN_PRODUCT_IMAGES = 2;
    static final int MAX_PRODUCT_IMAGES = 4;
    static final String COMPOSITION_ID = "AutopilotVideo";
    static final int VIDEO_WIDTH = 1080;
    static final int VIDEO_HEIGHT = 1920;

    private final ChainOrchestrator chainOrchestrator;
    private final NarrationSynthesizer narrationSynthesizer;
    private final NarrationScriptWriter scriptWriter;
    private final SceneTimingCalculator timingCalculator;
    private final UgcPromptBuilder promptBuilder;
    private final Clock clock;
    private final double targetSeconds;
    private final double avatarSeconds;
    private final Counter narrationFailureCounter;

    public DefaultAutopilotVideoService(
            ChainOrchestrator chainOrchestrator,
            NarrationSynthesizer narrationSynthesizer,
            NarrationScriptWriter scriptWriter,
            SceneTimingCalculator timingCalculator,
            UgcPromptBuilder promptBuilder,
            AdAutopilotProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.chainOrchestrator = chainOrchestrator;
        this.narrationSynthesizer = narrationSynthesizer;
        this.scriptWriter = scriptWriter;
        this.timingCalculator = timingCalculator;
        this.promptBuilder = promptBuilder;
        this.clock = clock;
        this.targetSeconds = properties.getAutopilot().getTargetSeconds();
        this.avatarSeconds = properties.getAutopilot().isIncludeAvatar()
                ? properties.getAutopilot().getAvatarSeconds()
                : 0;
        this.narrationFailureCounter = meterRegistry.counter("ad_autopilot.narration.failures");
    }

    @Override
    public AutopilotVideoResult generateAutopilotVideo(AutopilotVideoRequest request) {
        List<String> warnings = new ArrayList<>();
        if (request.productImages().size() < MIN_PRODUCT_IMAGES) {
            return AutopilotVideoResult.failed(
                    "At least " + MIN_PRODUCT_IMAGES + " product images are required", warnings);
        }

        List<String> images = request.productImages().size() > MAX_PRODUCT_IMAGES
                ? request.productImages().subList(0, MAX_PRODUCT_IMAGES)
                : request.productImages();

        AutopilotScripts scripts = scriptWriter.defaultScripts(
                request.productName(),
                request.productDescription(),
                request.price(),
                request.originalPrice());
        Map<Scene, NarrationAudio> narration = synthesizeNarration(scripts, request.voiceId(), warnings);

        SceneDurations durations = timingCalculator.adjustToTarget(
                timingCalculator.calculate(narration, avatarSeconds),
                targetSeconds);
        DurationValidation validation = timingCalculator.validateTotalDuration(durations);
        if (!validation.valid()) {
            warnings.add(validation.message());
            logger.warn("Autopilot video for {} is outside the duration window: {}",
                    request.productName(), validation.message());
        }
        logger.info("Planned autopilot video for {} total={}s narratedScenes={} estimatedSpeech={}s",
                request.productName(),
                validation.totalSeconds(),
                narration.size(),
                estimateSpeech(scripts));

        GenerationJob job = GenerationJob.queued(
                UUID.randomUUID().toString(),
                request.ownerId(),
                MediaKind.VIDEO,
                new PromptVariables(request.productName(), String.join(", ", scripts.features()), null, null),
                images.get(0),
                durations,
                clock.instant());

        try {
            GenerationJob started = chainOrchestrator.startSingleStageVideo(
                    job,
                    promptBuilder.renderPrompt(request.productName()),
                    renderProps(request, images, scripts, narration, durations));
            return AutopilotVideoResult.started(started.id(), warnings);
        } catch (ChainStepException e) {
            return AutopilotVideoResult.failed(e.getMessage(), warnings);
        }
    }

    private Map<Scene, NarrationAudio> synthesizeNarration(
            AutopilotScripts scripts,
            String voiceId,
            List<String> warnings) {
        Map<Scene, NarrationAudio> narration = new EnumMap<>(Scene.class);
        for (Map.Entry<Scene, String> line : scripts.narration().entrySet()) {
            try {
                NarrationAudio audio = narrationSynthesizer.synthesize(line.getValue(), voiceId);
                if (audio != null && audio.audioUrl() != null) {
                    narration.put(line.getKey(), audio);
                }
            } catch (RuntimeException e) {
                narrationFailureCounter.increment();
                warnings.add("Narration for " + line.getKey().key() + " failed: " + e.getMessage());
                logger.warn("Narration synthesis failed for scene {}, using default timing", line.getKey().key(), e);
            }
        }
        return narration;
    }

    private double estimateSpeech(AutopilotScripts scripts) {
        return scripts.narration()
                .values()
                .stream()
                .mapToDouble(timingCalculator::estimateSpeechSeconds)
                .sum();
    }

    private Map<String, Object> renderProps(
            AutopilotVideoRequest request,
            List<String> images,
            AutopilotScripts scripts,
            Map<Scene, NarrationAudio> narration,
            SceneDurations durations) {
        Map<String, String> audioUrls = new LinkedHashMap<>();
        narration.forEach((scene, audio) -> audioUrls.put(scene.key(), audio.audioUrl()));

        Map<String, Object> props = new LinkedHashMap<>();
        props.put("compositionId", COMPOSITION_ID);
        props.put("fps", SceneDurations.FPS);
        props.put("width", VIDEO_WIDTH);
        props.put("height", VIDEO_HEIGHT);
        props.put("durationInFrames", durations.totalFrames());
        props.put("sceneDurations", durations.asRenderProps());
        props.put("productName", request.productName());
        props.put("productImages", images);
        props.put("price", request.price());
        if (request.originalPrice() != null) {
            props.put("originalPrice", request.originalPrice());
        }
        Integer discount = scriptWriter.calculateDiscount(request.price(), request.originalPrice());
        if (discount != null) {
            props.put("discountPercent", discount);
        }
        props.put("storeName", request.storeName());
        if (request.logoUrl() != null) {
            props.put("logoUrl", request.logoUrl());
        }
        props.put("hookText", scripts.hook());
        props.put("features", scripts.features());
        props.put("socialProofText", scripts.socialProofText());
        props.put("socialProofName", scripts.socialProofName());
        if (durations.includes(Scene.AVATAR)) {
            props.put("avatarScript", scripts.avatarScript());
        }
        props.put("audioUrls", audioUrls);
        return props;
    }
}
