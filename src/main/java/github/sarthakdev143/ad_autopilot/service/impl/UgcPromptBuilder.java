package github.sarthakdev143.ad_autopilot.service.impl;

import github.sarthakdev143.ad_autopilot.model.PromptVariables;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class UgcPromptBuilder {

    static final String IMAGE_TEMPLATE = "Photorealistic selfie-style photo of {icp} holding {product}. "
            + "Setting: {scene}. Highlight: {features}. "
            + "Looks like it was shot on a phone: natural light, genuine smile, eye contact with the camera, "
            + "product label facing the lens, softly blurred background. "
            + "Authentic and friendly, not a studio advert.";

    static final String CHAINED_VIDEO_TEMPLATE = "Eight second handheld selfie video that continues from the reference image. "
            + "Reference image: {imageAnalysis}. "
            + "{icp} casually talks about {product} and mentions {features}, in one or two natural sentences. "
            + "The person keeps the product in frame, points at the label and keeps eye contact. "
            + "Setting: {scene}, matching the reference image. "
            + "Keep the same person, lighting and surroundings as the reference.";

    static final String RENDER_TEMPLATE = "Autopilot product video: {product}";

    static final String ANALYSIS_INSTRUCTIONS = "Describe this image for a video generator in a single paragraph: "
            + "the person (appearance, clothing, expression), the product they hold and how they hold it, "
            + "the setting and lighting, the overall mood, and any visible branding or text.";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public String imagePrompt(PromptVariables variables) {
        return render(IMAGE_TEMPLATE, asMap(variables, null));
    }

    public String chainedVideoPrompt(PromptVariables variables, String imageAnalysis) {
        return render(CHAINED_VIDEO_TEMPLATE, asMap(variables, imageAnalysis));
    }

    public String renderPrompt(String productName) {
        return render(RENDER_TEMPLATE, Map.of("product", productName == null ? "" : productName));
    }

    public String analysisInstructions() {
        return ANALYSIS_INSTRUCTIONS;
    }

    private Map<String, String> asMap(PromptVariables variables, String imageAnalysis) {
        return Map.of(
                "product", variables.product(),
                "features", variables.features(),
                "icp", variables.icp(),
                "scene", variables.scene(),
                "imageAnalysis", imageAnalysis == null ? "" : sanitize(imageAnalysis));
    }

    private String render(String template, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder rendered = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(value == null ? matcher.group() : value));
        }
        matcher.appendTail(rendered);
        return sanitize(rendered.toString());
    }

    static String sanitize(String value) {
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }
}
