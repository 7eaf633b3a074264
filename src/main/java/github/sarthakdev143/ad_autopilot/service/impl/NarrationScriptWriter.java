package github.sarthakdev143.ad_autopilot.service.impl;

import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotScripts;
import github.sarthakdev143.ad_autopilot.model.timing.Scene;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class NarrationScriptWriter {

    static final int FEATURE_COUNT = 4;
    static final String FEATURE_FILLER = "Premium quality";

    public AutopilotScripts defaultScripts(String productName, String features, String price, String originalPrice) {
        List<String> featureList = extractFeatures(features);
        String offer = originalPrice == null || originalPrice.isBlank()
                ? "Available now for just " + price + "."
                : "Originally " + originalPrice + ", now just " + price + "!";

        Map<Scene, String> narration = new EnumMap<>(Scene.class);
        narration.put(Scene.PROBLEM, "Tired of products that never live up to the hype? "
                + "We have all paid for things that just do not work.");
        narration.put(Scene.REVEAL, "Meet " + productName + ". "
                + "This is the fix you have been looking for, and here is why people love it.");
        narration.put(Scene.FEATURES, "Here is what makes " + productName + " different. "
                + String.join(". ", featureList) + ".");
        narration.put(Scene.SOCIAL_PROOF, "I honestly wish I had tried " + productName + " sooner. "
                + "It beat every expectation I had.");
        narration.put(Scene.OFFER, offer + " That is serious value.");
        narration.put(Scene.CTA, "Tap the link below and get yours today.");

        return new AutopilotScripts(
                "Stop scrolling for " + productName + "!",
                narration,
                featureList,
                "I honestly wish I had tried " + productName + " sooner. It beat every expectation I had.",
                "Sarah M.",
                "I have been using " + productName + " for a while now and it is the best purchase I have made. "
                        + "If you are on the fence, go for it.");
    }

    List<String> extractFeatures(String features) {
        List<String> extracted = new ArrayList<>();
        if (features != null) {
            Arrays.stream(features.split("[,\\n]|\\.(?:\\s|$)"))
                    .map(String::trim)
                    .filter(feature -> !feature.isEmpty())
                    .limit(FEATURE_COUNT)
                    .forEach(extracted::add);
        }
        while (extracted.size() < FEATURE_COUNT) {
            extracted.add(FEATURE_FILLER);
        }
        return extracted;
    }

    /**
     * Whole-number discount percentage, or {@code null} when either price cannot be read or there is no saving.
     */
    public Integer calculateDiscount(String price, String originalPrice) {
        Double current = parsePrice(price);
        Double original = parsePrice(originalPrice);
        if (current == null || original == null || original <= 0 || original <= current) {
            return null;
        }
        return (int) Math.round((original - current) / original * 100);
    }

    private Double parsePrice(String value) {
        if (value == null) {
            return null;
        }
        String digits = value.replaceAll("[^0-9.]", "");
        if (digits.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
