package github.sarthakdev143.ad_autopilot.service.impl;

import github.sarthakdev143.ad_autopilot.model.autopilot.AutopilotScripts;
import github.sarthakdev143.ad_autopilot.model.timing.Scene;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NarrationScriptWriterTest {

    private final NarrationScriptWriter writer = new NarrationScriptWriter();

    @Test
    void featuresAreSplitOnCommasNewlinesAndSentenceEnds() {
        assertThat(writer.extractFeatures("Dimmable, USB-C charging\nLasts 2.5 days. Folds flat. Ships free"))
                .containsExactly("Dimmable", "USB-C charging", "Lasts 2.5 days", "Folds flat");
    }

    @Test
    void missingFeaturesArePaddedWithFiller() {
        assertThat(writer.extractFeatures("Waterproof")).containsExactly(
                "Waterproof", "Premium quality", "Premium quality", "Premium quality");
        assertThat(writer.extractFeatures(null)).hasSize(4).containsOnly("Premium quality");
    }

    @Test
    void defaultScriptsNarrateEverySpokenScene() {
        AutopilotScripts scripts = writer.defaultScripts("Desk Lamp", "Dimmable", "$30", null);

        assertThat(scripts.narration()).containsOnlyKeys(
                Scene.PROBLEM, Scene.REVEAL, Scene.FEATURES, Scene.SOCIAL_PROOF, Scene.OFFER, Scene.CTA);
        assertThat(scripts.hook()).isEqualTo("Stop scrolling for Desk Lamp!");
        assertThat(scripts.narrationFor(Scene.OFFER)).startsWith("Available now for just $30.");
        assertThat(scripts.narrationFor(Scene.FEATURES)).contains("Dimmable");
    }

    @Test
    void offerMentionsOriginalPriceWhenDiscounted() {
        AutopilotScripts scripts = writer.defaultScripts("Desk Lamp", "", "$30", "$40");

        assertThat(scripts.narrationFor(Scene.OFFER)).startsWith("Originally $40, now just $30!");
    }

    @Test
    void discountIsWholePercentOnlyWhenThereIsASaving() {
        assertThat(writer.calculateDiscount("$30.00", "$40.00")).isEqualTo(25);
        assertThat(writer.calculateDiscount("19.99", "29.99")).isEqualTo(33);
        assertThat(writer.calculateDiscount("40", "30")).isNull();
        assertThat(writer.calculateDiscount("free", "30")).isNull();
        assertThat(writer.calculateDiscount("30", null)).isNull();
    }
}
