package github.sarthakdev143.ad_autopilot.service;

import github.sarthakdev143.ad_autopilot.model.NarrationAudio;

public interface NarrationSynthesizer {

    NarrationAudio synthesize(String text, String voiceId);
}
