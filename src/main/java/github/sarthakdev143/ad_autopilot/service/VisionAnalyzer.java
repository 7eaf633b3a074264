package github.sarthakdev143.ad_autopilot.service;

public interface VisionAnalyzer {

    String analyze(String imageUrl, String instructions);
}
