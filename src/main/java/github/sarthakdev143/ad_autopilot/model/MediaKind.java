package github.sarthakdev143.ad_autopilot.model;

public enum MediaKind {
    IMAGE,
    VIDEO
}
