package github.sarthakdev143.ad_autopilot.model;

public enum AssetStatus {
    PROCESSING,
    READY,
    ERROR;

    public boolean isTerminal() {
        return this != PROCESSING;
    }
}
