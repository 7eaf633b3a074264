package github.sarthakdev143.ad_autopilot.model.autopilot;

public enum HistoryStatus {
    PENDING,
    GENERATING,
    READY,
    FAILED;

    public boolean isTerminal() {
        return this == READY || this == FAILED;
    }
}
