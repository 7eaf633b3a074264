package github.sarthakdev143.ad_autopilot.model.chain;

public record ChainPollSummary(int swept, int checked, int historiesReady, int historiesFailed) {
}
