package github.sarthakdev143.ad_autopilot.model.chain;

import github.sarthakdev143.ad_autopilot.exception.IllegalChainTransitionException;

public enum ChainStage {
    QUEUED("queued"),
    GENERATING_IMAGE("generating_image"),
    ANALYZING_IMAGE("analyzing_image"),
    GENERATING_VIDEO("generating_video"),
    COMPLETED("completed"),
    ERROR("error");

    private final String label;

    ChainStage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }

    public boolean isAwaitingProvider() {
        return this == GENERATING_IMAGE || this == GENERATING_VIDEO;
    }

    public boolean canTransitionTo(ChainStage target) {
        if (target == null) {
            return false;
        }
        return switch (this) {
            case QUEUED -> target == GENERATING_IMAGE || target == GENERATING_VIDEO || target == ERROR;
            case GENERATING_IMAGE -> target == ANALYZING_IMAGE || target == ERROR;
            case ANALYZING_IMAGE -> target == GENERATING_VIDEO || target == ERROR;
            case GENERATING_VIDEO -> target == COMPLETED || target == ERROR;
            case ERROR -> target == ERROR;
            case COMPLETED -> false;
        };
    }

    public ChainStage transitionTo(ChainStage target) {
        if (!canTransitionTo(target)) {
            throw new IllegalChainTransitionException(this, target);
        }
        return target;
    }
}
