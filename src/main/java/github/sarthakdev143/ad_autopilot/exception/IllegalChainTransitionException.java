package github.sarthakdev143.ad_autopilot.exception;

import github.sarthakdev143.ad_autopilot.model.chain.ChainStage;

public class IllegalChainTransitionException extends IllegalStateException {

    private final ChainStage from;
    private final ChainStage to;

    public IllegalChainTransitionException(ChainStage from, ChainStage to) {
        super("Illegal chain transition " + from.label() + " -> " + to.label());
        this.from = from;
        this.to = to;
    }

    public ChainStage getFrom() {
        return from;
    }

    public ChainStage getTo() {
        return to;
    }
}
