package github.sarthakdev143.ad_autopilot.exception;

import github.sarthakdev143.ad_autopilot.model.chain.ChainStage;

/**
 * Thrown to the caller of a chain entry point after the job has already been moved to error.
 */
public class ChainStepException extends RuntimeException {

    private final String jobId;
    private final ChainStage stage;

    public ChainStepException(String jobId, ChainStage stage, String message, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
        this.stage = stage;
    }

    public String getJobId() {
        return jobId;
    }

    public ChainStage getStage() {
        return stage;
    }
}
