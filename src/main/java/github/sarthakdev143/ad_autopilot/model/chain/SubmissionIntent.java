package github.sarthakdev143.ad_autopilot.model.chain;

import java.time.Instant;

/**
 * Written before a provider submission is attempted and cleared once the provider job id is stored,
 * so a crash in between leaves a trace that the stalled-job sweep can act on.
 */
public record SubmissionIntent(ChainStage targetStage, Instant recordedAt) {
}
