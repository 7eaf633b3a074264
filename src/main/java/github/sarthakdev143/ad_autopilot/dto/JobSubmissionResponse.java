package github.sarthakdev143.ad_autopilot.dto;

import github.sarthakdev143.ad_autopilot.model.AssetStatus;

public record JobSubmissionResponse(String jobId, AssetStatus status, String stage, String message) {
}
