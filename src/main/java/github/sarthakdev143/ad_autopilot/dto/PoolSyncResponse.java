package github.sarthakdev143.ad_autopilot.dto;

import github.sarthakdev143.ad_autopilot.model.autopilot.PoolStats;

public record PoolSyncResponse(int deactivated, PoolStats stats) {
}
