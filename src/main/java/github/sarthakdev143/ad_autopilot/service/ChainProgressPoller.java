package github.sarthakdev143.ad_autopilot.service;

import github.sarthakdev143.ad_autopilot.model.chain.ChainPollSummary;

public interface ChainProgressPoller {

    /**
     * Advances every in-flight generation job once and settles the autopilot history rows that depend on them.
     */
    ChainPollSummary pollInFlightJobs();
}
