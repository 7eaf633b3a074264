package github.sarthakdev143.ad_autopilot.service;

import github.sarthakdev143.ad_autopilot.model.publishing.ReconciliationSummary;

/**
 * Pulls the remote status of in-flight publish jobs and records the ones that have settled.
 */
public interface PublishStatusReconciler {

    ReconciliationSummary reconcile();
}
