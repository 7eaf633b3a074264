package github.sarthakdev143.ad_autopilot.scheduler;

import github.sarthakdev143.ad_autopilot.service.AutopilotScheduler;
import github.sarthakdev143.ad_autopilot.service.ChainProgressPoller;
import github.sarthakdev143.ad_autopilot.service.PublishStatusReconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Periodic entry points. Each trigger finishes its pass before the next one of the same kind starts.
 */
@Component
@ConditionalOnProperty(name = "ad-autopilot.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class AutopilotTriggers {

    private static final Logger logger = LoggerFactory.getLogger(AutopilotTriggers.class);

    private final AutopilotScheduler autopilotScheduler;
    private final ChainProgressPoller chainProgressPoller;
    private final PublishStatusReconciler publishStatusReconciler;
    private final Clock clock;

    public AutopilotTriggers(
            AutopilotScheduler autopilotScheduler,
            ChainProgressPoller chainProgressPoller,
            PublishStatusReconciler publishStatusReconciler,
            Clock clock) {
        this.autopilotScheduler = autopilotScheduler;
        this.chainProgressPoller = chainProgressPoller;
        this.publishStatusReconciler = publishStatusReconciler;
        this.clock = clock;
    }

    @Scheduled(cron = "${ad-autopilot.scheduling.autopilot-cron:0 0 * * * *}", zone = "UTC")
    public void runAutopilotCycle() {
        try {
            autopilotScheduler.runDueGenerations(clock.instant());
        } catch (RuntimeException e) {
            logger.error("Autopilot cycle aborted", e);
        }
    }

    @Scheduled(
            fixedDelayString = "${ad-autopilot.scheduling.chain-poll-interval:PT30S}",
            initialDelayString = "${ad-autopilot.scheduling.chain-poll-initial-delay:PT15S}")
    public void pollGenerationChains() {
        try {
            chainProgressPoller.pollInFlightJobs();
        } catch (RuntimeException e) {
            logger.error("Chain progress poll aborted", e);
        }
    }

    @Scheduled(
            fixedDelayString = "${ad-autopilot.scheduling.reconcile-interval:PT5M}",
            initialDelayString = "${ad-autopilot.scheduling.reconcile-initial-delay:PT1M}")
    public void reconcilePublishJobs() {
        try {
            publishStatusReconciler.reconcile();
        } catch (RuntimeException e) {
            logger.error("Publish reconciliation aborted", e);
        }
    }
}
