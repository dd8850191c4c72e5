package tech.regionguard.failover.runtime;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.regionguard.failover.config.FailoverConfig;
import tech.regionguard.failover.decision.FailoverDecisionEngine;
import tech.regionguard.failover.replication.CloudWatchReplicationLagPoller;
import tech.regionguard.failover.state.FailoverStateStore;
import tech.regionguard.failover.warning.WarningService;
import tech.regionguard.lease.LeadershipService;

import java.time.Clock;
import java.time.Instant;

/**
 * Periodic failover work: decision cycles, CloudWatch lag polling and retention.
 */
@ApplicationScoped
public class FailoverJobs {

    private static final Logger LOG = Logger.getLogger(FailoverJobs.class);
    private static final int WARNING_RETENTION_HOURS = 24;

    @Inject
    FailoverConfig config;

    @Inject
    FailoverDecisionEngine engine;

    @Inject
    LeadershipService leadershipService;

    @Inject
    FailoverStateStore stateStore;

    @Inject
    WarningService warningService;

    @Inject
    Instance<CloudWatchReplicationLagPoller> lagPoller;

    @Inject
    Clock clock;

    @Scheduled(every = "${failover.decision.interval:5s}", identity = "failover-decision-cycle")
    void decisionCycle() {
        try {
            engine.evaluate();
        } catch (Exception e) {
            LOG.errorf(e, "Failover decision cycle failed");
        }
    }

    @Scheduled(every = "${failover.replication.poll-interval:30s}", identity = "replication-lag-poll")
    void pollReplicationLag() {
        if (!config.replication().cloudwatchEnabled() || !leadershipService.isLeader()) {
            return;
        }
        try {
            int recorded = lagPoller.get().poll();
            LOG.debugf("Recorded %d replication lag sample(s) from CloudWatch", recorded);
        } catch (Exception e) {
            LOG.errorf(e, "Replication lag polling failed");
        }
    }

    @Scheduled(every = "1h", identity = "failover-retention")
    void purgeOldRecords() {
        try {
            Instant now = clock.instant();
            int removed = stateStore.purgeTerminal(now.minus(config.cutover().retention()),
                now.minus(config.workflow().retention()));
            if (removed > 0) {
                LOG.infof("Purged %d terminal plan execution(s) and workflow record(s)", removed);
            }
            warningService.clearOldWarnings(WARNING_RETENTION_HOURS);
        } catch (Exception e) {
            LOG.errorf(e, "Retention purge failed");
        }
    }
}
