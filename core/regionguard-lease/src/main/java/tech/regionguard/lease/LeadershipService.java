package tech.regionguard.lease;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import java.time.Clock;
import java.time.Instant;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Tracks whether this instance is the orchestrator leader, and under which lease epoch.
 *
 * <p>Followers try to acquire on every tick, the leader renews. Losing the lease, or failing
 * to reach Redis for longer than the lease TTL, drops the epoch to 0 without stopping the
 * process. Plan execution calls {@link #confirm(long)} before each step, which re-checks the
 * epoch in Redis rather than trusting the last tick.</p>
 *
 * <p>With the lease disabled the instance always leads with epoch {@value #SINGLE_INSTANCE_EPOCH}.</p>
 */
@ApplicationScoped
public class LeadershipService {

    private static final Logger LOG = Logger.getLogger(LeadershipService.class.getName());

    static final long SINGLE_INSTANCE_EPOCH = 1;

    @Inject
    LeaseConfig leaseConfig;

    @Inject
    LeaseManager leaseManager;

    @Inject
    Instance<LeaseWarningService> warningServiceInstance;

    Clock clock = Clock.systemUTC();

    private volatile long epoch;
    private volatile Instant lastConfirmed;
    private volatile boolean redisAvailable = true;
    private volatile String outageWarningId;

    void onStartup(@Observes StartupEvent event) {
        if (!leaseConfig.enabled()) {
            epoch = SINGLE_INSTANCE_EPOCH;
            lastConfirmed = clock.instant();
            LOG.info("Orchestrator lease disabled, this instance is the leader");
            return;
        }
        LOG.info("Orchestrator lease enabled: instance " + leaseConfig.instanceId() + ", key " +
                leaseConfig.leaseKey() + ", TTL " + leaseConfig.leaseTtlSeconds() + "s");
        tick();
        if (epoch == 0 && redisAvailable) {
            LOG.info("Follower: lease held by " + leaseManager.currentHolder());
        }
    }

    /**
     * Renew as leader, try to acquire as follower.
     */
    @Scheduled(every = "${orchestrator-lease.renew-interval:10s}", identity = "orchestrator-lease")
    void tick() {
        if (!leaseConfig.enabled()) {
            return;
        }
        long held = epoch;
        try {
            if (held == 0) {
                long acquired = leaseManager.acquire();
                if (acquired > 0) {
                    epoch = acquired;
                    lastConfirmed = clock.instant();
                    LOG.info("Leading failover decisions with lease epoch " + acquired);
                }
            } else if (leaseManager.renew(held)) {
                lastConfirmed = clock.instant();
            } else {
                stepDown(held, "lease expired or was taken over by " + leaseManager.currentHolder());
            }
            redisRestored();
        } catch (LeaseManager.LeaseException e) {
            redisUnavailable(e);
        }
    }

    /**
     * Check with Redis that this instance still holds {@code expected}. A rejected epoch steps
     * this instance down; an unreachable Redis only fails this check.
     */
    public boolean confirm(long expected) {
        if (expected <= 0 || expected != epoch) {
            return false;
        }
        if (!leaseConfig.enabled()) {
            return true;
        }
        try {
            if (leaseManager.renew(expected)) {
                lastConfirmed = clock.instant();
                redisRestored();
                return true;
            }
            stepDown(expected, "epoch superseded");
            return false;
        } catch (LeaseManager.LeaseException e) {
            redisUnavailable(e);
            return false;
        }
    }

    void onShutdown(@Observes ShutdownEvent event) {
        long held = epoch;
        if (!leaseConfig.enabled() || held == 0) {
            return;
        }
        epoch = 0;
        if (leaseManager.release(held)) {
            LOG.info("Orchestrator lease released, peer can take over immediately");
        }
    }

    /**
     * @return true if this instance may evaluate failover decisions
     */
    public boolean isLeader() {
        return epoch > 0;
    }

    public OptionalLong currentEpoch() {
        long current = epoch;
        return current > 0 ? OptionalLong.of(current) : OptionalLong.empty();
    }

    public LeadershipStatus getStatus() {
        boolean enabled = leaseConfig.enabled();
        return new LeadershipStatus(
                leaseConfig.instanceId(),
                enabled,
                epoch,
                redisAvailable,
                lastConfirmed,
                enabled ? leaseManager.currentHolder() : leaseConfig.instanceId(),
                outageWarningId != null
        );
    }

    private void stepDown(long lostEpoch, String reason) {
        if (epoch != lostEpoch) {
            return;
        }
        epoch = 0;
        LOG.severe("Stepped down from orchestrator leadership (epoch " + lostEpoch + "): " + reason);
        raiseWarning(UUID.randomUUID().toString(), "CRITICAL", "Orchestrator Leadership Lost",
                "Instance " + leaseConfig.instanceId() + " lost lease epoch " + lostEpoch +
                " and stopped driving failover: " + reason);
    }

    private void redisUnavailable(LeaseManager.LeaseException e) {
        redisAvailable = false;
        LOG.severe("Orchestrator lease store unreachable: " + e.getMessage());
        if (outageWarningId == null) {
            outageWarningId = UUID.randomUUID().toString();
            raiseWarning(outageWarningId, "CRITICAL", "Orchestrator Lease Redis Connection Lost",
                    "Redis is unavailable, instance " + leaseConfig.instanceId() +
                    " cannot confirm its lease and will not run cutover steps");
        }
        long held = epoch;
        Instant confirmed = lastConfirmed;
        if (held > 0 && confirmed != null
                && confirmed.plusSeconds(leaseConfig.leaseTtlSeconds()).isBefore(clock.instant())) {
            stepDown(held, "not renewed within the " + leaseConfig.leaseTtlSeconds() + "s TTL");
        }
    }

    private void redisRestored() {
        redisAvailable = true;
        String warningId = outageWarningId;
        if (warningId != null) {
            outageWarningId = null;
            LOG.info("Orchestrator lease store reachable again");
            if (warningServiceInstance.isResolvable()) {
                try {
                    warningServiceInstance.get().acknowledgeWarning(warningId);
                } catch (RuntimeException e) {
                    LOG.warning("Could not acknowledge lease warning: " + e.getMessage());
                }
            }
        }
    }

    private void raiseWarning(String id, String severity, String title, String message) {
        if (!warningServiceInstance.isResolvable()) {
            return;
        }
        try {
            warningServiceInstance.get().addWarning(id, severity, title, message);
        } catch (RuntimeException e) {
            LOG.severe("Could not raise lease warning: " + e.getMessage());
        }
    }

    /**
     * Leadership snapshot for the readiness check.
     *
     * @param epoch current lease epoch, 0 while follower
     */
    public record LeadershipStatus(
            String instanceId,
            boolean leaseEnabled,
            long epoch,
            boolean redisAvailable,
            Instant lastConfirmed,
            String currentHolder,
            boolean hasWarning
    ) {

        public boolean leader() {
            return epoch > 0;
        }
    }
}
