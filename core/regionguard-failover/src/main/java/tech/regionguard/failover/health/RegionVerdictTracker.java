package tech.regionguard.failover.health;

import org.jboss.logging.Logger;
import tech.regionguard.failover.config.HysteresisPolicy;
import tech.regionguard.failover.model.HealthSample;
import tech.regionguard.failover.model.HealthState;
import tech.regionguard.failover.model.HealthVerdict;
import tech.regionguard.failover.model.RegionId;
import tech.regionguard.failover.model.VerdictTransition;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Majority voting and hysteresis for one region. Not thread-safe: owned by the aggregator's
 * ingestion thread.
 *
 * <p>Samples are grouped into rounds holding at most one sample per probe. A round closes
 * when every probe has reported, when a probe reports again (its new sample opens the next
 * round), or when it has been open for the window W. Probes that did not report, or whose
 * sample is older than W at close time, count as failed.</p>
 *
 * <p>A round is failing when a strict majority of the region's probes failed, successful when
 * a strict majority succeeded, and inconclusive otherwise. Inconclusive rounds break both
 * streaks.</p>
 */
class RegionVerdictTracker {

    private static final Logger LOG = Logger.getLogger(RegionVerdictTracker.class);

    enum RoundResult {
        FAILING,
        SUCCESSFUL,
        INCONCLUSIVE
    }

    private final RegionId regionId;
    private final Set<String> probeIds;
    private final HysteresisPolicy policy;
    private final long windowMillis;

    private final Map<String, HealthSample> openRound = new HashMap<>();
    private long roundOpenedAt;

    private HealthState status = HealthState.HEALTHY;
    private int consecutiveFailures;
    private int failuresSinceDegraded;
    private int consecutiveSuccesses;
    private Instant lastTransitionAt;

    RegionVerdictTracker(RegionId regionId, Set<String> probeIds, HysteresisPolicy policy, Instant now) {
        if (probeIds.isEmpty()) {
            throw new IllegalArgumentException("Region " + regionId + " has no probes");
        }
        this.regionId = regionId;
        this.probeIds = Set.copyOf(probeIds);
        this.policy = policy;
        this.windowMillis = policy.window().toMillis();
        this.lastTransitionAt = now;
    }

    /**
     * Resume from a persisted verdict. Streaks restart from zero, except that the
     * failure count is kept so the reported verdict stays consistent.
     */
    void restore(HealthVerdict verdict) {
        this.status = verdict.status();
        this.consecutiveFailures = verdict.consecutiveFailureCount();
        this.failuresSinceDegraded = 0;
        this.consecutiveSuccesses = 0;
        this.lastTransitionAt = verdict.lastTransitionAt();
    }

    /**
     * Add a sample and close whatever rounds it completes.
     *
     * @return transitions caused by this sample, usually none
     */
    List<VerdictTransition> onSample(HealthSample sample) {
        List<VerdictTransition> transitions = new ArrayList<>();
        if (!probeIds.contains(sample.probeId())) {
            LOG.debugf("Ignoring sample from unknown probe %s for region %s", sample.probeId(), regionId);
            return transitions;
        }

        long now = sample.timestampMillis();
        if (!openRound.isEmpty() && now - roundOpenedAt >= windowMillis) {
            closeRound(now).ifPresent(transitions::add);
        }
        if (openRound.containsKey(sample.probeId())) {
            closeRound(now).ifPresent(transitions::add);
        }

        if (openRound.isEmpty()) {
            roundOpenedAt = now;
        }
        openRound.put(sample.probeId(), sample);

        if (openRound.keySet().containsAll(probeIds)) {
            closeRound(now).ifPresent(transitions::add);
        }
        return transitions;
    }

    /**
     * Close the open round if it has outlived the window.
     */
    Optional<VerdictTransition> onTick(long nowMillis) {
        if (!openRound.isEmpty() && nowMillis - roundOpenedAt >= windowMillis) {
            return closeRound(nowMillis);
        }
        return Optional.empty();
    }

    HealthVerdict verdict() {
        return new HealthVerdict(regionId, status, consecutiveFailures, consecutiveSuccesses, lastTransitionAt);
    }

    RegionId regionId() {
        return regionId;
    }

    private Optional<VerdictTransition> closeRound(long closedAt) {
        RoundResult result = evaluate(closedAt);
        openRound.clear();
        return apply(result, closedAt);
    }

    private RoundResult evaluate(long closedAt) {
        int total = probeIds.size();
        long successes = openRound.values().stream()
            .filter(HealthSample::success)
            .filter(s -> closedAt - s.timestampMillis() <= windowMillis)
            .count();
        long failures = total - successes;

        if (failures * 2 > total) {
            return RoundResult.FAILING;
        }
        if (successes * 2 > total) {
            return RoundResult.SUCCESSFUL;
        }
        return RoundResult.INCONCLUSIVE;
    }

    private Optional<VerdictTransition> apply(RoundResult result, long closedAt) {
        HealthState before = status;

        switch (result) {
            case FAILING -> {
                consecutiveSuccesses = 0;
                consecutiveFailures++;
                if (status == HealthState.HEALTHY && consecutiveFailures >= policy.failureRounds()) {
                    status = HealthState.DEGRADED;
                    failuresSinceDegraded = 0;
                } else if (status == HealthState.DEGRADED) {
                    failuresSinceDegraded++;
                    if (failuresSinceDegraded >= policy.unhealthyRounds()) {
                        status = HealthState.UNHEALTHY;
                    }
                }
            }
            case SUCCESSFUL -> {
                consecutiveFailures = 0;
                failuresSinceDegraded = 0;
                consecutiveSuccesses++;
                if (status == HealthState.DEGRADED && consecutiveSuccesses >= policy.degradedRecoveryRounds()) {
                    status = HealthState.HEALTHY;
                } else if (status == HealthState.UNHEALTHY && consecutiveSuccesses >= policy.recoveryRounds()) {
                    status = HealthState.HEALTHY;
                }
            }
            case INCONCLUSIVE -> {
                consecutiveFailures = 0;
                failuresSinceDegraded = 0;
                consecutiveSuccesses = 0;
            }
        }

        if (status == before) {
            return Optional.empty();
        }

        lastTransitionAt = Instant.ofEpochMilli(closedAt);
        LOG.infof("Region %s verdict %s -> %s (%s round, failures=%d, successes=%d)",
            regionId, before, status, result, consecutiveFailures, consecutiveSuccesses);
        return Optional.of(new VerdictTransition(regionId, before, status, verdict()));
    }
}
