package tech.regionguard.failover.replication;

import org.jboss.logging.Logger;
import tech.regionguard.failover.model.RegionId;
import tech.regionguard.failover.model.ReplicationLag;
import tech.regionguard.failover.model.ReplicationLagSample;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Rolling lag estimate per (store, receiving region).
 *
 * A pair that has not reported for twice the expected interval, or never reported since it
 * was registered, is stale. Any stale pair makes an aggregate reading stale.
 */
public class ReplicationLagTracker {

    private static final Logger LOG = Logger.getLogger(ReplicationLagTracker.class);

    private final Clock clock;
    private final long staleAfterMillis;
    private final Map<Key, Estimate> estimates = new ConcurrentHashMap<>();

    private record Key(String storeId, RegionId regionId) {
    }

    /**
     * @param lagMillis       -1 until the first sample arrives
     * @param timestampMillis sample time, or registration time when nothing was reported
     */
    private record Estimate(long lagMillis, long timestampMillis, boolean reported) {
    }

    public ReplicationLagTracker(Clock clock, Duration expectedInterval) {
        this.clock = clock;
        this.staleAfterMillis = expectedInterval.multipliedBy(2).toMillis();
    }

    /**
     * Declare a store replicating into a region. Until it reports, its lag is stale.
     */
    public void register(String storeId, RegionId receivingRegion) {
        estimates.putIfAbsent(new Key(storeId, receivingRegion), new Estimate(-1, clock.millis(), false));
    }

    public boolean record(String storeId, RegionId receivingRegion, long lagMillis) {
        return record(new ReplicationLagSample(storeId, receivingRegion, lagMillis, clock.millis()));
    }

    /**
     * Record a sample. Samples older than the current estimate are rejected.
     *
     * @return true if the estimate was updated
     */
    public boolean record(ReplicationLagSample sample) {
        Objects.requireNonNull(sample, "sample");
        Key key = new Key(sample.storeId(), sample.regionId());
        boolean[] accepted = {false};

        estimates.compute(key, (k, current) -> {
            if (current != null && current.reported() && sample.timestampMillis() < current.timestampMillis()) {
                return current;
            }
            accepted[0] = true;
            return new Estimate(sample.lagMillis(), sample.timestampMillis(), true);
        });

        if (!accepted[0]) {
            LOG.debugf("Rejected out-of-order lag sample for %s -> %s at %d",
                sample.storeId(), sample.regionId(), sample.timestampMillis());
        }
        return accepted[0];
    }

    /**
     * Worst lag of one store across its receiving regions. An unknown store reads as stale.
     */
    public ReplicationLag currentLag(String storeId) {
        ReplicationLag lag = worst(storeId, null, k -> k.storeId().equals(storeId));
        if (lag == null) {
            return new ReplicationLag(storeId, null, -1, true, clock.instant());
        }
        return lag;
    }

    /**
     * Worst lag over every tracked store and region. Zero when nothing is tracked.
     */
    public ReplicationLag worstLag() {
        ReplicationLag lag = worst(ReplicationLag.ALL_STORES, null, k -> true);
        return lag != null ? lag : ReplicationLag.none(null, clock.instant());
    }

    /**
     * Worst lag over the stores replicating into a region. Zero when none do.
     */
    public ReplicationLag worstLag(RegionId receivingRegion) {
        ReplicationLag lag = worst(ReplicationLag.ALL_STORES, receivingRegion, k -> k.regionId().equals(receivingRegion));
        return lag != null ? lag : ReplicationLag.none(receivingRegion, clock.instant());
    }

    /**
     * Every tracked pair, ordered by store and region.
     */
    public List<ReplicationLag> snapshot() {
        long now = clock.millis();
        List<ReplicationLag> result = new ArrayList<>();
        estimates.forEach((key, estimate) -> result.add(toLag(key.storeId(), key.regionId(), estimate, now)));
        result.sort(Comparator.comparing(ReplicationLag::storeId)
            .thenComparing(l -> l.regionId().value()));
        return result;
    }

    private ReplicationLag worst(String label, RegionId regionLabel, Predicate<Key> filter) {
        long now = clock.millis();
        ReplicationLag worst = null;
        boolean anyStale = false;

        for (Map.Entry<Key, Estimate> entry : estimates.entrySet()) {
            if (!filter.test(entry.getKey())) {
                continue;
            }
            ReplicationLag lag = toLag(entry.getKey().storeId(), entry.getKey().regionId(), entry.getValue(), now);
            anyStale |= lag.stale();
            if (worst == null || lag.lagMillis() > worst.lagMillis()) {
                worst = lag;
            }
        }

        if (worst == null) {
            return null;
        }
        return new ReplicationLag(label, regionLabel, worst.lagMillis(), anyStale, Instant.ofEpochMilli(now));
    }

    private ReplicationLag toLag(String storeId, RegionId regionId, Estimate estimate, long now) {
        boolean stale = !estimate.reported() || now - estimate.timestampMillis() > staleAfterMillis;
        return new ReplicationLag(storeId, regionId, estimate.lagMillis(), stale,
            Instant.ofEpochMilli(estimate.timestampMillis()));
    }
}
