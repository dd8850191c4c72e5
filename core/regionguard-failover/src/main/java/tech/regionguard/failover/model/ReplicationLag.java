package tech.regionguard.failover.model;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;

/**
 * A lag reading. A stale reading is never zero and never within any bound.
 *
 * @param storeId   store the reading describes, "*" for an aggregate
 * @param regionId  receiving region, null for an aggregate over regions
 * @param lagMillis last known lag, -1 if nothing was ever reported
 */
@Schema(description = "Replication lag reading")
public record ReplicationLag(
    String storeId,
    RegionId regionId,
    long lagMillis,
    boolean stale,
    Instant observedAt
) {

    public static final String ALL_STORES = "*";

    public static ReplicationLag none(RegionId regionId, Instant now) {
        return new ReplicationLag(ALL_STORES, regionId, 0, false, now);
    }

    /**
     * @return true if the lag is known and strictly below the bound
     */
    public boolean isWithin(long boundMillis) {
        return !stale && lagMillis < boundMillis;
    }

    /**
     * @return true if the lag is known and at most the threshold
     */
    public boolean isAtMost(long thresholdMillis) {
        return !stale && lagMillis <= thresholdMillis;
    }

    /**
     * Orders readings from best to worst: stale is worse than any known lag.
     */
    public boolean isWorseThan(ReplicationLag other) {
        if (stale != other.stale) {
            return stale;
        }
        return lagMillis > other.lagMillis;
    }

    public String describe() {
        return stale ? "stale" : lagMillis + "ms";
    }
}
