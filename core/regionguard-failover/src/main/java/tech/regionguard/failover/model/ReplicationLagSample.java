package tech.regionguard.failover.model;

import java.util.Objects;

/**
 * Lag reported for one store toward one receiving (replica) region.
 */
public record ReplicationLagSample(String storeId, RegionId regionId, long lagMillis, long timestampMillis) {

    public ReplicationLagSample {
        Objects.requireNonNull(storeId, "storeId");
        Objects.requireNonNull(regionId, "regionId");
        if (lagMillis < 0) {
            throw new IllegalArgumentException("lagMillis must not be negative, was " + lagMillis);
        }
    }
}
