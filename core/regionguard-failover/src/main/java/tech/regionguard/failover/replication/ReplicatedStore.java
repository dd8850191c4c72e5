package tech.regionguard.failover.replication;

import tech.regionguard.failover.model.RegionId;

/**
 * A replicated data store whose writer can be moved between regions.
 * Lag is reported separately through {@link ReplicationLagTracker}.
 */
public interface ReplicatedStore {

    String storeId();

    /**
     * Make the store accept writes in the target region. Must check the current
     * state first and do nothing if the target already accepts writes.
     *
     * @param planned true for an orderly switchover with both regions reachable (fail-back),
     *                false for a failover away from an impaired region
     * @throws StorePromotionException if the store could not be made writable
     */
    void promoteToWritable(RegionId target, boolean planned) throws StorePromotionException;
}
