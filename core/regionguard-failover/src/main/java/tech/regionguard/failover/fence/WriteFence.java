package tech.regionguard.failover.fence;

import tech.regionguard.failover.model.RegionId;

/**
 * Capability for stopping new writes in a region, so two regions never accept writes at once.
 * {@link #fence} and {@link #lift} are idempotent.
 */
public interface WriteFence {

    void fence(RegionId regionId) throws WriteFenceException;

    void lift(RegionId regionId) throws WriteFenceException;

    boolean isFenced(RegionId regionId) throws WriteFenceException;

    /**
     * Short name used in logs and status output.
     */
    String type();
}
