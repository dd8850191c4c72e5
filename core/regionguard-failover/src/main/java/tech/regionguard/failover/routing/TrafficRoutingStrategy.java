package tech.regionguard.failover.routing;

import tech.regionguard.failover.model.RegionId;

import java.util.Optional;

/**
 * Capability for steering client traffic between regions.
 *
 * Implementations must be idempotent: setting the region that is already active is a no-op.
 */
public interface TrafficRoutingStrategy {

    /**
     * Route all traffic to the given region.
     *
     * @throws RoutingException if the change could not be applied
     */
    void setActiveRegion(RegionId regionId) throws RoutingException;

    /**
     * Health of the region as seen by the routing layer's own health checks.
     */
    boolean healthCheckStatus(RegionId regionId) throws RoutingException;

    /**
     * Region currently receiving traffic, empty if it cannot be determined.
     */
    Optional<RegionId> activeRegion() throws RoutingException;

    RoutingStatus getStatus();

    /**
     * Status information for monitoring.
     */
    record RoutingStatus(String strategyType, String activeRegion, String targetInfo, String lastOperation, String lastError) {
    }
}
