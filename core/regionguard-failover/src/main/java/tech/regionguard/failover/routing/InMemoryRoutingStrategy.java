package tech.regionguard.failover.routing;

import org.jboss.logging.Logger;
import tech.regionguard.failover.model.RegionId;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routing that only remembers the active region. Used when no routing layer is
 * managed by the orchestrator, and in tests.
 */
public class InMemoryRoutingStrategy implements TrafficRoutingStrategy {

    private static final Logger LOG = Logger.getLogger(InMemoryRoutingStrategy.class);

    private final Map<RegionId, Boolean> healthChecks = new ConcurrentHashMap<>();
    private volatile RegionId activeRegion;
    private volatile String lastOperation = "none";

    public InMemoryRoutingStrategy(RegionId initialRegion) {
        this.activeRegion = initialRegion;
    }

    @Override
    public void setActiveRegion(RegionId regionId) {
        if (regionId.equals(activeRegion)) {
            LOG.debugf("In-memory routing already points to %s", regionId);
            return;
        }
        LOG.infof("In-memory routing: active region %s -> %s (no external change)", activeRegion, regionId);
        activeRegion = regionId;
        lastOperation = "set-active:" + regionId;
    }

    @Override
    public boolean healthCheckStatus(RegionId regionId) {
        return healthChecks.getOrDefault(regionId, true);
    }

    /**
     * Override the health reported for a region.
     */
    public void setHealthCheckStatus(RegionId regionId, boolean healthy) {
        healthChecks.put(regionId, healthy);
    }

    @Override
    public Optional<RegionId> activeRegion() {
        return Optional.ofNullable(activeRegion);
    }

    @Override
    public RoutingStatus getStatus() {
        return new RoutingStatus("noop", String.valueOf(activeRegion),
            "No routing layer managed - traffic is not redirected", lastOperation, null);
    }
}
