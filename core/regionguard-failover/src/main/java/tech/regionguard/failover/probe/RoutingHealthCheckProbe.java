package tech.regionguard.failover.probe;

import tech.regionguard.failover.model.HealthSample;
import tech.regionguard.failover.model.RegionId;
import tech.regionguard.failover.routing.RoutingException;
import tech.regionguard.failover.routing.TrafficRoutingStrategy;

import java.time.Clock;
import java.util.Set;

/**
 * Uses the routing layer's own health checks (Route 53 in AWS) as a probe signal.
 * Gives an independent network path from the HTTP probes.
 */
public class RoutingHealthCheckProbe implements RegionProbe {

    public static final String PROBE_ID = "routing-health-check";

    private final TrafficRoutingStrategy routing;
    private final Set<RegionId> regions;
    private final Clock clock;

    public RoutingHealthCheckProbe(TrafficRoutingStrategy routing, Set<RegionId> regions, Clock clock) {
        this.routing = routing;
        this.regions = Set.copyOf(regions);
        this.clock = clock;
    }

    @Override
    public String id() {
        return PROBE_ID;
    }

    @Override
    public Set<RegionId> regions() {
        return regions;
    }

    @Override
    public HealthSample sample(RegionId regionId) throws RoutingException {
        long start = clock.millis();
        boolean healthy = routing.healthCheckStatus(regionId);
        long end = clock.millis();
        return new HealthSample(regionId, PROBE_ID, end, healthy, end - start);
    }
}
