package tech.regionguard.failover.model;

/**
 * A change of a region's verdict status, published to aggregator listeners.
 */
public record VerdictTransition(RegionId regionId, HealthState from, HealthState to, HealthVerdict verdict) {
}
