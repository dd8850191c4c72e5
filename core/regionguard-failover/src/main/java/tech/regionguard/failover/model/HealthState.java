package tech.regionguard.failover.model;

public enum HealthState {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
}
