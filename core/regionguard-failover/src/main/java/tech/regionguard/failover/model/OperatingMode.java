package tech.regionguard.failover.model;

/**
 * Process-wide operating mode, owned by the decision engine.
 */
public enum OperatingMode {
    PRIMARY_ACTIVE,
    DEGRADED,
    FAILOVER_PENDING,
    SECONDARY_ACTIVE,
    RECOVERING
}
