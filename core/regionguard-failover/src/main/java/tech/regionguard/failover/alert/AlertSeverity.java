package tech.regionguard.failover.alert;

public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL
}
