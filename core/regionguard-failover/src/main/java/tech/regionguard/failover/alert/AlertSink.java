package tech.regionguard.failover.alert;

/**
 * Destination for operator alerts. Delivery is best-effort.
 */
public interface AlertSink {

    /**
     * Deliver an alert. Implementations may block; callers go through {@link AlertDispatcher}.
     */
    void notify(AlertSeverity severity, String message);

    /**
     * Short name used in logs.
     */
    String name();
}
