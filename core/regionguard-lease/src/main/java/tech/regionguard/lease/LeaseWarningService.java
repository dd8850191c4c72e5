package tech.regionguard.lease;

/**
 * Where the lease module reports leadership loss and Redis outages. The failover
 * module bridges it to its operator warning store.
 */
public interface LeaseWarningService {

    /**
     * @param id       caller-chosen id, later passed to {@link #acknowledgeWarning(String)}
     * @param severity CRITICAL, WARNING or INFO
     */
    void addWarning(String id, String severity, String title, String message);

    /**
     * Mark a warning resolved, e.g. once Redis is reachable again.
     */
    void acknowledgeWarning(String id);
}
