package tech.regionguard.failover.warning;

import java.util.List;

/**
 * Store of operator-visible warnings.
 */
public interface WarningService {

    /**
     * Add a new warning.
     *
     * @return the generated warning id
     */
    String addWarning(String category, String severity, String message, String source);

    /**
     * All warnings, newest first.
     */
    List<Warning> getAllWarnings();

    List<Warning> getUnacknowledgedWarnings();

    /**
     * @return true if the warning existed
     */
    boolean acknowledgeWarning(String warningId);

    void clearOldWarnings(int hoursOld);
}
