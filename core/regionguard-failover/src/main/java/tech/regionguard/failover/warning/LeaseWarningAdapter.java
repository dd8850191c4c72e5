package tech.regionguard.failover.warning;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.regionguard.lease.LeaseWarningService;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bridges lease module warnings into the orchestrator's warning store.
 */
@ApplicationScoped
public class LeaseWarningAdapter implements LeaseWarningService {

    @Inject
    WarningService warningService;

    // lease warning id -> warning store id
    private final Map<String, String> warningIds = new ConcurrentHashMap<>();

    @Override
    public void addWarning(String id, String severity, String title, String message) {
        String storedId = warningService.addWarning("LEASE", severity, title + ": " + message, "LeadershipService");
        warningIds.put(id, storedId);
    }

    @Override
    public void acknowledgeWarning(String id) {
        String storedId = warningIds.remove(id);
        if (storedId != null) {
            warningService.acknowledgeWarning(storedId);
        }
    }
}
