package tech.regionguard.app;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;

import java.util.logging.Logger;

/**
 * RegionGuard App startup handler.
 *
 * <p>This deployment includes:
 * <ul>
 *   <li>regionguard-failover - Region probes, health verdicts, decision engine and cutover (config: failover.*)</li>
 *   <li>regionguard-lease - Orchestrator leadership lease in Redis (config: orchestrator-lease.enabled)</li>
 * </ul>
 */
@ApplicationScoped
public class AppStartup {

    private static final Logger LOG = Logger.getLogger(AppStartup.class.getName());

    void onStart(@Observes StartupEvent event) {
        LOG.info("RegionGuard App started");
    }

    void onShutdown(@Observes ShutdownEvent event) {
        LOG.info("RegionGuard App shutdown");
    }
}
