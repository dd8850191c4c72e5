package tech.regionguard.failover.state;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.regionguard.failover.config.FailoverConfig;

import java.nio.file.Path;

/**
 * CDI producer that selects the state store backend from configuration.
 */
@ApplicationScoped
public class FailoverStateStoreProducer {

    private static final Logger LOG = Logger.getLogger(FailoverStateStoreProducer.class);

    @Inject
    FailoverConfig config;

    @Produces
    @ApplicationScoped
    public FailoverStateStore failoverStateStore() {
        FailoverConfig.StateStoreType type = config.state().type();
        LOG.infof("Initializing failover state store: type=%s", type);

        return switch (type) {
            case MEMORY -> {
                LOG.warn("Using in-memory failover state - operating mode will not survive a restart");
                yield new InMemoryFailoverStateStore();
            }
            case FILE -> {
                Path directory = Path.of(config.state().directory());
                LOG.infof("Using file failover state in %s", directory.toAbsolutePath());
                yield new FileFailoverStateStore(directory);
            }
        };
    }
}
