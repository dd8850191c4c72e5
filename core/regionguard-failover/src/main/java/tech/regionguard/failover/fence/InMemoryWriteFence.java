package tech.regionguard.failover.fence;

import org.jboss.logging.Logger;
import tech.regionguard.failover.model.RegionId;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fence flags kept in memory only. Writers are not actually stopped; used where
 * fencing is enforced elsewhere, and in tests.
 */
public class InMemoryWriteFence implements WriteFence {

    private static final Logger LOG = Logger.getLogger(InMemoryWriteFence.class);

    private final Set<RegionId> fenced = ConcurrentHashMap.newKeySet();

    @Override
    public void fence(RegionId regionId) {
        if (fenced.add(regionId)) {
            LOG.infof("Write fence raised for %s (in-memory)", regionId);
        }
    }

    @Override
    public void lift(RegionId regionId) {
        if (fenced.remove(regionId)) {
            LOG.infof("Write fence lifted for %s (in-memory)", regionId);
        }
    }

    @Override
    public boolean isFenced(RegionId regionId) {
        return fenced.contains(regionId);
    }

    @Override
    public String type() {
        return "noop";
    }
}
