package tech.regionguard.failover.replication;

import org.jboss.logging.Logger;
import tech.regionguard.failover.model.RegionId;

/**
 * Store with nothing to promote, e.g. an S3 bucket with cross-region replication
 * where every regional bucket already accepts writes. Its lag is still tracked.
 */
public class NoOpReplicatedStore implements ReplicatedStore {

    private static final Logger LOG = Logger.getLogger(NoOpReplicatedStore.class);

    private final String storeId;

    public NoOpReplicatedStore(String storeId) {
        this.storeId = storeId;
    }

    @Override
    public String storeId() {
        return storeId;
    }

    @Override
    public void promoteToWritable(RegionId target, boolean planned) {
        LOG.debugf("Store %s needs no promotion for %s", storeId, target);
    }
}
