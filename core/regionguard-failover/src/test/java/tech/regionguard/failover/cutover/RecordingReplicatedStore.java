package tech.regionguard.failover.cutover;

import tech.regionguard.failover.model.RegionId;
import tech.regionguard.failover.replication.ReplicatedStore;
import tech.regionguard.failover.replication.StorePromotionException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Store fake that records promotions and can fail or block on demand.
 */
class RecordingReplicatedStore implements ReplicatedStore {

    private final String storeId;
    private final List<RegionId> promotions = new CopyOnWriteArrayList<>();
    private volatile RegionId writer = RegionId.PRIMARY;
    private volatile boolean failing;
    private volatile CountDownLatch gate;

    RecordingReplicatedStore(String storeId) {
        this.storeId = storeId;
    }

    void failPromotions(boolean failing) {
        this.failing = failing;
    }

    void blockUntil(CountDownLatch gate) {
        this.gate = gate;
    }

    List<RegionId> promotions() {
        return promotions;
    }

    RegionId writer() {
        return writer;
    }

    @Override
    public String storeId() {
        return storeId;
    }

    @Override
    public void promoteToWritable(RegionId target, boolean planned) throws StorePromotionException {
        CountDownLatch latch = gate;
        if (latch != null) {
            try {
                latch.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StorePromotionException(storeId + " promotion interrupted", e);
            }
        }
        if (failing) {
            throw new StorePromotionException(storeId + " replica in " + target + " is not ACTIVE");
        }
        if (target.equals(writer)) {
            return;
        }
        promotions.add(target);
        writer = target;
    }
}
