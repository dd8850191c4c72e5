package tech.regionguard.failover.probe;

import tech.regionguard.failover.model.HealthSample;
import tech.regionguard.failover.model.RegionId;

import java.util.Set;

/**
 * An independent liveness signal for one or more regions.
 */
public interface RegionProbe {

    /**
     * Stable identifier, unique per region.
     */
    String id();

    /**
     * Regions this probe observes.
     */
    Set<RegionId> regions();

    /**
     * Take one sample. A failed observation is returned as {@code success=false};
     * exceptions are also turned into failed samples by the scheduler.
     */
    HealthSample sample(RegionId regionId) throws Exception;
}
