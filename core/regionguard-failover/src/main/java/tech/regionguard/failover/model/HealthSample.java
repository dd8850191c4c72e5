package tech.regionguard.failover.model;

import java.util.Objects;

/**
 * One observation of a region by one probe.
 *
 * @param latencyMillis round-trip latency, null when the probe could not measure it
 */
public record HealthSample(
    RegionId regionId,
    String probeId,
    long timestampMillis,
    boolean success,
    Long latencyMillis
) {

    public HealthSample {
        Objects.requireNonNull(regionId, "regionId");
        Objects.requireNonNull(probeId, "probeId");
    }

    public static HealthSample success(RegionId regionId, String probeId, long timestampMillis, Long latencyMillis) {
        return new HealthSample(regionId, probeId, timestampMillis, true, latencyMillis);
    }

    public static HealthSample failure(RegionId regionId, String probeId, long timestampMillis, Long latencyMillis) {
        return new HealthSample(regionId, probeId, timestampMillis, false, latencyMillis);
    }
}
