package tech.regionguard.failover.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;

/**
 * Quorum verdict for one region.
 */
@Schema(description = "Aggregated health verdict of a region")
public record HealthVerdict(
    @Schema(description = "Region identifier", examples = {"PRIMARY", "SECONDARY"})
    RegionId regionId,

    @Schema(description = "Verdict", examples = {"HEALTHY", "DEGRADED", "UNHEALTHY"})
    HealthState status,

    @Schema(description = "Consecutive failing majority rounds", examples = {"0", "3"})
    int consecutiveFailureCount,

    @Schema(description = "Consecutive successful majority rounds", examples = {"0", "10"})
    int consecutiveSuccessCount,

    @Schema(description = "When the verdict last changed status")
    Instant lastTransitionAt
) {

    public static HealthVerdict initial(RegionId regionId, Instant now) {
        return new HealthVerdict(regionId, HealthState.HEALTHY, 0, 0, now);
    }

    @JsonIgnore
    public boolean isHealthy() {
        return status == HealthState.HEALTHY;
    }
}
