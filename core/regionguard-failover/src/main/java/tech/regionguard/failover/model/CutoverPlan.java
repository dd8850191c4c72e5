package tech.regionguard.failover.model;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * An immutable request to move the active region.
 */
@Schema(description = "Cutover plan moving writes and traffic between regions")
public record CutoverPlan(
    String planId,
    Kind kind,
    OperatingMode fromMode,
    OperatingMode toMode,
    RegionId sourceRegion,
    RegionId targetRegion,
    Instant createdAt,
    String reason,
    List<CutoverStep> steps
) {

    public enum Kind {
        FAILOVER,
        FAILBACK
    }

    public CutoverPlan {
        Objects.requireNonNull(planId, "planId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(sourceRegion, "sourceRegion");
        Objects.requireNonNull(targetRegion, "targetRegion");
        if (sourceRegion.equals(targetRegion)) {
            throw new IllegalArgumentException("Source and target region must differ: " + sourceRegion);
        }
        steps = List.copyOf(steps);
    }

    public static CutoverPlan failover(RegionId source, RegionId target, Instant now, String reason) {
        return new CutoverPlan(UUID.randomUUID().toString(), Kind.FAILOVER,
            OperatingMode.FAILOVER_PENDING, OperatingMode.SECONDARY_ACTIVE,
            source, target, now, reason, List.of(CutoverStep.values()));
    }

    public static CutoverPlan failback(RegionId source, RegionId target, Instant now, String reason) {
        return new CutoverPlan(UUID.randomUUID().toString(), Kind.FAILBACK,
            OperatingMode.RECOVERING, OperatingMode.PRIMARY_ACTIVE,
            source, target, now, reason, List.of(CutoverStep.values()));
    }
}
