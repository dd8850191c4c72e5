package tech.regionguard.failover.decision;

import org.eclipse.microprofile.openapi.annotations.media.Schema;
import tech.regionguard.failover.model.CutoverExecution;
import tech.regionguard.failover.model.HealthVerdict;
import tech.regionguard.failover.model.OperatingMode;
import tech.regionguard.failover.model.RegionId;
import tech.regionguard.failover.model.ReplicationLag;

import java.time.Instant;
import java.util.List;

/**
 * Operator view of the decision engine.
 *
 * @param unresolvedPlanId failed plan that may have moved storage or traffic, null when none
 * @param activeExecution  the running plan with per-step progress, null when idle
 * @param standbyLag       replication lag toward the region that would take over next
 */
@Schema(description = "Current failover operating mode and the inputs it was decided on")
public record EngineStatus(
    OperatingMode mode,
    String reason,
    Instant changedAt,
    RegionId activeRegion,
    boolean leader,
    boolean automationHalted,
    boolean failbackConfirmed,
    String currentPlanId,
    String unresolvedPlanId,
    CutoverExecution activeExecution,
    List<HealthVerdict> verdicts,
    ReplicationLag standbyLag,
    int pendingManualReconciliations
) {
}
