package tech.regionguard.failover.model;

import java.time.Instant;

/**
 * Persisted decision engine state, restored on restart.
 *
 * @param currentPlanId   plan in flight, null when none
 * @param unresolvedPlanId failed plan that may have promoted storage or moved traffic, null when none.
 *                         Cleared when an operator resumes automation.
 */
public record EngineState(
    OperatingMode mode,
    String reason,
    Instant changedAt,
    boolean failbackConfirmed,
    boolean automationHalted,
    String currentPlanId,
    String unresolvedPlanId
) {

    public static EngineState initial(Instant now) {
        return new EngineState(OperatingMode.PRIMARY_ACTIVE, "initial start", now, false, false, null, null);
    }

    public EngineState withMode(OperatingMode newMode, String newReason, Instant now) {
        return new EngineState(newMode, newReason, now, failbackConfirmed, automationHalted, currentPlanId,
            unresolvedPlanId);
    }

    public EngineState withFailbackConfirmed(boolean confirmed) {
        return new EngineState(mode, reason, changedAt, confirmed, automationHalted, currentPlanId, unresolvedPlanId);
    }

    public EngineState withAutomationHalted(boolean halted) {
        return new EngineState(mode, reason, changedAt, failbackConfirmed, halted, currentPlanId, unresolvedPlanId);
    }

    public EngineState withCurrentPlan(String planId) {
        return new EngineState(mode, reason, changedAt, failbackConfirmed, automationHalted, planId, unresolvedPlanId);
    }

    public EngineState withUnresolvedPlan(String planId) {
        return new EngineState(mode, reason, changedAt, failbackConfirmed, automationHalted, currentPlanId, planId);
    }
}
