package tech.regionguard.failover.workflow;

import org.eclipse.microprofile.openapi.annotations.media.Schema;
import tech.regionguard.failover.model.RegionId;

import java.util.List;

/**
 * What reconciliation did with each in-flight workflow of a region.
 */
@Schema(description = "Result of reconciling in-flight workflows after a cutover")
public record ReconciliationReport(RegionId region, List<WorkflowOutcome> outcomes) {

    public enum Action {
        RESUMED_NEXT_STEP,
        RETRIED_STEP,
        ABORTED,
        MANUAL_RECONCILIATION
    }

    public record WorkflowOutcome(String workflowId, Action action, int stepIndex, String detail) {
    }

    public ReconciliationReport {
        outcomes = List.copyOf(outcomes);
    }

    public long count(Action action) {
        return outcomes.stream().filter(o -> o.action() == action).count();
    }

    public boolean needsManualReconciliation() {
        return count(Action.MANUAL_RECONCILIATION) > 0;
    }

    public String summary() {
        return String.format("%d workflow(s) in %s: %d resumed, %d retried, %d aborted, %d manual",
            outcomes.size(), region, count(Action.RESUMED_NEXT_STEP), count(Action.RETRIED_STEP),
            count(Action.ABORTED), count(Action.MANUAL_RECONCILIATION));
    }
}
