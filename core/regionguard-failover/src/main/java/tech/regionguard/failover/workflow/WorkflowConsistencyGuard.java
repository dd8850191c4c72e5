package tech.regionguard.failover.workflow;

import org.jboss.logging.Logger;
import tech.regionguard.failover.alert.AlertSeverity;
import tech.regionguard.failover.alert.AlertSink;
import tech.regionguard.failover.decision.InvalidOperatorActionException;
import tech.regionguard.failover.model.RegionId;
import tech.regionguard.failover.model.SideEffectStatus;
import tech.regionguard.failover.model.WorkflowExecutionRecord;
import tech.regionguard.failover.model.WorkflowStatus;
import tech.regionguard.failover.state.FailoverStateStore;
import tech.regionguard.failover.workflow.ReconciliationReport.Action;
import tech.regionguard.failover.workflow.ReconciliationReport.WorkflowOutcome;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps multi-step workflows consistent across a region cutover.
 *
 * <p>Each workflow's progress is tracked as the index of its last committed step plus the
 * idempotency token of the pending one. After a cutover the pending step is never replayed
 * unless the workflow engine confirms its side effect was not applied; an unknown outcome
 * is handed to an operator instead.</p>
 */
public class WorkflowConsistencyGuard {

    private static final Logger LOG = Logger.getLogger(WorkflowConsistencyGuard.class);

    public enum Resolution {
        APPLIED,
        NOT_APPLIED,
        ABORT
    }

    private final WorkflowEngine engine;
    private final FailoverStateStore stateStore;
    private final AlertSink alertSink;
    private final int maxResumeAttempts;
    private final Clock clock;

    public WorkflowConsistencyGuard(WorkflowEngine engine, FailoverStateStore stateStore, AlertSink alertSink,
                                    int maxResumeAttempts, Clock clock) {
        if (maxResumeAttempts < 1) {
            throw new IllegalArgumentException("maxResumeAttempts must be >= 1, was " + maxResumeAttempts);
        }
        this.engine = engine;
        this.stateStore = stateStore;
        this.alertSink = alertSink;
        this.maxResumeAttempts = maxResumeAttempts;
        this.clock = clock;
    }

    /**
     * Start tracking a workflow. Registering a workflow that is already in flight returns the existing record.
     */
    public synchronized WorkflowExecutionRecord begin(String workflowId, RegionId region) {
        return stateStore.findWorkflow(workflowId)
            .filter(existing -> !existing.status().isTerminal())
            .orElseGet(() -> {
                WorkflowExecutionRecord record = WorkflowExecutionRecord.started(workflowId, region, clock.instant());
                stateStore.saveWorkflow(record);
                LOG.debugf("Tracking workflow %s in %s", workflowId, region);
                return record;
            });
    }

    /**
     * Record that a step's side effect is durable. Idempotent; an older step index is ignored.
     */
    public synchronized WorkflowExecutionRecord stepCommitted(String workflowId, int stepIndex) {
        WorkflowExecutionRecord record = require(workflowId);
        if (record.status().isTerminal()) {
            throw new InvalidOperatorActionException("Workflow " + workflowId + " is already " + record.status());
        }
        if (stepIndex <= record.lastCompletedStepIndex()) {
            return record;
        }
        WorkflowExecutionRecord updated = record.committed(stepIndex, clock.instant());
        stateStore.saveWorkflow(updated);
        return updated;
    }

    public synchronized WorkflowExecutionRecord complete(String workflowId) {
        WorkflowExecutionRecord record = require(workflowId);
        if (record.status() == WorkflowStatus.COMPLETED) {
            return record;
        }
        WorkflowExecutionRecord updated = record.withStatus(WorkflowStatus.COMPLETED, null, clock.instant());
        stateStore.saveWorkflow(updated);
        return updated;
    }

    /**
     * Reconcile the in-flight workflows of a region and resume them in the same region.
     */
    public ReconciliationReport reconcile(RegionId region) {
        return reconcile(region, region);
    }

    /**
     * Reconcile the in-flight workflows of {@code region}, resuming survivors in {@code resumeIn}.
     * One workflow failing never blocks the others.
     */
    public synchronized ReconciliationReport reconcile(RegionId region, RegionId resumeIn) {
        List<WorkflowOutcome> outcomes = new ArrayList<>();
        for (WorkflowExecutionRecord record : inFlight(region)) {
            outcomes.add(reconcileOne(record, resumeIn));
        }
        ReconciliationReport report = new ReconciliationReport(region, outcomes);
        LOG.infof("Workflow reconciliation: %s", report.summary());
        return report;
    }

    /**
     * Operator decision for a workflow flagged for manual reconciliation.
     */
    public synchronized WorkflowExecutionRecord resolveManually(String workflowId, Resolution resolution) {
        WorkflowExecutionRecord record = require(workflowId);
        if (record.status() != WorkflowStatus.MANUAL_RECONCILIATION) {
            throw new InvalidOperatorActionException(
                "Workflow " + workflowId + " is " + record.status() + ", not awaiting manual reconciliation");
        }

        int step = record.pendingStepIndex();
        try {
            WorkflowExecutionRecord updated = switch (resolution) {
                case APPLIED -> {
                    WorkflowExecutionRecord committed = record.committed(step, clock.instant());
                    stateStore.saveWorkflow(committed);
                    engine.resume(workflowId, committed.pendingStepIndex(), committed.idempotencyToken());
                    yield committed;
                }
                case NOT_APPLIED -> {
                    WorkflowExecutionRecord retried = record.retried(clock.instant());
                    stateStore.saveWorkflow(retried);
                    engine.resume(workflowId, step, retried.idempotencyToken());
                    yield retried;
                }
                case ABORT -> {
                    engine.abort(workflowId);
                    WorkflowExecutionRecord aborted = record.withStatus(WorkflowStatus.ABORTED,
                        "aborted by operator", clock.instant());
                    stateStore.saveWorkflow(aborted);
                    yield aborted;
                }
            };
            LOG.infof("Workflow %s resolved manually as %s at step %d", workflowId, resolution, step);
            return updated;
        } catch (WorkflowEngineException e) {
            LOG.errorf(e, "Workflow engine rejected manual resolution %s for %s", resolution, workflowId);
            WorkflowExecutionRecord flagged = record.withStatus(WorkflowStatus.MANUAL_RECONCILIATION,
                "manual resolution " + resolution + " failed: " + e.getMessage(), clock.instant());
            stateStore.saveWorkflow(flagged);
            return flagged;
        }
    }

    public List<WorkflowExecutionRecord> pendingManualReconciliations() {
        return stateStore.listWorkflows().stream()
            .filter(r -> r.status() == WorkflowStatus.MANUAL_RECONCILIATION)
            .sorted(Comparator.comparing(WorkflowExecutionRecord::workflowId))
            .toList();
    }

    private WorkflowOutcome reconcileOne(WorkflowExecutionRecord record, RegionId resumeIn) {
        String workflowId = record.workflowId();
        int step = record.pendingStepIndex();
        try {
            SideEffectStatus status = engine.sideEffectStatus(workflowId, step, record.idempotencyToken());
            switch (status) {
                case APPLIED -> {
                    // Commit first so a crash before resume cannot replay the step
                    WorkflowExecutionRecord committed = record.committed(step, clock.instant()).movedTo(resumeIn, clock.instant());
                    stateStore.saveWorkflow(committed);
                    engine.resume(workflowId, committed.pendingStepIndex(), committed.idempotencyToken());
                    return new WorkflowOutcome(workflowId, Action.RESUMED_NEXT_STEP, committed.pendingStepIndex(),
                        "step " + step + " was applied");
                }
                case NOT_APPLIED -> {
                    if (record.resumeAttempts() >= maxResumeAttempts) {
                        engine.abort(workflowId);
                        stateStore.saveWorkflow(record.withStatus(WorkflowStatus.ABORTED,
                            "step " + step + " not applied after " + record.resumeAttempts() + " attempts",
                            clock.instant()));
                        alertSink.notify(AlertSeverity.WARNING, String.format(
                            "Workflow %s aborted: step %d not applied after %d resume attempts",
                            workflowId, step, record.resumeAttempts()));
                        return new WorkflowOutcome(workflowId, Action.ABORTED, step, "resume attempts exhausted");
                    }
                    WorkflowExecutionRecord retried = record.retried(clock.instant()).movedTo(resumeIn, clock.instant());
                    stateStore.saveWorkflow(retried);
                    engine.resume(workflowId, step, retried.idempotencyToken());
                    return new WorkflowOutcome(workflowId, Action.RETRIED_STEP, step,
                        "attempt " + retried.resumeAttempts() + " with token " + retried.idempotencyToken());
                }
                default -> {
                    return flagForManual(record, "side effect of step " + step + " is unknown");
                }
            }
        } catch (Exception e) {
            LOG.errorf(e, "Reconciliation failed for workflow %s", workflowId);
            return flagForManual(record, "reconciliation failed: " + e.getMessage());
        }
    }

    private WorkflowOutcome flagForManual(WorkflowExecutionRecord record, String reason) {
        WorkflowExecutionRecord flagged = record.withStatus(WorkflowStatus.MANUAL_RECONCILIATION, reason, clock.instant());
        try {
            stateStore.saveWorkflow(flagged);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Could not persist manual reconciliation flag for workflow %s", record.workflowId());
        }
        alertSink.notify(AlertSeverity.WARNING, String.format(
            "Workflow %s needs manual reconciliation at step %d: %s",
            record.workflowId(), record.pendingStepIndex(), reason));
        return new WorkflowOutcome(record.workflowId(), Action.MANUAL_RECONCILIATION, record.pendingStepIndex(), reason);
    }

    /**
     * Union of the guard's own records and the engine's view. The guard's record wins
     * because it holds the committed step index.
     */
    private List<WorkflowExecutionRecord> inFlight(RegionId region) {
        Map<String, WorkflowExecutionRecord> byId = new LinkedHashMap<>();
        for (WorkflowExecutionRecord record : stateStore.listWorkflows()) {
            if (record.region().equals(region) && record.status() == WorkflowStatus.IN_FLIGHT) {
                byId.put(record.workflowId(), record);
            }
        }
        try {
            for (WorkflowExecutionRecord reported : engine.listInFlight(region)) {
                if (byId.containsKey(reported.workflowId())) {
                    continue;
                }
                boolean knownTerminalOrManual = stateStore.findWorkflow(reported.workflowId())
                    .map(r -> r.status() != WorkflowStatus.IN_FLIGHT)
                    .orElse(false);
                if (!knownTerminalOrManual) {
                    byId.put(reported.workflowId(), reported);
                }
            }
        } catch (WorkflowEngineException e) {
            LOG.warnf(e, "Workflow engine could not list in-flight workflows for %s, using tracked records only", region);
        }
        return new ArrayList<>(byId.values());
    }

    private WorkflowExecutionRecord require(String workflowId) {
        return stateStore.findWorkflow(workflowId).orElseThrow(() -> new WorkflowNotFoundException(workflowId));
    }
}
