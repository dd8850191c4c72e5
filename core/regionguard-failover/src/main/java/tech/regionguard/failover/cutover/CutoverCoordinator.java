package tech.regionguard.failover.cutover;

import org.jboss.logging.Logger;
import tech.regionguard.failover.alert.AlertSeverity;
import tech.regionguard.failover.alert.AlertSink;
import tech.regionguard.failover.config.CutoverSettings;
import tech.regionguard.failover.decision.InvalidOperatorActionException;
import tech.regionguard.failover.fence.WriteFence;
import tech.regionguard.failover.fence.WriteFenceException;
import tech.regionguard.failover.model.CutoverExecution;
import tech.regionguard.failover.model.CutoverPlan;
import tech.regionguard.failover.model.CutoverStep;
import tech.regionguard.failover.model.RegionId;
import tech.regionguard.failover.model.ReplicationLag;
import tech.regionguard.failover.model.StepProgress;
import tech.regionguard.failover.replication.ReplicatedStore;
import tech.regionguard.failover.replication.ReplicationLagTracker;
import tech.regionguard.failover.routing.RoutingException;
import tech.regionguard.failover.routing.TrafficRoutingStrategy;
import tech.regionguard.failover.state.FailoverStateStore;
import tech.regionguard.failover.workflow.ReconciliationReport;
import tech.regionguard.failover.workflow.WorkflowConsistencyGuard;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes cutover plans step by step.
 *
 * <h2>Steps</h2>
 * <ol>
 *   <li>Fence writes in the source region</li>
 *   <li>Wait for replication toward the target to drain</li>
 *   <li>Promote every replicated store in the target region</li>
 *   <li>Point traffic at the target region</li>
 *   <li>Reconcile in-flight workflows</li>
 *   <li>Mark the plan succeeded</li>
 * </ol>
 *
 * <p>Every step checks current state before acting, so a plan resumed after a restart
 * can replay its first unfinished step safely. Each step runs on the step executor with
 * a bounded timeout and progress is persisted after every step. A failed step halts the
 * plan; nothing is retried automatically.</p>
 *
 * <p>A plan is stamped with the orchestrator lease epoch when it is claimed, and the epoch is
 * re-confirmed before each step. If it cannot be confirmed the plan pauses, still IN_PROGRESS,
 * without touching fences, storage or routing, so whichever instance holds the lease next
 * resumes it from the persisted progress.</p>
 *
 * <p>Only one plan runs at a time.</p>
 */
public class CutoverCoordinator {

    private static final Logger LOG = Logger.getLogger(CutoverCoordinator.class);

    private final WriteFence writeFence;
    private final ReplicationLagTracker lagTracker;
    private final List<ReplicatedStore> stores;
    private final TrafficRoutingStrategy routing;
    private final LeadershipCheck leadership;
    private final WorkflowConsistencyGuard workflowGuard;
    private final FailoverStateStore stateStore;
    private final AlertSink alertSink;
    private final CutoverSettings settings;
    private final Clock clock;
    private final ExecutorService stepExecutor;

    private final Object monitor = new Object();
    private CutoverExecution active;
    private String cancelRequestedFor;

    public CutoverCoordinator(WriteFence writeFence, ReplicationLagTracker lagTracker, List<ReplicatedStore> stores,
                              TrafficRoutingStrategy routing, LeadershipCheck leadership,
                              WorkflowConsistencyGuard workflowGuard, FailoverStateStore stateStore,
                              AlertSink alertSink, CutoverSettings settings, Clock clock,
                              ExecutorService stepExecutor) {
        this.writeFence = writeFence;
        this.lagTracker = lagTracker;
        this.stores = List.copyOf(stores);
        this.routing = routing;
        this.leadership = leadership;
        this.workflowGuard = workflowGuard;
        this.stateStore = stateStore;
        this.alertSink = alertSink;
        this.settings = settings;
        this.clock = clock;
        this.stepExecutor = stepExecutor;
    }

    /**
     * Run a new plan. Blocks the calling thread until the plan reaches a terminal outcome or
     * pauses because the orchestrator lease could not be confirmed.
     *
     * @throws PlanInProgressException if another plan is running
     */
    public CutoverExecution execute(CutoverPlan plan) {
        CutoverExecution execution = claim(CutoverExecution.start(plan, clock.instant()));
        LOG.infof("Starting %s plan %s: %s -> %s (%s)", plan.kind(), plan.planId(),
            plan.sourceRegion(), plan.targetRegion(), plan.reason());
        return run(execution);
    }

    /**
     * Continue an execution from its first unfinished step, typically after a restart.
     */
    public CutoverExecution resume(CutoverExecution execution) {
        if (execution.isTerminal()) {
            return execution;
        }
        CutoverExecution claimed = claim(execution);
        LOG.infof("Resuming plan %s from step %s", execution.planId(),
            execution.nextStep().map(CutoverStep::name).orElse("none"));
        return run(claimed);
    }

    /**
     * Request cancellation. Takes effect before the next step starts.
     *
     * @throws PlanCommittedException if a step with an external side effect has completed
     * @throws InvalidOperatorActionException if the plan is not running
     */
    public CutoverExecution cancel(String planId) {
        synchronized (monitor) {
            if (active == null || !active.planId().equals(planId)) {
                throw new InvalidOperatorActionException("Plan " + planId + " is not running");
            }
            if (active.committed()) {
                throw new PlanCommittedException(planId, active.lastSuccessfulStep());
            }
            cancelRequestedFor = planId;
            LOG.warnf("Cancellation requested for plan %s", planId);
            return active;
        }
    }

    /**
     * Operator release of a region's write fence, typically left up by a plan that failed after
     * promotion started.
     *
     * @throws PlanInProgressException if a plan is running
     */
    public void liftWriteFence(RegionId region) throws WriteFenceException {
        synchronized (monitor) {
            if (active != null) {
                throw new PlanInProgressException(active.planId());
            }
        }
        writeFence.lift(region);
        LOG.warnf("Write fence in %s lifted by operator", region);
    }

    public Optional<CutoverExecution> activeExecution() {
        synchronized (monitor) {
            return Optional.ofNullable(active);
        }
    }

    private CutoverExecution claim(CutoverExecution execution) {
        CutoverExecution stamped = execution.withLeaseEpoch(leadership.currentEpoch().orElse(0));
        synchronized (monitor) {
            if (active != null) {
                throw new PlanInProgressException(active.planId());
            }
            active = stamped;
            cancelRequestedFor = null;
        }
        persist(stamped);
        return stamped;
    }

    private CutoverExecution run(CutoverExecution start) {
        CutoverExecution execution = start;
        try {
            while (true) {
                Optional<CutoverStep> next = execution.nextStep();
                if (next.isEmpty()) {
                    execution = execution.finish(CutoverExecution.Status.SUCCEEDED, null, clock.instant());
                    persist(execution);
                    LOG.infof("Plan %s SUCCEEDED: %s now active", execution.planId(), execution.plan().targetRegion());
                    return execution;
                }

                if (isCancelRequested(execution.planId())) {
                    if (!execution.committed()) {
                        return cancelExecution(execution);
                    }
                    LOG.warnf("Plan %s committed while cancellation was pending, running to completion",
                        execution.planId());
                    clearCancelRequest();
                }

                CutoverStep step = next.get();
                if (!leadership.confirm(execution.leaseEpoch())) {
                    return pause(execution, step);
                }
                StepProgress progress = progressOf(execution, step).running(clock.instant());
                execution = update(execution, progress);
                LOG.infof("Plan %s step %d/%d %s started", execution.planId(), step.number(),
                    execution.steps().size(), step);

                try {
                    String detail = runWithTimeout(execution.plan(), step);
                    execution = update(execution, progress.succeeded(clock.instant(), detail));
                    LOG.infof("Plan %s step %d %s succeeded: %s", execution.planId(), step.number(), step, detail);
                } catch (StepCancelledException e) {
                    execution = update(execution, progress.failed(clock.instant(), "cancelled"));
                    return cancelExecution(execution);
                } catch (StepFailedException e) {
                    execution = update(execution, progress.failed(clock.instant(), e.getMessage()));
                    return fail(execution, step, e.getMessage());
                }
            }
        } finally {
            synchronized (monitor) {
                active = null;
                cancelRequestedFor = null;
            }
        }
    }

    private String runWithTimeout(CutoverPlan plan, CutoverStep step) throws StepFailedException, StepCancelledException {
        Duration timeout = step == CutoverStep.VERIFY_REPLICATION_DRAINED
            ? settings.drainStepTimeout()
            : settings.stepTimeout();

        Future<String> future = stepExecutor.submit(() -> runStep(plan, step));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StepFailedException(step + " timed out after " + timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StepFailedException(step + " interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StepCancelledException cancelled) {
                throw cancelled;
            }
            if (cause instanceof StepFailedException failed) {
                throw failed;
            }
            throw new StepFailedException(step + " failed: " + cause.getMessage(), cause);
        }
    }

    private String runStep(CutoverPlan plan, CutoverStep step) throws Exception {
        return switch (step) {
            case STOP_SOURCE_WRITES -> stopSourceWrites(plan.sourceRegion());
            case VERIFY_REPLICATION_DRAINED -> verifyReplicationDrained(plan);
            case PROMOTE_TARGET_STORAGE -> promoteTargetStorage(plan);
            case REDIRECT_TRAFFIC -> redirectTraffic(plan.targetRegion());
            case RECONCILE_WORKFLOWS -> reconcileWorkflows(plan);
            case MARK_SUCCEEDED -> "plan complete";
        };
    }

    private String stopSourceWrites(RegionId source) throws WriteFenceException {
        if (isFencedQuietly(source)) {
            return "writes already fenced in " + source;
        }
        writeFence.fence(source);
        return "writes fenced in " + source + " via " + writeFence.type();
    }

    private String verifyReplicationDrained(CutoverPlan plan) throws StepFailedException, StepCancelledException {
        RegionId target = plan.targetRegion();
        long deadline = clock.millis() + settings.drainTimeout().toMillis();
        ReplicationLag lag = lagTracker.worstLag(target);

        while (!lag.isAtMost(settings.drainThresholdMillis())) {
            if (clock.millis() >= deadline) {
                break;
            }
            if (isCancelRequested(plan.planId())) {
                throw new StepCancelledException();
            }
            try {
                Thread.sleep(settings.drainPollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StepFailedException("interrupted while waiting for replication to drain");
            }
            lag = lagTracker.worstLag(target);
        }

        if (lag.isAtMost(settings.drainThresholdMillis())) {
            return "replication drained: " + lag.describe();
        }
        if (lag.isAtMost(settings.acceptedDataLossMillis())) {
            alertSink.notify(AlertSeverity.WARNING, String.format(
                "Plan %s: replication toward %s did not drain within %s, accepting %s (limit %dms)",
                plan.planId(), target, settings.drainTimeout(), lag.describe(), settings.acceptedDataLossMillis()));
            return "accepted residual lag: " + lag.describe();
        }
        throw new StepFailedException("replication toward " + target + " not drained: " + lag.describe());
    }

    private String promoteTargetStorage(CutoverPlan plan) throws Exception {
        boolean planned = plan.kind() == CutoverPlan.Kind.FAILBACK;
        for (ReplicatedStore store : stores) {
            store.promoteToWritable(plan.targetRegion(), planned);
            LOG.infof("Store %s writable in %s", store.storeId(), plan.targetRegion());
        }
        // A fail-back target was fenced by the earlier failover
        writeFence.lift(plan.targetRegion());
        return stores.size() + " store(s) writable in " + plan.targetRegion() + (planned ? " (switchover)" : " (failover)");
    }

    private String redirectTraffic(RegionId target) throws RoutingException {
        Optional<RegionId> current = Optional.empty();
        try {
            current = routing.activeRegion();
        } catch (RoutingException e) {
            LOG.debugf("Could not read active region before redirect: %s", e.getMessage());
        }
        if (current.isPresent() && current.get().equals(target)) {
            return "traffic already routed to " + target;
        }
        routing.setActiveRegion(target);
        return "traffic routed to " + target;
    }

    private String reconcileWorkflows(CutoverPlan plan) {
        ReconciliationReport report = workflowGuard.reconcile(plan.sourceRegion(), plan.targetRegion());
        return report.summary();
    }

    private CutoverExecution pause(CutoverExecution execution, CutoverStep step) {
        LOG.warnf("Plan %s paused before step %d %s: orchestrator lease epoch %d not confirmed",
            execution.planId(), step.number(), step, execution.leaseEpoch());
        return execution;
    }

    private CutoverExecution cancelExecution(CutoverExecution execution) {
        String message = "cancelled by operator" + liftSourceFence(execution, "cancelled");
        CutoverExecution cancelled = execution.finish(CutoverExecution.Status.CANCELLED, message, clock.instant());
        persist(cancelled);
        LOG.warnf("Plan %s CANCELLED: %s", execution.planId(), message);
        alertSink.notify(AlertSeverity.WARNING, "Cutover plan " + execution.planId() + " " + message);
        return cancelled;
    }

    /**
     * A plan halted before promotion or redirect started leaves the source region as the only
     * writer, so its fence comes down again. Once either has started the fence stays up.
     */
    private CutoverExecution fail(CutoverExecution execution, CutoverStep step, String reason) {
        CutoverExecution.Status outcome = execution.lastSuccessfulStep() == 0
            ? CutoverExecution.Status.FAILED
            : CutoverExecution.Status.PARTIAL;
        String message = String.format("step %d %s failed: %s", step.number(), step, reason);
        if (!execution.reachedSideEffects()) {
            message += liftSourceFence(execution, outcome.name());
        } else if (sourceFenceAttempted(execution)) {
            message += ", writes in " + execution.plan().sourceRegion() + " stay fenced until an operator lifts them";
        }
        CutoverExecution finished = execution.finish(outcome, message, clock.instant());
        persist(finished);
        LOG.errorf("Plan %s %s at %s (last successful step %d)", execution.planId(), outcome, message,
            execution.lastSuccessfulStep());
        alertSink.notify(AlertSeverity.CRITICAL, String.format(
            "Cutover plan %s (%s -> %s) ended %s after step %d: %s",
            execution.planId(), execution.plan().sourceRegion(), execution.plan().targetRegion(),
            outcome, execution.lastSuccessfulStep(), message));
        return finished;
    }

    /**
     * @return suffix for the outcome message, empty when writes were never fenced
     */
    private String liftSourceFence(CutoverExecution execution, String outcome) {
        if (!sourceFenceAttempted(execution)) {
            return "";
        }
        RegionId source = execution.plan().sourceRegion();
        try {
            writeFence.lift(source);
            return ", writes re-enabled in " + source;
        } catch (WriteFenceException e) {
            LOG.errorf(e, "Could not lift write fence in %s after plan %s %s", source, execution.planId(), outcome);
            alertSink.notify(AlertSeverity.CRITICAL, String.format(
                "Plan %s %s but writes in %s are still fenced: %s", execution.planId(), outcome, source, e.getMessage()));
            return ", write fence in " + source + " could NOT be lifted";
        }
    }

    private static boolean sourceFenceAttempted(CutoverExecution execution) {
        return progressOf(execution, CutoverStep.STOP_SOURCE_WRITES).status() != StepProgress.Status.PENDING;
    }

    private CutoverExecution update(CutoverExecution execution, StepProgress progress) {
        CutoverExecution updated = execution.withStep(progress);
        synchronized (monitor) {
            active = updated;
        }
        persist(updated);
        return updated;
    }

    private void persist(CutoverExecution execution) {
        try {
            stateStore.saveExecution(execution);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to persist progress of plan %s", execution.planId());
        }
    }

    private boolean isFencedQuietly(RegionId region) {
        try {
            return writeFence.isFenced(region);
        } catch (WriteFenceException e) {
            LOG.debugf("Fence state of %s unknown, fencing: %s", region, e.getMessage());
            return false;
        }
    }

    private boolean isCancelRequested(String planId) {
        synchronized (monitor) {
            return planId.equals(cancelRequestedFor);
        }
    }

    private void clearCancelRequest() {
        synchronized (monitor) {
            cancelRequestedFor = null;
        }
    }

    private static StepProgress progressOf(CutoverExecution execution, CutoverStep step) {
        return execution.steps().stream()
            .filter(p -> p.step() == step)
            .findFirst()
            .orElse(StepProgress.pending(step));
    }

    private static class StepFailedException extends Exception {
        StepFailedException(String message) {
            super(message);
        }

        StepFailedException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    private static class StepCancelledException extends Exception {
        StepCancelledException() {
            super("cancelled");
        }
    }
}
