package tech.regionguard.failover.decision;

import org.jboss.logging.Logger;
import tech.regionguard.failover.alert.AlertSeverity;
import tech.regionguard.failover.alert.AlertSink;
import tech.regionguard.failover.config.DecisionPolicy;
import tech.regionguard.failover.cutover.CutoverCoordinator;
import tech.regionguard.failover.cutover.PlanInProgressException;
import tech.regionguard.failover.fence.WriteFenceException;
import tech.regionguard.failover.health.HealthAggregator;
import tech.regionguard.failover.health.VerdictListener;
import tech.regionguard.failover.model.CutoverExecution;
import tech.regionguard.failover.model.CutoverPlan;
import tech.regionguard.failover.model.EngineState;
import tech.regionguard.failover.model.HealthState;
import tech.regionguard.failover.model.HealthVerdict;
import tech.regionguard.failover.model.OperatingMode;
import tech.regionguard.failover.model.RegionId;
import tech.regionguard.failover.model.ReplicationLag;
import tech.regionguard.failover.model.VerdictTransition;
import tech.regionguard.failover.replication.ReplicationLagTracker;
import tech.regionguard.failover.state.FailoverStateStore;
import tech.regionguard.failover.workflow.WorkflowConsistencyGuard;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Owns the operating mode and decides when to move the active region.
 *
 * <h2>Modes</h2>
 * <pre>
 * PRIMARY_ACTIVE -> DEGRADED -> FAILOVER_PENDING -> SECONDARY_ACTIVE -> RECOVERING -> PRIMARY_ACTIVE
 * </pre>
 *
 * <p>A failover plan is only created when the primary is UNHEALTHY, the secondary is HEALTHY
 * and replication lag toward the secondary is fresh and below the RPO bound. Fail-back is
 * proposed when the primary has been stable long enough, and executed only after operator
 * confirmation unless auto fail-back is enabled. A failed plan halts automation until an
 * operator resumes it. When the failed plan had started promoting storage or redirecting
 * traffic, the engine also stays out of PRIMARY_ACTIVE until then, since the secondary may
 * already be the writer.</p>
 *
 * <p>Decisions run under one lock, and only while this instance holds the orchestrator
 * lease. Plans execute on the plan executor after the lock is released. A plan that pauses
 * because the lease could not be confirmed is picked up again from the state store on the
 * next cycle this instance runs as leader.</p>
 */
public class FailoverDecisionEngine implements VerdictListener {

    private static final Logger LOG = Logger.getLogger(FailoverDecisionEngine.class);
    private static final int MAX_PASSES_PER_CYCLE = 3;

    private final HealthAggregator aggregator;
    private final ReplicationLagTracker lagTracker;
    private final CutoverCoordinator coordinator;
    private final WorkflowConsistencyGuard workflowGuard;
    private final FailoverStateStore stateStore;
    private final AlertSink alertSink;
    private final DecisionPolicy policy;
    private final RegionId primary;
    private final RegionId secondary;
    private final BooleanSupplier leadership;
    private final ExecutorService planExecutor;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();

    private EngineState state;
    private CutoverPlan currentPlan;
    private Instant planStartedAt;
    private CutoverExecution pendingResume;
    private boolean rtoEscalated;
    private boolean noSafeTargetAlerted;
    private boolean leaderLastCycle;
    private boolean unresolvedHoldLogged;
    private boolean statePersistPending;
    private String pausedPlanAlerted;

    public FailoverDecisionEngine(HealthAggregator aggregator, ReplicationLagTracker lagTracker,
                                  CutoverCoordinator coordinator, WorkflowConsistencyGuard workflowGuard,
                                  FailoverStateStore stateStore, AlertSink alertSink, DecisionPolicy policy,
                                  RegionId primary, RegionId secondary, BooleanSupplier leadership,
                                  ExecutorService planExecutor, Clock clock) {
        this.aggregator = aggregator;
        this.lagTracker = lagTracker;
        this.coordinator = coordinator;
        this.workflowGuard = workflowGuard;
        this.stateStore = stateStore;
        this.alertSink = alertSink;
        this.policy = policy;
        this.primary = primary;
        this.secondary = secondary;
        this.leadership = leadership;
        this.planExecutor = planExecutor;
        this.clock = clock;
        this.state = EngineState.initial(clock.instant());
    }

    /**
     * Load persisted state. An unfinished plan is resumed on the next decision cycle run as leader.
     */
    public void initialize() {
        lock.lock();
        try {
            recover();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run one decision cycle.
     */
    public void evaluate() {
        boolean leader = leadership.getAsBoolean();
        Runnable launch = null;
        lock.lock();
        try {
            if (!leader) {
                if (leaderLastCycle) {
                    LOG.info("Lost orchestrator leadership, decision cycles paused");
                }
                leaderLastCycle = false;
                return;
            }
            if (!leaderLastCycle) {
                LOG.info("Holding orchestrator leadership, reloading persisted state");
                recover();
                leaderLastCycle = true;
            }
            if (statePersistPending) {
                persistState();
            }
            launch = decide();
        } finally {
            lock.unlock();
        }
        if (launch != null) {
            launch.run();
        }
    }

    /**
     * Verdict changes trigger an immediate cycle. Skipped when a cycle is already running,
     * the scheduled cycle picks the change up.
     */
    @Override
    public void onTransition(VerdictTransition transition) {
        AlertSeverity severity = transition.to() == HealthState.HEALTHY ? AlertSeverity.INFO : AlertSeverity.WARNING;
        alertSink.notify(severity, String.format("Region %s health %s -> %s",
            transition.regionId(), transition.from(), transition.to()));
        triggerEvaluation();
    }

    public void triggerEvaluation() {
        if (lock.isLocked()) {
            return;
        }
        try {
            evaluate();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Decision cycle triggered by verdict change failed");
        }
    }

    /**
     * Operator confirmation that the proposed fail-back may run.
     */
    public EngineStatus confirmFailback() {
        lock.lock();
        try {
            if (state.mode() != OperatingMode.RECOVERING) {
                throw new InvalidOperatorActionException(
                    "No fail-back proposed, current mode is " + state.mode());
            }
            state = state.withFailbackConfirmed(true);
            persistState();
            LOG.info("Fail-back confirmed by operator");
        } finally {
            lock.unlock();
        }
        evaluate();
        return status();
    }

    /**
     * Resume after a failed plan. The operator asserts that storage, traffic and write fences
     * have been reconciled with the current mode.
     */
    public EngineStatus resumeAutomation() {
        lock.lock();
        try {
            if (state.automationHalted() || state.unresolvedPlanId() != null) {
                state = state.withAutomationHalted(false).withUnresolvedPlan(null);
                unresolvedHoldLogged = false;
                noSafeTargetAlerted = false;
                persistState();
                alertSink.notify(AlertSeverity.INFO, "Failover automation resumed by operator in mode " + state.mode());
            }
        } finally {
            lock.unlock();
        }
        evaluate();
        return status();
    }

    public CutoverExecution cancelPlan(String planId) {
        return coordinator.cancel(planId);
    }

    /**
     * Operator release of a write fence left up by a failed plan.
     *
     * @throws PlanInProgressException if a plan is running
     */
    public void liftWriteFence(RegionId region) throws WriteFenceException {
        lock.lock();
        try {
            if (currentPlan != null) {
                throw new PlanInProgressException(currentPlan.planId());
            }
            coordinator.liftWriteFence(region);
        } finally {
            lock.unlock();
        }
        alertSink.notify(AlertSeverity.WARNING, "Write fence in " + region + " lifted by operator");
    }

    /**
     * Operator-requested failover. Only allowed from DEGRADED and still subject to the
     * secondary health and replication lag checks.
     *
     * @throws PlanInProgressException if a plan is already running
     */
    public CutoverPlan requestFailover(String reason) {
        CutoverPlan plan;
        lock.lock();
        try {
            if (currentPlan != null) {
                throw new PlanInProgressException(currentPlan.planId());
            }
            if (state.mode() != OperatingMode.DEGRADED) {
                throw new InvalidOperatorActionException(
                    "Manual failover is only allowed in DEGRADED mode, current mode is " + state.mode());
            }
            Optional<String> blocker = failoverBlocker();
            if (blocker.isPresent()) {
                throw new InvalidOperatorActionException("Failover to " + secondary + " is unsafe: " + blocker.get());
            }
            plan = CutoverPlan.failover(primary, secondary, clock.instant(), "manual: " + reason);
            startPlan(plan);
        } finally {
            lock.unlock();
        }
        launch(plan).run();
        return plan;
    }

    public EngineStatus status() {
        lock.lock();
        try {
            CutoverExecution execution = coordinator.activeExecution().orElse(null);
            return new EngineStatus(
                state.mode(),
                state.reason(),
                state.changedAt(),
                aggregator.activeRegion(),
                leadership.getAsBoolean(),
                state.automationHalted(),
                state.failbackConfirmed(),
                state.currentPlanId(),
                state.unresolvedPlanId(),
                execution,
                new ArrayList<>(aggregator.snapshot().values()),
                lagTracker.worstLag(standbyOf(aggregator.activeRegion())),
                workflowGuard.pendingManualReconciliations().size()
            );
        } finally {
            lock.unlock();
        }
    }

    public OperatingMode mode() {
        lock.lock();
        try {
            return state.mode();
        } finally {
            lock.unlock();
        }
    }

    public boolean isAutomationHalted() {
        lock.lock();
        try {
            return state.automationHalted();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Called on the plan executor once a plan reaches a terminal outcome.
     */
    void onPlanFinished(CutoverExecution execution) {
        lock.lock();
        try {
            if (currentPlan == null || !currentPlan.planId().equals(execution.planId())) {
                LOG.warnf("Ignoring outcome of unknown plan %s", execution.planId());
                return;
            }
            CutoverPlan plan = currentPlan;
            currentPlan = null;
            planStartedAt = null;
            if (!execution.isTerminal()) {
                // lease not confirmed, reload and resume on the next cycle run as leader
                leaderLastCycle = false;
                if (!plan.planId().equals(pausedPlanAlerted)) {
                    pausedPlanAlerted = plan.planId();
                    alertSink.notify(AlertSeverity.WARNING, String.format(
                        "Plan %s paused after step %d: orchestrator lease epoch %d could not be confirmed",
                        plan.planId(), execution.lastSuccessfulStep(), execution.leaseEpoch()));
                }
                return;
            }
            pausedPlanAlerted = null;
            state = state.withCurrentPlan(null).withFailbackConfirmed(false);

            if (execution.status() == CutoverExecution.Status.SUCCEEDED) {
                aggregator.setActiveRegion(plan.targetRegion());
                state = state.withUnresolvedPlan(null);
                noSafeTargetAlerted = false;
                transition(plan.toMode(), plan.kind() + " plan " + plan.planId() + " succeeded");
                return;
            }

            OperatingMode fallback = plan.kind() == CutoverPlan.Kind.FAILOVER
                ? OperatingMode.DEGRADED
                : OperatingMode.SECONDARY_ACTIVE;
            state = state.withAutomationHalted(true);
            if (execution.reachedSideEffects()) {
                state = state.withUnresolvedPlan(plan.planId());
            }
            transition(fallback, String.format("%s plan %s ended %s: %s",
                plan.kind(), plan.planId(), execution.status(), execution.failureMessage()));
            alertSink.notify(AlertSeverity.CRITICAL, String.format(
                "Failover automation halted after plan %s ended %s, operator must %s", plan.planId(), execution.status(),
                execution.reachedSideEffects()
                    ? "reconcile storage, traffic and write fences with mode " + fallback + " before resuming"
                    : "resume"));
        } finally {
            lock.unlock();
        }
    }

    private Runnable decide() {
        checkRtoDeadline();
        if (pendingResume != null) {
            CutoverExecution execution = pendingResume;
            pendingResume = null;
            return () -> submit(execution.plan(), () -> coordinator.resume(execution));
        }

        for (int pass = 0; pass < MAX_PASSES_PER_CYCLE; pass++) {
            OperatingMode before = state.mode();
            CutoverPlan plan = decideOnce();
            if (plan != null) {
                return launch(plan);
            }
            if (state.mode() == before) {
                break;
            }
        }
        return null;
    }

    private CutoverPlan decideOnce() {
        HealthState primaryHealth = healthOf(primary);

        switch (state.mode()) {
            case PRIMARY_ACTIVE -> {
                if (primaryHealth != HealthState.HEALTHY) {
                    transition(OperatingMode.DEGRADED, "primary " + primary + " is " + primaryHealth);
                }
            }
            case DEGRADED -> {
                if (primaryHealth == HealthState.HEALTHY && state.unresolvedPlanId() != null) {
                    if (!unresolvedHoldLogged) {
                        unresolvedHoldLogged = true;
                        LOG.warnf("Primary %s recovered but plan %s may have moved storage or traffic, "
                            + "staying DEGRADED until an operator resumes automation", primary, state.unresolvedPlanId());
                    }
                } else if (primaryHealth == HealthState.HEALTHY) {
                    noSafeTargetAlerted = false;
                    transition(OperatingMode.PRIMARY_ACTIVE, "primary " + primary + " recovered");
                } else if (primaryHealth == HealthState.UNHEALTHY && !state.automationHalted()) {
                    Optional<String> blocker = failoverBlocker();
                    if (blocker.isEmpty()) {
                        CutoverPlan plan = CutoverPlan.failover(primary, secondary, clock.instant(),
                            "primary " + primary + " UNHEALTHY");
                        startPlan(plan);
                        return plan;
                    }
                    if (!noSafeTargetAlerted) {
                        noSafeTargetAlerted = true;
                        LOG.errorf("Primary %s UNHEALTHY but no safe failover target: %s", primary, blocker.get());
                        alertSink.notify(AlertSeverity.CRITICAL, String.format(
                            "Primary %s UNHEALTHY and no safe failover target: %s", primary, blocker.get()));
                    }
                }
            }
            case SECONDARY_ACTIVE -> {
                ReplicationLag lag = lagTracker.worstLag(primary);
                if (primaryHealth == HealthState.HEALTHY && lag.isWithin(policy.rpoBoundMillis())) {
                    transition(OperatingMode.RECOVERING, "primary " + primary + " stable, fail-back proposed");
                }
            }
            case RECOVERING -> {
                if (currentPlan != null) {
                    return null;
                }
                if (primaryHealth != HealthState.HEALTHY) {
                    state = state.withFailbackConfirmed(false);
                    transition(OperatingMode.SECONDARY_ACTIVE,
                        "fail-back withdrawn, primary " + primary + " is " + primaryHealth);
                    return null;
                }
                boolean confirmed = state.failbackConfirmed() || policy.autoFailback();
                if (!confirmed || state.automationHalted()) {
                    return null;
                }
                int manual = workflowGuard.pendingManualReconciliations().size();
                if (manual > 0) {
                    LOG.infof("Fail-back waiting on %d manual workflow reconciliation(s)", manual);
                    return null;
                }
                ReplicationLag lag = lagTracker.worstLag(primary);
                if (!lag.isWithin(policy.rpoBoundMillis())) {
                    LOG.infof("Fail-back waiting for replication toward %s: %s", primary, lag.describe());
                    return null;
                }
                CutoverPlan plan = CutoverPlan.failback(secondary, primary, clock.instant(),
                    state.failbackConfirmed() ? "fail-back confirmed by operator" : "automatic fail-back");
                startPlan(plan);
                return plan;
            }
            case FAILOVER_PENDING -> {
                // plan running, outcome handled in onPlanFinished
            }
        }
        return null;
    }

    /**
     * Reason the secondary cannot take over, empty when failover is safe.
     */
    private Optional<String> failoverBlocker() {
        HealthState secondaryHealth = healthOf(secondary);
        if (secondaryHealth != HealthState.HEALTHY) {
            return Optional.of("secondary " + secondary + " is " + secondaryHealth);
        }
        ReplicationLag lag = lagTracker.worstLag(secondary);
        if (!lag.isWithin(policy.rpoBoundMillis())) {
            return Optional.of("replication toward " + secondary + " " + lag.describe()
                + " violates RPO bound " + policy.rpoBoundMillis() + "ms");
        }
        return Optional.empty();
    }

    private void startPlan(CutoverPlan plan) {
        if (currentPlan != null) {
            throw new PlanInProgressException(currentPlan.planId());
        }
        currentPlan = plan;
        planStartedAt = clock.instant();
        rtoEscalated = false;
        state = state.withCurrentPlan(plan.planId());
        if (state.mode() != plan.fromMode()) {
            transition(plan.fromMode(), plan.kind() + " plan " + plan.planId() + " started: " + plan.reason());
        } else {
            persistState();
        }
    }

    private Runnable launch(CutoverPlan plan) {
        return () -> submit(plan, () -> coordinator.execute(plan));
    }

    private void submit(CutoverPlan plan, PlanRun run) {
        try {
            planExecutor.execute(() -> {
                CutoverExecution result;
                try {
                    result = run.execute();
                } catch (RuntimeException e) {
                    LOG.errorf(e, "Plan %s aborted unexpectedly", plan.planId());
                    result = abandoned(plan, "aborted: " + e.getMessage());
                }
                onPlanFinished(result);
            });
        } catch (RejectedExecutionException e) {
            LOG.errorf("Plan executor rejected plan %s", plan.planId());
            onPlanFinished(abandoned(plan, "plan executor shut down"));
        }
    }

    private CutoverExecution abandoned(CutoverPlan plan, String message) {
        CutoverExecution last = coordinator.activeExecution()
            .filter(e -> e.planId().equals(plan.planId()))
            .orElseGet(() -> CutoverExecution.start(plan, clock.instant()));
        CutoverExecution failed = last.finish(CutoverExecution.Status.FAILED, message, clock.instant());
        try {
            stateStore.saveExecution(failed);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to persist abandoned plan %s", plan.planId());
        }
        return failed;
    }

    private void checkRtoDeadline() {
        if (currentPlan == null || rtoEscalated || planStartedAt == null) {
            return;
        }
        Duration elapsed = Duration.between(planStartedAt, clock.instant());
        if (elapsed.compareTo(policy.rtoDeadline()) > 0) {
            rtoEscalated = true;
            LOG.errorf("Plan %s still running after %s, RTO deadline %s exceeded",
                currentPlan.planId(), elapsed, policy.rtoDeadline());
            alertSink.notify(AlertSeverity.CRITICAL, String.format(
                "RTO deadline exceeded: plan %s (%s -> %s) not finished after %s",
                currentPlan.planId(), currentPlan.sourceRegion(), currentPlan.targetRegion(), elapsed));
        }
    }

    private void recover() {
        state = stateStore.loadEngineState().orElseGet(() -> EngineState.initial(clock.instant()));
        currentPlan = null;
        planStartedAt = null;
        pendingResume = null;

        Optional<CutoverExecution> unfinished = coordinator.activeExecution().isPresent()
            ? coordinator.activeExecution()
            : stateStore.listExecutions().stream().filter(e -> !e.isTerminal()).findFirst();

        if (unfinished.isPresent()) {
            CutoverExecution execution = unfinished.get();
            currentPlan = execution.plan();
            planStartedAt = execution.startedAt();
            if (coordinator.activeExecution().isEmpty()) {
                pendingResume = execution;
                LOG.infof("Found unfinished plan %s at step %d, will resume", execution.planId(),
                    execution.lastSuccessfulStep());
            }
            state = state.withCurrentPlan(execution.planId());
            if (state.mode() != execution.plan().fromMode()) {
                state = state.withMode(execution.plan().fromMode(), "resuming plan " + execution.planId(), clock.instant());
            }
        } else if (state.mode() == OperatingMode.FAILOVER_PENDING) {
            state = state.withCurrentPlan(null);
            transition(OperatingMode.DEGRADED, "restarted in FAILOVER_PENDING without a recorded plan");
        } else if (state.currentPlanId() != null) {
            state = state.withCurrentPlan(null);
        }

        RegionId active = switch (state.mode()) {
            case SECONDARY_ACTIVE, RECOVERING -> secondary;
            default -> primary;
        };
        aggregator.setActiveRegion(active);
        persistState();
        LOG.infof("Decision engine state: mode=%s, active=%s, halted=%s", state.mode(), active, state.automationHalted());
    }

    private void transition(OperatingMode to, String reason) {
        OperatingMode from = state.mode();
        state = state.withMode(to, reason, clock.instant());
        persistState();
        LOG.infof("Operating mode %s -> %s: %s", from, to, reason);
        alertSink.notify(severityOf(to), String.format("Operating mode %s -> %s: %s", from, to, reason));
    }

    private static AlertSeverity severityOf(OperatingMode mode) {
        return switch (mode) {
            case PRIMARY_ACTIVE, RECOVERING -> AlertSeverity.INFO;
            case DEGRADED, SECONDARY_ACTIVE -> AlertSeverity.WARNING;
            case FAILOVER_PENDING -> AlertSeverity.CRITICAL;
        };
    }

    private RegionId standbyOf(RegionId active) {
        return primary.equals(active) ? secondary : primary;
    }

    private HealthState healthOf(RegionId region) {
        return aggregator.verdict(region).map(HealthVerdict::status).orElse(HealthState.UNHEALTHY);
    }

    /**
     * A failed write is retried on every cycle until it succeeds. Until then a restart would
     * reload an older mode and plan.
     */
    private void persistState() {
        try {
            stateStore.saveEngineState(state);
            if (statePersistPending) {
                statePersistPending = false;
                LOG.infof("Engine state persisted again (mode %s)", state.mode());
                alertSink.notify(AlertSeverity.INFO, "Engine state persisted again in mode " + state.mode());
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to persist engine state (mode %s)", state.mode());
            if (!statePersistPending) {
                statePersistPending = true;
                alertSink.notify(AlertSeverity.CRITICAL, String.format(
                    "Engine state in mode %s could not be persisted, a restart would resume an older mode: %s",
                    state.mode(), e.getMessage()));
            }
        }
    }

    @FunctionalInterface
    private interface PlanRun {
        CutoverExecution execute();
    }
}
