package tech.regionguard.failover.decision;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.regionguard.failover.FixedLeadership;
import tech.regionguard.failover.MutableClock;
import tech.regionguard.failover.alert.AlertSeverity;
import tech.regionguard.failover.alert.AlertSink;
import tech.regionguard.failover.config.CutoverSettings;
import tech.regionguard.failover.config.DecisionPolicy;
import tech.regionguard.failover.config.HysteresisPolicy;
import tech.regionguard.failover.cutover.CutoverCoordinator;
import tech.regionguard.failover.cutover.PlanInProgressException;
import tech.regionguard.failover.fence.InMemoryWriteFence;
import tech.regionguard.failover.health.HealthAggregator;
import tech.regionguard.failover.model.CutoverExecution;
import tech.regionguard.failover.model.CutoverPlan;
import tech.regionguard.failover.model.CutoverStep;
import tech.regionguard.failover.model.EngineState;
import tech.regionguard.failover.model.HealthState;
import tech.regionguard.failover.model.HealthVerdict;
import tech.regionguard.failover.model.OperatingMode;
import tech.regionguard.failover.model.RegionId;
import tech.regionguard.failover.model.StepProgress;
import tech.regionguard.failover.model.VerdictTransition;
import tech.regionguard.failover.model.WorkflowExecutionRecord;
import tech.regionguard.failover.model.ReplicationLag;
import tech.regionguard.failover.replication.ReplicatedStore;
import tech.regionguard.failover.replication.ReplicationLagTracker;
import tech.regionguard.failover.replication.StorePromotionException;
import tech.regionguard.failover.routing.InMemoryRoutingStrategy;
import tech.regionguard.failover.state.FailoverStateStore;
import tech.regionguard.failover.state.InMemoryFailoverStateStore;
import tech.regionguard.failover.state.StateStoreException;
import tech.regionguard.failover.workflow.WorkflowConsistencyGuard;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class FailoverDecisionEngineTest {

    private static final RegionId PRIMARY = RegionId.PRIMARY;
    private static final RegionId SECONDARY = RegionId.SECONDARY;

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
    private final AtomicBoolean leader = new AtomicBoolean(true);

    private HealthAggregator aggregator;
    private ReplicationLagTracker lagTracker;
    private CutoverCoordinator coordinator;
    private WorkflowConsistencyGuard workflowGuard;
    private InMemoryFailoverStateStore stateStore;
    private AlertSink alertSink;
    private QueuedExecutorService planExecutor;

    @BeforeEach
    void setUp() {
        aggregator = new HealthAggregator(
            Map.of(PRIMARY, Set.of("p1", "p2"), SECONDARY, Set.of("p1", "p2")),
            new HysteresisPolicy(3, 3, 5, 10, Duration.ofSeconds(180)), PRIMARY, clock);
        lagTracker = new ReplicationLagTracker(clock, Duration.ofSeconds(60));
        lagTracker.record("orders", SECONDARY, 200);
        lagTracker.record("orders", PRIMARY, 200);
        coordinator = mock(CutoverCoordinator.class);
        when(coordinator.execute(any())).thenAnswer(invocation ->
            finished(invocation.getArgument(0), CutoverExecution.Status.SUCCEEDED));
        when(coordinator.resume(any())).thenAnswer(invocation ->
            ((CutoverExecution) invocation.getArgument(0)).finish(CutoverExecution.Status.SUCCEEDED, null, clock.instant()));
        workflowGuard = mock(WorkflowConsistencyGuard.class);
        stateStore = new InMemoryFailoverStateStore();
        alertSink = mock(AlertSink.class);
        planExecutor = new QueuedExecutorService();
    }

    @Test
    void shouldStayPrimaryActiveWhileHealthy() {
        FailoverDecisionEngine engine = engine(new DecisionPolicy(5000, Duration.ofMinutes(15), false));

        engine.evaluate();

        assertEquals(OperatingMode.PRIMARY_ACTIVE, engine.mode());
        assertEquals(0, planExecutor.pending());
    }

    @Test
    void shouldFailOverWhenPrimaryUnhealthyAndSecondarySafe() {
        // Given
        FailoverDecisionEngine engine = engine(defaultPolicy());
        health(HealthState.UNHEALTHY, HealthState.HEALTHY);

        // When
        engine.evaluate();

        // Then the plan is queued and the mode is FAILOVER_PENDING
        assertEquals(OperatingMode.FAILOVER_PENDING, engine.mode());
        assertEquals(1, planExecutor.pending());
        verify(alertSink).notify(eq(AlertSeverity.CRITICAL), contains("-> FAILOVER_PENDING"));

        // When the plan runs
        planExecutor.runAll();

        // Then
        verify(coordinator).execute(argThat(plan -> plan.kind() == CutoverPlan.Kind.FAILOVER
            && plan.sourceRegion().equals(PRIMARY) && plan.targetRegion().equals(SECONDARY)));
        assertEquals(OperatingMode.SECONDARY_ACTIVE, engine.mode());
        assertEquals(SECONDARY, aggregator.activeRegion());
        assertNull(stateStore.loadEngineState().orElseThrow().currentPlanId());
    }

    @Test
    void shouldOnlyDegradeWhilePrimaryIsDegraded() {
        FailoverDecisionEngine engine = engine(defaultPolicy());
        health(HealthState.DEGRADED, HealthState.HEALTHY);

        engine.evaluate();

        assertEquals(OperatingMode.DEGRADED, engine.mode());
        assertEquals(0, planExecutor.pending());
    }

    @Test
    void shouldReturnToPrimaryActiveWhenPrimaryRecovers() {
        // Given
        FailoverDecisionEngine engine = engine(defaultPolicy());
        health(HealthState.DEGRADED, HealthState.HEALTHY);
        engine.evaluate();

        // When
        health(HealthState.HEALTHY, HealthState.HEALTHY);
        engine.evaluate();

        // Then
        assertEquals(OperatingMode.PRIMARY_ACTIVE, engine.mode());
    }

    @Test
    void shouldRefuseFailoverWhenReplicationLagIsStale() {
        // Given lag samples older than twice the poll interval
        FailoverDecisionEngine engine = engine(defaultPolicy());
        health(HealthState.UNHEALTHY, HealthState.HEALTHY);
        clock.advance(Duration.ofMinutes(3));

        // When
        engine.evaluate();
        engine.evaluate();

        // Then
        assertEquals(OperatingMode.DEGRADED, engine.mode());
        assertEquals(0, planExecutor.pending());
        verify(alertSink, times(1)).notify(eq(AlertSeverity.CRITICAL), contains("no safe failover target"));
    }

    @Test
    void shouldRefuseFailoverWhenLagExceedsRpoBound() {
        FailoverDecisionEngine engine = engine(defaultPolicy());
        health(HealthState.UNHEALTHY, HealthState.HEALTHY);
        lagTracker.record("orders", SECONDARY, 9000);

        engine.evaluate();

        assertEquals(OperatingMode.DEGRADED, engine.mode());
        assertEquals(0, planExecutor.pending());
    }

    @Test
    void shouldRefuseFailoverWhenSecondaryIsNotHealthy() {
        FailoverDecisionEngine engine = engine(defaultPolicy());
        health(HealthState.UNHEALTHY, HealthState.DEGRADED);

        engine.evaluate();

        assertEquals(OperatingMode.DEGRADED, engine.mode());
        verify(alertSink).notify(eq(AlertSeverity.CRITICAL), contains("secondary SECONDARY is DEGRADED"));
    }

    @Test
    void shouldHaltAutomationWhenPlanDoesNotSucceed() {
        // Given
        when(coordinator.execute(any())).thenAnswer(invocation ->
            finished(invocation.getArgument(0), CutoverExecution.Status.PARTIAL));
        FailoverDecisionEngine engine = engine(defaultPolicy());
        health(HealthState.UNHEALTHY, HealthState.HEALTHY);

        // When
        engine.evaluate();
        planExecutor.runAll();

        // Then
        assertEquals(OperatingMode.DEGRADED, engine.mode());
        assertTrue(engine.isAutomationHalted());
        verify(alertSink).notify(eq(AlertSeverity.CRITICAL), contains("automation halted"));

        // And no new plan is started while halted
        engine.evaluate();
        assertEquals(0, planExecutor.pending());
        verify(coordinator, times(1)).execute(any());

        // When the operator resumes automation
        engine.resumeAutomation();

        // Then
        assertFalse(engine.isAutomationHalted());
        assertEquals(1, planExecutor.pending());
    }

    @Test
    void shouldHaltAutomationWhenPlanThrows() {
        when(coordinator.execute(any())).thenThrow(new IllegalStateException("boom"));
        FailoverDecisionEngine engine = engine(defaultPolicy());
        health(HealthState.UNHEALTHY, HealthState.HEALTHY);

        engine.evaluate();
        planExecutor.runAll();

        assertEquals(OperatingMode.DEGRADED, engine.mode());
        assertTrue(engine.isAutomationHalted());
        CutoverExecution recorded = stateStore.listExecutions().get(0);
        assertEquals(CutoverExecution.Status.FAILED, recorded.status());
    }

    @Test
    void shouldRejectSecondPlanWhileOneIsRunning() {
        // Given
        FailoverDecisionEngine engine = engine(defaultPolicy());
        health(HealthState.UNHEALTHY, HealthState.HEALTHY);
        engine.evaluate();

        // When / Then
        assertThrows(PlanInProgressException.class, () -> engine.requestFailover("operator"));
        assertEquals(1, planExecutor.pending());
    }

    @Test
    void shouldAllowManualFailoverOnlyFromDegraded() {
        // Given
        FailoverDecisionEngine engine = engine(defaultPolicy());
        engine.evaluate();
        assertThrows(InvalidOperatorActionException.class, () -> engine.requestFailover("operator"));

        health(HealthState.DEGRADED, HealthState.HEALTHY);
        engine.evaluate();

        // When
        CutoverPlan plan = engine.requestFailover("maintenance");

        // Then
        assertEquals("manual: maintenance", plan.reason());
        assertEquals(OperatingMode.FAILOVER_PENDING, engine.mode());
        assertEquals(1, planExecutor.pending());
    }

    @Test
    void shouldRejectUnsafeManualFailover() {
        FailoverDecisionEngine engine = engine(defaultPolicy());
        health(HealthState.DEGRADED, HealthState.UNHEALTHY);
        engine.evaluate();

        InvalidOperatorActionException thrown = assertThrows(InvalidOperatorActionException.class,
            () -> engine.requestFailover("operator"));

        assertTrue(thrown.getMessage().contains("unsafe"));
        assertEquals(OperatingMode.DEGRADED, engine.mode());
    }

    @Test
    void shouldProposeFailbackAndWaitForConfirmation() {
        // Given
        persistMode(OperatingMode.SECONDARY_ACTIVE);
        FailoverDecisionEngine engine = engine(defaultPolicy());
        health(HealthState.HEALTHY, HealthState.HEALTHY);

        // When
        engine.evaluate();

        // Then
        assertEquals(OperatingMode.RECOVERING, engine.mode());
        assertEquals(0, planExecutor.pending());

        // When the operator confirms
        engine.confirmFailback();
        planExecutor.runAll();

        // Then
        verify(coordinator).execute(argThat(plan -> plan.kind() == CutoverPlan.Kind.FAILBACK
            && plan.targetRegion().equals(PRIMARY)));
        assertEquals(OperatingMode.PRIMARY_ACTIVE, engine.mode());
        assertEquals(PRIMARY, aggregator.activeRegion());
        assertFalse(stateStore.loadEngineState().orElseThrow().failbackConfirmed());
    }

    @Test
    void shouldFailBackWithoutConfirmationWhenAutomatic() {
        persistMode(OperatingMode.SECONDARY_ACTIVE);
        FailoverDecisionEngine engine = engine(new DecisionPolicy(5000, Duration.ofMinutes(15), true));
        health(HealthState.HEALTHY, HealthState.HEALTHY);

        engine.evaluate();
        planExecutor.runAll();

        assertEquals(OperatingMode.PRIMARY_ACTIVE, engine.mode());
    }

    @Test
    void shouldHoldFailbackWhileWorkflowsAwaitManualReconciliation() {
        // Given
        persistMode(OperatingMode.SECONDARY_ACTIVE);
        when(workflowGuard.pendingManualReconciliations()).thenReturn(List.of(
            WorkflowExecutionRecord.started("wf-1", SECONDARY, clock.instant())));
        FailoverDecisionEngine engine = engine(new DecisionPolicy(5000, Duration.ofMinutes(15), true));
        health(HealthState.HEALTHY, HealthState.HEALTHY);

        // When
        engine.evaluate();

        // Then
        assertEquals(OperatingMode.RECOVERING, engine.mode());
        assertEquals(0, planExecutor.pending());
    }

    @Test
    void shouldWithdrawFailbackWhenPrimaryRelapses() {
        // Given
        persistMode(OperatingMode.RECOVERING);
        FailoverDecisionEngine engine = engine(defaultPolicy());
        health(HealthState.DEGRADED, HealthState.HEALTHY);

        // When
        engine.evaluate();

        // Then
        assertEquals(OperatingMode.SECONDARY_ACTIVE, engine.mode());
        assertEquals(SECONDARY, aggregator.activeRegion());
        assertEquals(0, planExecutor.pending());
    }

    @Test
    void shouldRejectFailbackConfirmationOutsideRecovering() {
        FailoverDecisionEngine engine = engine(defaultPolicy());
        engine.initialize();

        assertThrows(InvalidOperatorActionException.class, engine::confirmFailback);
    }

    @Test
    void shouldResumeUnfinishedPlanAfterRestart() {
        // Given a plan persisted mid-way by a previous process
        CutoverPlan plan = CutoverPlan.failover(PRIMARY, SECONDARY, clock.instant(), "primary UNHEALTHY");
        Instant now = clock.instant();
        CutoverExecution unfinished = CutoverExecution.start(plan, now)
            .withStep(StepProgress.pending(CutoverStep.STOP_SOURCE_WRITES).succeeded(now, "fenced"))
            .withStep(StepProgress.pending(CutoverStep.VERIFY_REPLICATION_DRAINED).succeeded(now, "drained"));
        stateStore.saveExecution(unfinished);
        stateStore.saveEngineState(EngineState.initial(now)
            .withMode(OperatingMode.FAILOVER_PENDING, "plan started", now)
            .withCurrentPlan(plan.planId()));
        health(HealthState.UNHEALTHY, HealthState.HEALTHY);
        FailoverDecisionEngine engine = engine(defaultPolicy());

        // When
        engine.initialize();
        engine.evaluate();
        planExecutor.runAll();

        // Then
        verify(coordinator).resume(unfinished);
        verify(coordinator, never()).execute(any());
        assertEquals(OperatingMode.SECONDARY_ACTIVE, engine.mode());
    }

    @Test
    void shouldResumePlanPausedForUnconfirmedLeaseOnNextCycle() {
        // Given the coordinator pauses after fencing because the lease epoch was not confirmed
        when(coordinator.execute(any())).thenAnswer(invocation -> {
            CutoverPlan plan = invocation.getArgument(0);
            Instant now = clock.instant();
            CutoverExecution paused = CutoverExecution.start(plan, now)
                .withLeaseEpoch(3)
                .withStep(StepProgress.pending(CutoverStep.STOP_SOURCE_WRITES).succeeded(now, "fenced"));
            stateStore.saveExecution(paused);
            return paused;
        });
        FailoverDecisionEngine engine = engine(defaultPolicy());
        health(HealthState.UNHEALTHY, HealthState.HEALTHY);

        // When
        engine.evaluate();
        planExecutor.runAll();

        // Then automation is not halted and the plan stays pending
        assertEquals(OperatingMode.FAILOVER_PENDING, engine.mode());
        assertFalse(engine.isAutomationHalted());
        verify(alertSink).notify(eq(AlertSeverity.WARNING), contains("lease epoch 3 could not be confirmed"));

        // When the next cycle runs as leader
        engine.evaluate();
        planExecutor.runAll();

        // Then the persisted plan is resumed rather than restarted
        verify(coordinator).resume(argThat(execution -> execution.lastSuccessfulStep() == 1));
        verify(coordinator, times(1)).execute(any());
        assertEquals(OperatingMode.SECONDARY_ACTIVE, engine.mode());
    }

    @Test
    void shouldFallBackToDegradedWhenRestartedPendingWithoutPlan() {
        stateStore.saveEngineState(EngineState.initial(clock.instant())
            .withMode(OperatingMode.FAILOVER_PENDING, "plan started", clock.instant()));
        FailoverDecisionEngine engine = engine(defaultPolicy());

        engine.initialize();

        assertEquals(OperatingMode.DEGRADED, engine.mode());
        assertNull(engine.status().currentPlanId());
    }

    @Test
    void shouldEscalateOnceWhenRtoDeadlinePasses() {
        // Given a plan that has not finished
        FailoverDecisionEngine engine = engine(defaultPolicy());
        health(HealthState.UNHEALTHY, HealthState.HEALTHY);
        engine.evaluate();

        // When
        clock.advance(Duration.ofMinutes(16));
        engine.evaluate();
        engine.evaluate();

        // Then
        verify(alertSink, times(1)).notify(eq(AlertSeverity.CRITICAL), contains("RTO deadline exceeded"));
    }

    @Test
    void shouldNotDecideWithoutLeadership() {
        // Given
        leader.set(false);
        FailoverDecisionEngine engine = engine(defaultPolicy());
        health(HealthState.UNHEALTHY, HealthState.HEALTHY);

        // When
        engine.evaluate();

        // Then
        assertEquals(OperatingMode.PRIMARY_ACTIVE, engine.mode());
        assertEquals(0, planExecutor.pending());

        // When leadership is acquired
        leader.set(true);
        engine.evaluate();

        // Then
        assertEquals(OperatingMode.FAILOVER_PENDING, engine.mode());
        assertEquals(1, planExecutor.pending());
    }

    @Test
    void shouldAlertAndEvaluateOnVerdictTransition() {
        // Given
        FailoverDecisionEngine engine = engine(defaultPolicy());
        health(HealthState.DEGRADED, HealthState.HEALTHY);
        HealthVerdict verdict = aggregator.verdict(PRIMARY).orElseThrow();

        // When
        engine.onTransition(new VerdictTransition(PRIMARY, HealthState.HEALTHY, HealthState.DEGRADED, verdict));

        // Then
        verify(alertSink).notify(AlertSeverity.WARNING, "Region PRIMARY health HEALTHY -> DEGRADED");
        assertEquals(OperatingMode.DEGRADED, engine.mode());
    }

    @Test
    void shouldReportStatus() {
        FailoverDecisionEngine engine = engine(defaultPolicy());
        engine.evaluate();

        EngineStatus status = engine.status();

        assertEquals(OperatingMode.PRIMARY_ACTIVE, status.mode());
        assertEquals(PRIMARY, status.activeRegion());
        assertTrue(status.leader());
        assertFalse(status.automationHalted());
        assertEquals(2, status.verdicts().size());
        assertEquals(0, status.pendingManualReconciliations());
    }

    @Test
    void shouldHoldDegradedWhileFailedPromotionLeavesPrimaryFenced() throws Exception {
        // Given a real coordinator whose storage promotion fails after writes were fenced
        InMemoryWriteFence fence = new InMemoryWriteFence();
        ReplicatedStore orders = mock(ReplicatedStore.class);
        when(orders.storeId()).thenReturn("orders");
        doThrow(new StorePromotionException("orders replica in SECONDARY is not ACTIVE"))
            .when(orders).promoteToWritable(any(), anyBoolean());
        ExecutorService stepExecutor = Executors.newCachedThreadPool();
        try {
            FailoverDecisionEngine engine = engine(defaultPolicy(), stateStore,
                realCoordinator(fence, orders, Duration.ofSeconds(1), stepExecutor));
            health(HealthState.UNHEALTHY, HealthState.HEALTHY);

            // When the failover plan runs and ends PARTIAL
            engine.evaluate();
            planExecutor.runAll();

            // Then
            assertEquals(OperatingMode.DEGRADED, engine.mode());
            assertTrue(fence.isFenced(PRIMARY));
            String planId = engine.status().unresolvedPlanId();
            assertNotNull(planId);
            assertEquals(CutoverExecution.Status.PARTIAL, stateStore.findExecution(planId).orElseThrow().status());

            // When the primary recovers
            health(HealthState.HEALTHY, HealthState.HEALTHY);
            engine.evaluate();

            // Then the engine does not claim PRIMARY_ACTIVE over a fenced primary
            assertEquals(OperatingMode.DEGRADED, engine.mode());
            assertTrue(fence.isFenced(PRIMARY));

            // When the operator lifts the fence and resumes
            engine.liftWriteFence(PRIMARY);
            engine.resumeAutomation();

            // Then
            assertFalse(fence.isFenced(PRIMARY));
            assertEquals(OperatingMode.PRIMARY_ACTIVE, engine.mode());
            assertNull(engine.status().unresolvedPlanId());
            verify(alertSink).notify(AlertSeverity.WARNING, "Write fence in PRIMARY lifted by operator");
        } finally {
            stepExecutor.shutdownNow();
        }
    }

    @Test
    void shouldReturnToPrimaryActiveUnfencedWhenPlanFailsBeforePromotion() throws Exception {
        // Given a real coordinator and lag that goes stale before the drain check
        InMemoryWriteFence fence = new InMemoryWriteFence();
        ReplicatedStore orders = mock(ReplicatedStore.class);
        when(orders.storeId()).thenReturn("orders");
        ExecutorService stepExecutor = Executors.newCachedThreadPool();
        try {
            FailoverDecisionEngine engine = engine(defaultPolicy(), stateStore,
                realCoordinator(fence, orders, Duration.ZERO, stepExecutor));
            health(HealthState.UNHEALTHY, HealthState.HEALTHY);
            engine.evaluate();
            clock.advance(Duration.ofMinutes(3));

            // When
            planExecutor.runAll();

            // Then the source fence came down with the failed plan
            assertEquals(OperatingMode.DEGRADED, engine.mode());
            assertFalse(fence.isFenced(PRIMARY));
            assertNull(engine.status().unresolvedPlanId());
            verify(orders, never()).promoteToWritable(any(), anyBoolean());

            // When the primary recovers
            health(HealthState.HEALTHY, HealthState.HEALTHY);
            engine.evaluate();

            // Then
            assertEquals(OperatingMode.PRIMARY_ACTIVE, engine.mode());
            assertFalse(fence.isFenced(PRIMARY));
        } finally {
            stepExecutor.shutdownNow();
        }
    }

    @Test
    void shouldStayDegradedAfterPlanThatStartedPromotionUntilOperatorResumes() {
        // Given a plan that failed while promoting storage
        when(coordinator.execute(any())).thenAnswer(invocation -> failedDuringPromotion(invocation.getArgument(0)));
        FailoverDecisionEngine engine = engine(defaultPolicy());
        health(HealthState.UNHEALTHY, HealthState.HEALTHY);
        engine.evaluate();
        planExecutor.runAll();
        verify(alertSink).notify(eq(AlertSeverity.CRITICAL), contains("reconcile storage, traffic and write fences"));

        // When the primary recovers
        health(HealthState.HEALTHY, HealthState.HEALTHY);
        engine.evaluate();
        engine.evaluate();

        // Then
        assertEquals(OperatingMode.DEGRADED, engine.mode());
        assertNotNull(stateStore.loadEngineState().orElseThrow().unresolvedPlanId());

        // When
        engine.resumeAutomation();

        // Then
        assertEquals(OperatingMode.PRIMARY_ACTIVE, engine.mode());
        assertFalse(engine.isAutomationHalted());
        assertNull(stateStore.loadEngineState().orElseThrow().unresolvedPlanId());
    }

    @Test
    void shouldKeepUnresolvedPlanAcrossRestart() {
        // Given
        stateStore.saveEngineState(EngineState.initial(clock.instant())
            .withMode(OperatingMode.DEGRADED, "plan failed", clock.instant())
            .withAutomationHalted(true)
            .withUnresolvedPlan("plan-1"));
        health(HealthState.HEALTHY, HealthState.HEALTHY);
        FailoverDecisionEngine engine = engine(defaultPolicy());

        // When
        engine.initialize();
        engine.evaluate();

        // Then
        assertEquals(OperatingMode.DEGRADED, engine.mode());
        assertEquals("plan-1", engine.status().unresolvedPlanId());
    }

    @Test
    void shouldRefuseOperatorFenceLiftWhilePlanRuns() throws Exception {
        FailoverDecisionEngine engine = engine(defaultPolicy());
        health(HealthState.UNHEALTHY, HealthState.HEALTHY);
        engine.evaluate();

        assertThrows(PlanInProgressException.class, () -> engine.liftWriteFence(PRIMARY));
        verify(coordinator, never()).liftWriteFence(any());
    }

    @Test
    void shouldAlertOnceAndRetryWhenEngineStateCannotBePersisted() {
        // Given a state store that rejects writes
        AtomicBoolean failing = new AtomicBoolean(true);
        InMemoryFailoverStateStore flaky = spy(new InMemoryFailoverStateStore());
        doAnswer(invocation -> {
            if (failing.get()) {
                throw new StateStoreException("state file not writable", null);
            }
            return invocation.callRealMethod();
        }).when(flaky).saveEngineState(any());
        FailoverDecisionEngine engine = engine(defaultPolicy(), flaky, coordinator);
        health(HealthState.DEGRADED, HealthState.HEALTHY);

        // When
        engine.evaluate();
        engine.evaluate();

        // Then the mode moved but one CRITICAL alert reports it is not durable
        assertEquals(OperatingMode.DEGRADED, engine.mode());
        assertTrue(flaky.loadEngineState().isEmpty());
        verify(alertSink, times(1)).notify(eq(AlertSeverity.CRITICAL), contains("could not be persisted"));

        // When the store recovers
        failing.set(false);
        engine.evaluate();

        // Then the next cycle writes the current mode
        assertEquals(OperatingMode.DEGRADED, flaky.loadEngineState().orElseThrow().mode());
        verify(alertSink).notify(AlertSeverity.INFO, "Engine state persisted again in mode DEGRADED");
        verify(alertSink, times(1)).notify(eq(AlertSeverity.CRITICAL), contains("could not be persisted"));
    }

    @Test
    void shouldReportLagTowardStandbyRegion() {
        // Given different lag in each direction
        lagTracker.record("orders", SECONDARY, 350);
        lagTracker.record("orders", PRIMARY, 900);
        FailoverDecisionEngine engine = engine(defaultPolicy());
        engine.evaluate();

        // When
        ReplicationLag primaryActive = engine.status().standbyLag();

        // Then
        assertEquals(350, primaryActive.lagMillis());
        assertFalse(primaryActive.stale());

        // When the secondary takes over
        health(HealthState.UNHEALTHY, HealthState.HEALTHY);
        engine.evaluate();
        planExecutor.runAll();

        // Then
        assertEquals(SECONDARY, engine.status().activeRegion());
        assertEquals(900, engine.status().standbyLag().lagMillis());
    }

    private FailoverDecisionEngine engine(DecisionPolicy policy) {
        return engine(policy, stateStore, coordinator);
    }

    private FailoverDecisionEngine engine(DecisionPolicy policy, FailoverStateStore store, CutoverCoordinator plans) {
        return new FailoverDecisionEngine(aggregator, lagTracker, plans, workflowGuard, store,
            alertSink, policy, PRIMARY, SECONDARY, leader::get, planExecutor, clock);
    }

    private CutoverCoordinator realCoordinator(InMemoryWriteFence fence, ReplicatedStore store, Duration drainTimeout,
                                               ExecutorService stepExecutor) {
        CutoverSettings settings = new CutoverSettings(Duration.ofSeconds(5), 1000, drainTimeout,
            Duration.ofMillis(20), 5000);
        return new CutoverCoordinator(fence, lagTracker, List.of(store), new InMemoryRoutingStrategy(PRIMARY),
            new FixedLeadership(1), workflowGuard, stateStore, alertSink, settings, clock, stepExecutor);
    }

    private CutoverExecution failedDuringPromotion(CutoverPlan plan) {
        Instant now = clock.instant();
        return CutoverExecution.start(plan, now)
            .withStep(StepProgress.pending(CutoverStep.STOP_SOURCE_WRITES).succeeded(now, "fenced"))
            .withStep(StepProgress.pending(CutoverStep.VERIFY_REPLICATION_DRAINED).succeeded(now, "drained"))
            .withStep(StepProgress.pending(CutoverStep.PROMOTE_TARGET_STORAGE).running(now).failed(now, "timed out"))
            .finish(CutoverExecution.Status.PARTIAL, "step 3 PROMOTE_TARGET_STORAGE failed: timed out", now);
    }

    private static DecisionPolicy defaultPolicy() {
        return new DecisionPolicy(5000, Duration.ofMinutes(15), false);
    }

    private void health(HealthState primary, HealthState secondary) {
        aggregator.restore(List.of(
            new HealthVerdict(PRIMARY, primary, 0, 0, clock.instant()),
            new HealthVerdict(SECONDARY, secondary, 0, 0, clock.instant())));
    }

    private void persistMode(OperatingMode mode) {
        stateStore.saveEngineState(EngineState.initial(clock.instant()).withMode(mode, "earlier run", clock.instant()));
    }

    private CutoverExecution finished(CutoverPlan plan, CutoverExecution.Status status) {
        String message = status == CutoverExecution.Status.SUCCEEDED ? null : "step 3 PROMOTE_TARGET_STORAGE failed";
        return CutoverExecution.start(plan, clock.instant()).finish(status, message, clock.instant());
    }
}
