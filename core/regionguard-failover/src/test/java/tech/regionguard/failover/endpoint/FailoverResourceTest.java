package tech.regionguard.failover.endpoint;

import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.regionguard.failover.MutableClock;
import tech.regionguard.failover.cutover.PlanInProgressException;
import tech.regionguard.failover.decision.FailoverDecisionEngine;
import tech.regionguard.failover.fence.WriteFenceException;
import tech.regionguard.failover.model.CutoverExecution;
import tech.regionguard.failover.model.CutoverPlan;
import tech.regionguard.failover.model.RegionId;
import tech.regionguard.failover.replication.ReplicationLagTracker;
import tech.regionguard.failover.state.InMemoryFailoverStateStore;
import tech.regionguard.failover.warning.InMemoryWarningService;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class FailoverResourceTest {

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");

    private FailoverResource resource;

    @BeforeEach
    void setUp() {
        resource = new FailoverResource();
        resource.engine = mock(FailoverDecisionEngine.class);
        resource.lagTracker = new ReplicationLagTracker(clock, Duration.ofSeconds(60));
        resource.stateStore = new InMemoryFailoverStateStore();
        resource.warningService = new InMemoryWarningService();
        resource.clock = clock;
    }

    @Test
    void shouldReturnPlanWithProgress() {
        // Given
        CutoverPlan plan = CutoverPlan.failover(RegionId.PRIMARY, RegionId.SECONDARY, clock.instant(), "test");
        CutoverExecution execution = CutoverExecution.start(plan, clock.instant());
        resource.stateStore.saveExecution(execution);

        // When
        Response response = resource.getPlan(plan.planId());

        // Then
        assertEquals(200, response.getStatus());
        assertEquals(execution, response.getEntity());
    }

    @Test
    void shouldReturnNotFoundForUnknownPlan() {
        Response response = resource.getPlan("missing");

        assertEquals(404, response.getStatus());
        assertEquals("PLAN_NOT_FOUND", ((ErrorResponse) response.getEntity()).code());
    }

    @Test
    void shouldDefaultManualFailoverReason() {
        resource.manualFailover(null);

        verify(resource.engine).requestFailover("operator request");
    }

    @Test
    void shouldRecordReportedLagAtCurrentTime() {
        // When
        Map<String, Object> result = resource.reportReplicationLag(
            new FailoverResource.LagReport("orders", "SECONDARY", 1200, null));

        // Then
        assertEquals(true, result.get("accepted"));
        assertEquals(1200, resource.lagTracker.currentLag("orders").lagMillis());
        assertFalse(resource.lagTracker.currentLag("orders").stale());
    }

    @Test
    void shouldRejectOutOfOrderLagReport() {
        long now = clock.millis();
        resource.reportReplicationLag(new FailoverResource.LagReport("orders", "SECONDARY", 100, now));

        Map<String, Object> result = resource.reportReplicationLag(
            new FailoverResource.LagReport("orders", "SECONDARY", 900, now - 5000));

        assertEquals(false, result.get("accepted"));
        assertEquals(100, resource.lagTracker.currentLag("orders").lagMillis());
    }

    @Test
    void shouldRejectLagReportWithoutStore() {
        assertThrows(IllegalArgumentException.class, () -> resource.reportReplicationLag(
            new FailoverResource.LagReport(null, "SECONDARY", 100, null)));
    }

    @Test
    void shouldAcknowledgeWarnings() {
        String id = resource.warningService.addWarning("FAILOVER", "WARNING", "lag rising", "test");

        assertEquals(200, resource.acknowledgeWarning(id).getStatus());
        assertEquals(404, resource.acknowledgeWarning("missing").getStatus());
        assertTrue(resource.getWarnings(true).isEmpty());
        assertEquals(1, resource.getWarnings(false).size());
    }

    @Test
    void shouldMapPlanInProgressToConflict() {
        Response response = new FailoverExceptionMappers.PlanInProgressMapper()
            .toResponse(new PlanInProgressException("plan-1"));

        assertEquals(409, response.getStatus());
        assertEquals("PLAN_IN_PROGRESS", ((ErrorResponse) response.getEntity()).code());
    }

    @Test
    void shouldLiftWriteFenceThroughEngine() throws Exception {
        resource.liftWriteFence("PRIMARY");

        verify(resource.engine).liftWriteFence(RegionId.PRIMARY);
        verify(resource.engine).status();
    }

    @Test
    void shouldMapFenceBackendFailureToServiceUnavailable() {
        Response response = new FailoverExceptionMappers.WriteFenceMapper()
            .toResponse(new WriteFenceException("ssm PutParameter throttled"));

        assertEquals(503, response.getStatus());
        assertEquals("WRITE_FENCE_UNAVAILABLE", ((ErrorResponse) response.getEntity()).code());
    }
}
