package tech.regionguard.failover.endpoint;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.regionguard.failover.decision.EngineStatus;
import tech.regionguard.failover.decision.FailoverDecisionEngine;
import tech.regionguard.failover.fence.WriteFenceException;
import tech.regionguard.failover.health.HealthAggregator;
import tech.regionguard.failover.model.CutoverExecution;
import tech.regionguard.failover.model.CutoverPlan;
import tech.regionguard.failover.model.HealthVerdict;
import tech.regionguard.failover.model.RegionId;
import tech.regionguard.failover.model.ReplicationLag;
import tech.regionguard.failover.model.ReplicationLagSample;
import tech.regionguard.failover.replication.ReplicationLagTracker;
import tech.regionguard.failover.routing.TrafficRoutingStrategy;
import tech.regionguard.failover.state.FailoverStateStore;
import tech.regionguard.failover.warning.Warning;
import tech.regionguard.failover.warning.WarningService;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Path("/failover")
@Tag(name = "Failover", description = "Operating mode, cutover plans and operator actions")
@Produces(MediaType.APPLICATION_JSON)
public class FailoverResource {

    @Inject
    FailoverDecisionEngine engine;

    @Inject
    HealthAggregator aggregator;

    @Inject
    ReplicationLagTracker lagTracker;

    @Inject
    FailoverStateStore stateStore;

    @Inject
    TrafficRoutingStrategy routing;

    @Inject
    WarningService warningService;

    @Inject
    Clock clock;

    @Schema(description = "Manual failover request")
    public record ManualFailoverRequest(
        @Schema(description = "Why the operator is failing over", example = "primary database maintenance overran")
        String reason
    ) {
    }

    @Schema(description = "Replication lag reported by a store")
    public record LagReport(
        @Schema(description = "Store id as configured under failover.stores", example = "transactions")
        String storeId,
        @Schema(description = "Region receiving the replicated writes", example = "SECONDARY")
        String regionId,
        @Schema(description = "Lag in milliseconds", example = "1200")
        long lagMillis,
        @Schema(description = "When the lag was measured, epoch millis. Defaults to now.")
        Long timestampMillis
    ) {
    }

    @GET
    @Path("/status")
    @Operation(summary = "Get failover status", description = "Operating mode, active region, verdicts, worst lag and running plan")
    public EngineStatus getStatus() {
        return engine.status();
    }

    @GET
    @Path("/verdicts")
    @Operation(summary = "Get region health verdicts")
    public List<HealthVerdict> getVerdicts() {
        return new ArrayList<>(aggregator.snapshot().values());
    }

    @GET
    @Path("/routing")
    @Operation(summary = "Get traffic routing status")
    public TrafficRoutingStrategy.RoutingStatus getRoutingStatus() {
        return routing.getStatus();
    }

    @GET
    @Path("/plans")
    @Operation(summary = "List cutover plan executions", description = "Retained plan history, newest first")
    public List<CutoverExecution> getPlans() {
        return stateStore.listExecutions();
    }

    @GET
    @Path("/plans/{planId}")
    @Operation(summary = "Get a cutover plan execution with per-step progress")
    @APIResponse(responseCode = "404", description = "Unknown plan")
    public Response getPlan(@PathParam("planId") @Parameter(description = "Plan id") String planId) {
        return stateStore.findExecution(planId)
            .map(execution -> Response.ok(execution).build())
            .orElseGet(() -> FailoverExceptionMappers.error(Response.Status.NOT_FOUND, "PLAN_NOT_FOUND",
                "Unknown plan: " + planId));
    }

    @POST
    @Path("/plans/{planId}/cancel")
    @Operation(summary = "Cancel a running plan",
        description = "Only allowed before storage promotion or traffic redirect has completed")
    @APIResponse(responseCode = "409", description = "Plan committed or not running")
    public CutoverExecution cancelPlan(@PathParam("planId") @Parameter(description = "Plan id") String planId) {
        return engine.cancelPlan(planId);
    }

    @POST
    @Path("/failback/confirm")
    @Operation(summary = "Confirm the proposed fail-back")
    @APIResponse(responseCode = "409", description = "No fail-back proposed")
    public EngineStatus confirmFailback() {
        return engine.confirmFailback();
    }

    @POST
    @Path("/automation/resume")
    @Operation(summary = "Resume automation halted by a failed plan")
    public EngineStatus resumeAutomation() {
        return engine.resumeAutomation();
    }

    @POST
    @Path("/write-fence/{regionId}/lift")
    @Operation(summary = "Lift a region's write fence",
        description = "Re-enables writes in a region fenced by a plan that failed after promotion or redirect started")
    @APIResponse(responseCode = "409", description = "Plan in progress")
    @APIResponse(responseCode = "503", description = "Fence backend unavailable")
    public EngineStatus liftWriteFence(@PathParam("regionId") @Parameter(description = "Region id") String regionId)
            throws WriteFenceException {
        engine.liftWriteFence(RegionId.of(regionId));
        return engine.status();
    }

    @POST
    @Path("/manual-failover")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Request a failover to the secondary region",
        description = "Allowed in DEGRADED mode when the secondary is healthy and replication lag is within the RPO bound")
    @APIResponse(responseCode = "409", description = "Plan in progress, wrong mode or unsafe target")
    public CutoverPlan manualFailover(ManualFailoverRequest request) {
        String reason = request != null && request.reason() != null ? request.reason() : "operator request";
        return engine.requestFailover(reason);
    }

    @GET
    @Path("/replication/lag")
    @Operation(summary = "Get replication lag per store and receiving region")
    public List<ReplicationLag> getReplicationLag() {
        return lagTracker.snapshot();
    }

    @POST
    @Path("/replication/lag")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Report replication lag", description = "Samples older than the latest estimate are ignored")
    @APIResponse(responseCode = "400", description = "Invalid sample")
    public Map<String, Object> reportReplicationLag(LagReport report) {
        if (report == null || report.storeId() == null || report.regionId() == null) {
            throw new IllegalArgumentException("storeId and regionId are required");
        }
        long timestamp = report.timestampMillis() != null ? report.timestampMillis() : clock.millis();
        boolean accepted = lagTracker.record(new ReplicationLagSample(report.storeId(),
            RegionId.of(report.regionId()), report.lagMillis(), timestamp));
        return Map.of("accepted", accepted);
    }

    @GET
    @Path("/warnings")
    @Operation(summary = "Get warnings")
    public List<Warning> getWarnings(
            @QueryParam("unacknowledged") @DefaultValue("false") @Parameter(description = "Only unacknowledged") boolean unacknowledged) {
        return unacknowledged ? warningService.getUnacknowledgedWarnings() : warningService.getAllWarnings();
    }

    @POST
    @Path("/warnings/{warningId}/acknowledge")
    @Operation(summary = "Acknowledge a warning")
    public Response acknowledgeWarning(@PathParam("warningId") @Parameter(description = "Warning ID") String warningId) {
        if (warningService.acknowledgeWarning(warningId)) {
            return Response.ok(Map.of("status", "success")).build();
        }
        return FailoverExceptionMappers.error(Response.Status.NOT_FOUND, "WARNING_NOT_FOUND", "Warning not found");
    }
}
