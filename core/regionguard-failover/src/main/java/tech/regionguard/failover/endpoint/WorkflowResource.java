package tech.regionguard.failover.endpoint;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.regionguard.failover.health.HealthAggregator;
import tech.regionguard.failover.model.RegionId;
import tech.regionguard.failover.model.WorkflowExecutionRecord;
import tech.regionguard.failover.state.FailoverStateStore;
import tech.regionguard.failover.workflow.WorkflowConsistencyGuard;
import tech.regionguard.failover.workflow.WorkflowNotFoundException;

import java.util.List;

/**
 * Lets workflow runtimes report step progress, and operators resolve workflows
 * flagged for manual reconciliation.
 */
@Path("/failover/workflows")
@Tag(name = "Workflows", description = "In-flight workflow tracking across cutovers")
@Produces(MediaType.APPLICATION_JSON)
public class WorkflowResource {

    @Inject
    WorkflowConsistencyGuard guard;

    @Inject
    FailoverStateStore stateStore;

    @Inject
    HealthAggregator aggregator;

    @Schema(description = "Start tracking a workflow")
    public record BeginRequest(
        @Schema(description = "Workflow id", example = "payment-7f3a")
        String workflowId,
        @Schema(description = "Region running the workflow, defaults to the active region", example = "PRIMARY")
        String regionId
    ) {
    }

    @Schema(description = "Operator resolution of a workflow awaiting manual reconciliation")
    public record ResolveRequest(
        @Schema(description = "APPLIED, NOT_APPLIED or ABORT")
        WorkflowConsistencyGuard.Resolution resolution
    ) {
    }

    @GET
    @Operation(summary = "List tracked workflows")
    public List<WorkflowExecutionRecord> list() {
        return stateStore.listWorkflows();
    }

    @GET
    @Path("/manual")
    @Operation(summary = "List workflows awaiting manual reconciliation")
    public List<WorkflowExecutionRecord> pendingManual() {
        return guard.pendingManualReconciliations();
    }

    @GET
    @Path("/{workflowId}")
    @Operation(summary = "Get a tracked workflow")
    @APIResponse(responseCode = "404", description = "Unknown workflow")
    public WorkflowExecutionRecord get(@PathParam("workflowId") @Parameter(description = "Workflow id") String workflowId) {
        return stateStore.findWorkflow(workflowId).orElseThrow(() -> new WorkflowNotFoundException(workflowId));
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Start tracking a workflow", description = "Returns the existing record if already in flight")
    public WorkflowExecutionRecord begin(BeginRequest request) {
        if (request == null || request.workflowId() == null || request.workflowId().isBlank()) {
            throw new IllegalArgumentException("workflowId is required");
        }
        RegionId region = request.regionId() != null ? RegionId.of(request.regionId()) : aggregator.activeRegion();
        return guard.begin(request.workflowId(), region);
    }

    @POST
    @Path("/{workflowId}/steps/{stepIndex}/committed")
    @Operation(summary = "Record a committed step", description = "Idempotent; older step indexes are ignored")
    public WorkflowExecutionRecord stepCommitted(
            @PathParam("workflowId") @Parameter(description = "Workflow id") String workflowId,
            @PathParam("stepIndex") @Parameter(description = "Zero-based step index") int stepIndex) {
        return guard.stepCommitted(workflowId, stepIndex);
    }

    @POST
    @Path("/{workflowId}/complete")
    @Operation(summary = "Mark a workflow completed")
    public WorkflowExecutionRecord complete(@PathParam("workflowId") @Parameter(description = "Workflow id") String workflowId) {
        return guard.complete(workflowId);
    }

    @POST
    @Path("/{workflowId}/resolve")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Resolve a workflow awaiting manual reconciliation")
    @APIResponse(responseCode = "409", description = "Workflow is not awaiting manual reconciliation")
    public WorkflowExecutionRecord resolve(
            @PathParam("workflowId") @Parameter(description = "Workflow id") String workflowId,
            ResolveRequest request) {
        if (request == null || request.resolution() == null) {
            throw new IllegalArgumentException("resolution is required");
        }
        return guard.resolveManually(workflowId, request.resolution());
    }
}
