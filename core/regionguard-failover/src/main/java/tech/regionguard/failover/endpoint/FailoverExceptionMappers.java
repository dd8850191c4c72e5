package tech.regionguard.failover.endpoint;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import tech.regionguard.failover.cutover.PlanCommittedException;
import tech.regionguard.failover.cutover.PlanInProgressException;
import tech.regionguard.failover.decision.InvalidOperatorActionException;
import tech.regionguard.failover.fence.WriteFenceException;
import tech.regionguard.failover.workflow.WorkflowNotFoundException;

/**
 * Maps failover domain exceptions to HTTP responses.
 */
public final class FailoverExceptionMappers {

    private FailoverExceptionMappers() {
    }

    static Response error(Response.Status status, String code, String message) {
        return Response.status(status)
            .type(MediaType.APPLICATION_JSON)
            .entity(new ErrorResponse(code, message))
            .build();
    }

    @Provider
    public static class PlanInProgressMapper implements ExceptionMapper<PlanInProgressException> {
        @Override
        public Response toResponse(PlanInProgressException exception) {
            return error(Response.Status.CONFLICT, "PLAN_IN_PROGRESS", exception.getMessage());
        }
    }

    @Provider
    public static class PlanCommittedMapper implements ExceptionMapper<PlanCommittedException> {
        @Override
        public Response toResponse(PlanCommittedException exception) {
            return error(Response.Status.CONFLICT, "PLAN_COMMITTED", exception.getMessage());
        }
    }

    @Provider
    public static class InvalidOperatorActionMapper implements ExceptionMapper<InvalidOperatorActionException> {
        @Override
        public Response toResponse(InvalidOperatorActionException exception) {
            return error(Response.Status.CONFLICT, "INVALID_OPERATOR_ACTION", exception.getMessage());
        }
    }

    @Provider
    public static class WorkflowNotFoundMapper implements ExceptionMapper<WorkflowNotFoundException> {
        @Override
        public Response toResponse(WorkflowNotFoundException exception) {
            return error(Response.Status.NOT_FOUND, "WORKFLOW_NOT_FOUND", exception.getMessage());
        }
    }

    @Provider
    public static class WriteFenceMapper implements ExceptionMapper<WriteFenceException> {
        @Override
        public Response toResponse(WriteFenceException exception) {
            return error(Response.Status.SERVICE_UNAVAILABLE, "WRITE_FENCE_UNAVAILABLE", exception.getMessage());
        }
    }

    @Provider
    public static class IllegalArgumentMapper implements ExceptionMapper<IllegalArgumentException> {
        @Override
        public Response toResponse(IllegalArgumentException exception) {
            return error(Response.Status.BAD_REQUEST, "INVALID_REQUEST", exception.getMessage());
        }
    }
}
