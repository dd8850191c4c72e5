package tech.regionguard.failover.workflow;

import tech.regionguard.failover.model.RegionId;
import tech.regionguard.failover.model.SideEffectStatus;
import tech.regionguard.failover.model.WorkflowExecutionRecord;

import java.util.List;

/**
 * The business workflow runtime whose in-flight executions survive a cutover.
 *
 * <p>Steps are addressed by index. Every step carries an idempotency token; the engine
 * must treat a replayed token as the same attempt.</p>
 */
public interface WorkflowEngine {

    /**
     * Workflows known to the engine as running in the given region.
     */
    List<WorkflowExecutionRecord> listInFlight(RegionId region) throws WorkflowEngineException;

    void resume(String workflowId, int fromStep, String idempotencyToken) throws WorkflowEngineException;

    void abort(String workflowId) throws WorkflowEngineException;

    /**
     * Whether the external side effect of a step was applied, looked up by its token.
     * Return {@link SideEffectStatus#UNKNOWN} when the engine cannot tell.
     */
    SideEffectStatus sideEffectStatus(String workflowId, int step, String idempotencyToken)
        throws WorkflowEngineException;
}
