package tech.regionguard.failover.workflow;

import org.jboss.logging.Logger;
import tech.regionguard.failover.model.RegionId;
import tech.regionguard.failover.model.SideEffectStatus;
import tech.regionguard.failover.model.WorkflowExecutionRecord;

import java.util.List;

/**
 * Used when no workflow runtime is integrated. Reports nothing in flight and every
 * side effect as unknown, so records registered through the REST API end up in
 * manual reconciliation instead of being replayed blindly.
 */
public class NoOpWorkflowEngine implements WorkflowEngine {

    private static final Logger LOG = Logger.getLogger(NoOpWorkflowEngine.class);

    @Override
    public List<WorkflowExecutionRecord> listInFlight(RegionId region) {
        return List.of();
    }

    @Override
    public void resume(String workflowId, int fromStep, String idempotencyToken) {
        LOG.infof("[NoOp] resume workflow %s from step %d (token %s)", workflowId, fromStep, idempotencyToken);
    }

    @Override
    public void abort(String workflowId) {
        LOG.infof("[NoOp] abort workflow %s", workflowId);
    }

    @Override
    public SideEffectStatus sideEffectStatus(String workflowId, int step, String idempotencyToken) {
        return SideEffectStatus.UNKNOWN;
    }
}
