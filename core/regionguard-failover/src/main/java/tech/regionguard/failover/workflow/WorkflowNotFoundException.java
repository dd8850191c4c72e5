package tech.regionguard.failover.workflow;

public class WorkflowNotFoundException extends RuntimeException {

    public WorkflowNotFoundException(String workflowId) {
        super("Unknown workflow: " + workflowId);
    }
}
