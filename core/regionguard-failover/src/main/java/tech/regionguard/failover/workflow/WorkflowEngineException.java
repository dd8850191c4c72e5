package tech.regionguard.failover.workflow;

/**
 * Raised when the workflow engine cannot answer or apply a request.
 */
public class WorkflowEngineException extends Exception {

    public WorkflowEngineException(String message) {
        super(message);
    }

    public WorkflowEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
