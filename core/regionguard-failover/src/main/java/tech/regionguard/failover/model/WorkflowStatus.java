package tech.regionguard.failover.model;

public enum WorkflowStatus {
    IN_FLIGHT,
    MANUAL_RECONCILIATION,
    COMPLETED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED;
    }
}
