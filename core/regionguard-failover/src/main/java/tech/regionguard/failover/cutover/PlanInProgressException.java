package tech.regionguard.failover.cutover;

/**
 * A plan was requested while another is still running. Requests are rejected, never queued.
 */
public class PlanInProgressException extends RuntimeException {

    private final String activePlanId;

    public PlanInProgressException(String activePlanId) {
        super("Cutover plan already in progress: " + activePlanId);
        this.activePlanId = activePlanId;
    }

    public String getActivePlanId() {
        return activePlanId;
    }
}
