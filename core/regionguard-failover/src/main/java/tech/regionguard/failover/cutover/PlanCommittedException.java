package tech.regionguard.failover.cutover;

/**
 * Cancellation was requested after a step with an external side effect completed.
 */
public class PlanCommittedException extends RuntimeException {

    public PlanCommittedException(String planId, int lastSuccessfulStep) {
        super("Plan " + planId + " is committed (step " + lastSuccessfulStep + " done) and will run to completion");
    }
}
