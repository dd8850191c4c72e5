package tech.regionguard.failover.model;

/**
 * Ordered steps of every cutover plan. Step numbers are 1-based.
 */
public enum CutoverStep {
    STOP_SOURCE_WRITES(false),
    VERIFY_REPLICATION_DRAINED(false),
    PROMOTE_TARGET_STORAGE(true),
    REDIRECT_TRAFFIC(true),
    RECONCILE_WORKFLOWS(false),
    MARK_SUCCEEDED(false);

    private final boolean externalSideEffect;

    CutoverStep(boolean externalSideEffect) {
        this.externalSideEffect = externalSideEffect;
    }

    /**
     * Completing a step with an external side effect commits the plan: it can no longer be cancelled.
     */
    public boolean hasExternalSideEffect() {
        return externalSideEffect;
    }

    public int number() {
        return ordinal() + 1;
    }
}
