package tech.regionguard.failover.model;

/**
 * What the workflow engine knows about a step's side effect, looked up by idempotency token.
 */
public enum SideEffectStatus {
    APPLIED,
    NOT_APPLIED,
    UNKNOWN
}
