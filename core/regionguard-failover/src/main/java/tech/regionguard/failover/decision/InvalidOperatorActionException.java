package tech.regionguard.failover.decision;

/**
 * An operator request that does not apply in the current state, such as confirming a
 * fail-back while nothing is proposed.
 */
public class InvalidOperatorActionException extends RuntimeException {

    public InvalidOperatorActionException(String message) {
        super(message);
    }
}
