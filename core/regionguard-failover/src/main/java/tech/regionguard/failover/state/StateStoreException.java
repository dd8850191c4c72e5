package tech.regionguard.failover.state;

/**
 * The state backend failed. Callers cannot assume the write happened.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
