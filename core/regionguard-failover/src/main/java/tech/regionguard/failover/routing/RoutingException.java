package tech.regionguard.failover.routing;

/**
 * The routing layer rejected or failed an operation.
 */
public class RoutingException extends Exception {

    public RoutingException(String message) {
        super(message);
    }

    public RoutingException(String message, Throwable cause) {
        super(message, cause);
    }
}
