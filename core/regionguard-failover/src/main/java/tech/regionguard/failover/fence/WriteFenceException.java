package tech.regionguard.failover.fence;

public class WriteFenceException extends Exception {

    public WriteFenceException(String message) {
        super(message);
    }

    public WriteFenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
