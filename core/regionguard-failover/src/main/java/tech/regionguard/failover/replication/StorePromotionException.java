package tech.regionguard.failover.replication;

public class StorePromotionException extends Exception {

    public StorePromotionException(String message) {
        super(message);
    }

    public StorePromotionException(String message, Throwable cause) {
        super(message, cause);
    }
}
