package in.eventhub.infrastructure.pubsub;

/**
 * Backbone unreachable or subscription lost.
 */
public class PubSubException extends RuntimeException {

    public PubSubException(String message) {
        super(message);
    }

    public PubSubException(String message, Throwable cause) {
        super(message, cause);
    }
}
