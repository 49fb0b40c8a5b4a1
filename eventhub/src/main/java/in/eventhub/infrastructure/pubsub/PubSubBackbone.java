package in.eventhub.infrastructure.pubsub;

import java.time.Duration;

/**
 * Topic-based publish/subscribe shared by all instances.
 *
 * Fire-and-forget: a message published while nobody is subscribed is lost.
 * Implementations throw {@link PubSubException} when the backbone is unreachable.
 */
public interface PubSubBackbone extends AutoCloseable {

    /**
     * @return number of subscribers that received the message, when the backbone reports it
     */
    long publish(String topic, String payload);

    Subscription subscribe(String topic);

    @Override
    void close();

    /**
     * One live subscription to a topic.
     */
    interface Subscription extends AutoCloseable {

        /**
         * Wait up to {@code timeout} for the next message.
         *
         * @return the payload, or null on timeout
         * @throws PubSubException if the subscription was lost
         */
        String poll(Duration timeout) throws InterruptedException;

        String topic();

        @Override
        void close();
    }
}
