package in.eventhub.infrastructure.metrics;

import in.eventhub.domain.message.MessageType;

/**
 * Real-time core metrics for monitoring and alerting.
 *
 * Implementations can publish to Prometheus or any other backend.
 */
public interface RealtimeMetrics {

    /**
     * Record a connection registered after a successful handshake.
     */
    void connectionOpened();

    /**
     * Record a connection removed from the registry.
     */
    void connectionClosed();

    /**
     * Record a handshake that failed before registration.
     */
    void handshakeFailed();

    /**
     * Record a message written to a client.
     *
     * @param type Outbound message type
     * @param bytes Serialized size
     */
    void messageSent(MessageType type, int bytes);

    /**
     * Record a message dropped by the per-connection rate limiter.
     */
    void rateLimited();

    /**
     * Record a transport write failure (connection treated as dead).
     */
    void sendFailed();

    /**
     * Record a message taken off a bus topic.
     *
     * @param topic Logical topic (events, progress, notifications)
     * @param outcome delivered, skipped or malformed
     */
    void busMessage(String topic, String outcome);

    /**
     * Record a heartbeat round.
     *
     * @param delivered Number of connections that received the ping
     */
    void heartbeat(int delivered);

    /**
     * Metrics sink that records nothing.
     */
    static RealtimeMetrics noop() {
        return NoopRealtimeMetrics.INSTANCE;
    }
}
