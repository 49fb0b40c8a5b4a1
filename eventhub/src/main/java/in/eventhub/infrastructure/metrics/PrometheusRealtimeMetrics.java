package in.eventhub.infrastructure.metrics;

import in.eventhub.domain.message.MessageType;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;

/**
 * Prometheus implementation of RealtimeMetrics.
 *
 * Key Metrics:
 * - realtime_connections_active - live connections on this instance
 * - realtime_connections_total{event} - opened / closed / handshake_failed
 * - realtime_messages_sent_total{type} - messages written to clients
 * - realtime_bytes_sent_total - serialized bytes written
 * - realtime_messages_dropped_total{reason} - rate_limited / send_failed
 * - realtime_bus_messages_total{topic, outcome} - pub/sub consumption
 * - realtime_heartbeats_total - heartbeat rounds
 *
 * Usage:
 * <pre>
 * PrometheusRealtimeMetrics metrics = new PrometheusRealtimeMetrics();
 * routes.get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusRealtimeMetrics implements RealtimeMetrics {

    private final CollectorRegistry registry;

    private final Gauge activeConnections;
    private final Counter connectionEvents;
    private final Counter messagesSent;
    private final Counter bytesSent;
    private final Counter messagesDropped;
    private final Counter busMessages;
    private final Counter heartbeats;
    private final Gauge lastHeartbeatDelivered;

    public PrometheusRealtimeMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusRealtimeMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.activeConnections = Gauge.build()
            .name("realtime_connections_active")
            .help("Live WebSocket connections on this instance")
            .register(registry);

        this.connectionEvents = Counter.build()
            .name("realtime_connections_total")
            .help("Connection lifecycle events")
            .labelNames("event")
            .register(registry);

        this.messagesSent = Counter.build()
            .name("realtime_messages_sent_total")
            .help("Messages written to clients")
            .labelNames("type")
            .register(registry);

        this.bytesSent = Counter.build()
            .name("realtime_bytes_sent_total")
            .help("Serialized bytes written to clients")
            .register(registry);

        this.messagesDropped = Counter.build()
            .name("realtime_messages_dropped_total")
            .help("Messages not delivered to a connection")
            .labelNames("reason")
            .register(registry);

        this.busMessages = Counter.build()
            .name("realtime_bus_messages_total")
            .help("Messages consumed from pub/sub topics")
            .labelNames("topic", "outcome")
            .register(registry);

        this.heartbeats = Counter.build()
            .name("realtime_heartbeats_total")
            .help("Heartbeat rounds")
            .register(registry);

        this.lastHeartbeatDelivered = Gauge.build()
            .name("realtime_heartbeat_last_delivered")
            .help("Connections reached by the latest heartbeat")
            .register(registry);
    }

    @Override
    public void connectionOpened() {
        activeConnections.inc();
        connectionEvents.labels("opened").inc();
    }

    @Override
    public void connectionClosed() {
        activeConnections.dec();
        connectionEvents.labels("closed").inc();
    }

    @Override
    public void handshakeFailed() {
        connectionEvents.labels("handshake_failed").inc();
    }

    @Override
    public void messageSent(MessageType type, int bytes) {
        messagesSent.labels(type.wireName()).inc();
        bytesSent.inc(bytes);
    }

    @Override
    public void rateLimited() {
        messagesDropped.labels("rate_limited").inc();
    }

    @Override
    public void sendFailed() {
        messagesDropped.labels("send_failed").inc();
    }

    @Override
    public void busMessage(String topic, String outcome) {
        busMessages.labels(topic, outcome).inc();
    }

    @Override
    public void heartbeat(int delivered) {
        heartbeats.inc();
        lastHeartbeatDelivered.set(delivered);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
