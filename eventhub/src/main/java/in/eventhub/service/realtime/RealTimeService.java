package in.eventhub.service.realtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.eventhub.config.RealtimeConfig;
import in.eventhub.domain.common.NotificationLevel;
import in.eventhub.domain.connection.ConnectionStats;
import in.eventhub.domain.event.Event;
import in.eventhub.domain.event.EventTarget;
import in.eventhub.domain.message.MessageCodec;
import in.eventhub.infrastructure.metrics.RealtimeMetrics;
import in.eventhub.infrastructure.pubsub.PubSubBackbone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Consumer;

/**
 * Real-time service: owns the connection manager, the event bus and the heartbeat.
 *
 * Lifecycle: {@link #start()} starts the bus subscribers, then the heartbeat.
 * {@link #stop()} stops both and disconnects every client; it is idempotent and safe
 * before or after a partial start.
 */
public final class RealTimeService {
    private static final Logger log = LoggerFactory.getLogger(RealTimeService.class);

    private final String instanceId;
    private final ConnectionManager connections;
    private final EventBus eventBus;
    private final HeartbeatSupervisor heartbeat;
    private final ObjectMapper mapper;
    private final Clock clock;

    private volatile boolean running = false;
    private volatile Instant startedAt;

    public RealTimeService(String instanceId, ConnectionManager connections, EventBus eventBus,
                           HeartbeatSupervisor heartbeat, ObjectMapper mapper, Clock clock) {
        this.instanceId = instanceId;
        this.connections = connections;
        this.eventBus = eventBus;
        this.heartbeat = heartbeat;
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * Wire a service from configuration.
     */
    public static RealTimeService create(RealtimeConfig config, PubSubBackbone backbone,
                                         RealtimeMetrics metrics, ObjectMapper mapper) {
        Clock clock = Clock.systemUTC();
        RateLimiter rateLimiter = new RateLimiter(config.rateLimitPerMinute(), clock);
        ConnectionManager connections = new ConnectionManager(rateLimiter, new MessageCodec(mapper), metrics, clock);
        EventBus bus = new EventBus(backbone, connections, mapper, config.channelPrefix(),
            config.instanceId(), metrics, clock);
        HeartbeatSupervisor heartbeat = new HeartbeatSupervisor(connections, config.heartbeatInterval(),
            config.idleTimeout(), metrics, clock);
        return new RealTimeService(config.instanceId(), connections, bus, heartbeat, mapper, clock);
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    public synchronized void start() {
        if (running) {
            log.warn("Real-time service already running");
            return;
        }

        log.info("Starting real-time service (instance={})", instanceId);
        try {
            eventBus.startSubscribers();
            heartbeat.start();
        } catch (RuntimeException e) {
            log.error("Real-time service failed to start, rolling back", e);
            heartbeat.stop();
            eventBus.stopSubscribers();
            throw e;
        }
        startedAt = clock.instant();
        running = true;
        log.info("Real-time service started");
    }

    public synchronized void stop() {
        log.info("Stopping real-time service (instance={})", instanceId);
        running = false;
        heartbeat.stop();
        eventBus.stopSubscribers();
        int closed = connections.disconnectAll();
        startedAt = null;
        log.info("Real-time service stopped ({} connections closed)", closed);
    }

    public boolean isRunning() {
        return running;
    }

    // ═══════════════════════════════════════════════════════════════
    // PUBLISH
    // ═══════════════════════════════════════════════════════════════

    public Event publishEvent(String type, JsonNode data, EventTarget target) {
        return eventBus.publishEvent(type, data, target);
    }

    /**
     * Broadcast an event built from any Jackson-serializable payload.
     */
    public Event publishEvent(String type, Object payload) {
        return eventBus.publishEvent(type, mapper.valueToTree(payload), EventTarget.broadcast());
    }

    public Event publishUserEvent(String type, String userId, Object payload) {
        return eventBus.publishEvent(type, mapper.valueToTree(payload), EventTarget.user(userId));
    }

    public Event publishSessionEvent(String type, String sessionId, Object payload) {
        return eventBus.publishEvent(type, mapper.valueToTree(payload), EventTarget.session(sessionId));
    }

    public Event publishRoomEvent(String type, String room, Object payload) {
        return eventBus.publishEvent(type, mapper.valueToTree(payload), EventTarget.room(room));
    }

    public boolean publishProgressUpdate(String operationId, ObjectNode fields) {
        return eventBus.publishProgressUpdate(operationId, fields);
    }

    public boolean publishProgressUpdate(String operationId, ObjectNode fields, EventTarget target) {
        return eventBus.publishProgressUpdate(operationId, fields, target);
    }

    public boolean publishNotification(NotificationLevel level, String title, String message,
                                       String actionUrl, EventTarget target) {
        return eventBus.publishNotification(level, title, message, actionUrl, target);
    }

    public void addEventListener(Consumer<Event> listener) {
        eventBus.addEventListener(listener);
    }

    // ═══════════════════════════════════════════════════════════════
    // OBSERVABILITY
    // ═══════════════════════════════════════════════════════════════

    public ConnectionStats getStats() {
        return connections.getStats();
    }

    public ServiceStatus getServiceStatus() {
        Instant started = startedAt;
        long uptime = started == null ? 0 : Duration.between(started, clock.instant()).getSeconds();
        return new ServiceStatus(
            running,
            instanceId,
            uptime,
            heartbeat.isRunning(),
            heartbeat.getLastBeatAt(),
            eventBus.subscriberStates(),
            eventBus.listenerCount(),
            connections.getStats());
    }

    public String getInstanceId() {
        return instanceId;
    }

    public ConnectionManager connectionManager() {
        return connections;
    }

    public EventBus eventBus() {
        return eventBus;
    }

    public HeartbeatSupervisor heartbeat() {
        return heartbeat;
    }
}
