package in.eventhub.service.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.eventhub.domain.common.NotificationLevel;
import in.eventhub.domain.event.Event;
import in.eventhub.domain.event.EventTarget;
import in.eventhub.domain.event.Notification;
import in.eventhub.domain.event.ProgressUpdate;
import in.eventhub.domain.message.MessagePayload;
import in.eventhub.domain.message.OutboundMessage;
import in.eventhub.infrastructure.metrics.RealtimeMetrics;
import in.eventhub.infrastructure.pubsub.PubSubBackbone;
import in.eventhub.infrastructure.pubsub.ReconnectionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Bridges the local ConnectionManager to the shared pub/sub backbone.
 *
 * Three topics under one prefix: {@code <prefix>:events}, {@code <prefix>:progress},
 * {@code <prefix>:notifications}. Each topic has one {@link SubscriberLoop} that decodes
 * incoming messages and fans them out to the local connections.
 *
 * Events are delivered locally at publish time; the copy that comes back from the backbone is
 * recognized by its origin instance id and dropped.
 */
public final class EventBus {
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    public static final String EVENTS = "events";
    public static final String PROGRESS = "progress";
    public static final String NOTIFICATIONS = "notifications";

    static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofSeconds(1);

    private final PubSubBackbone backbone;
    private final ConnectionManager connections;
    private final BusCodec codec;
    private final String channelPrefix;
    private final String instanceId;
    private final RealtimeMetrics metrics;
    private final Clock clock;
    private final Supplier<ReconnectionPolicy> policyFactory;
    private final Duration pollTimeout;

    private final List<Consumer<Event>> listeners = new CopyOnWriteArrayList<>();
    private final List<SubscriberLoop> loops = new ArrayList<>();  // guarded by this

    public EventBus(PubSubBackbone backbone, ConnectionManager connections, ObjectMapper mapper,
                    String channelPrefix, String instanceId, RealtimeMetrics metrics, Clock clock) {
        this(backbone, connections, mapper, channelPrefix, instanceId, metrics, clock,
             ReconnectionPolicy::forSubscriber, DEFAULT_POLL_TIMEOUT);
    }

    public EventBus(PubSubBackbone backbone, ConnectionManager connections, ObjectMapper mapper,
                    String channelPrefix, String instanceId, RealtimeMetrics metrics, Clock clock,
                    Supplier<ReconnectionPolicy> policyFactory, Duration pollTimeout) {
        this.backbone = backbone;
        this.connections = connections;
        this.codec = new BusCodec(mapper);
        this.channelPrefix = channelPrefix;
        this.instanceId = instanceId;
        this.metrics = metrics;
        this.clock = clock;
        this.policyFactory = policyFactory;
        this.pollTimeout = pollTimeout;
    }

    public String topic(String kind) {
        return channelPrefix + ":" + kind;
    }

    // ═══════════════════════════════════════════════════════════════
    // PUBLISH
    // ═══════════════════════════════════════════════════════════════

    /**
     * Publish an event to every instance and deliver it to this instance's connections.
     * Local delivery happens even when the backbone is unreachable.
     *
     * @param target null means broadcast
     * @return the published envelope
     */
    public Event publishEvent(String type, JsonNode data, EventTarget target) {
        Event event = Event.create(type, data, target, instanceId, clock.instant());

        try {
            backbone.publish(topic(EVENTS), codec.encodeEvent(event));
            log.debug("[BUS] Published event {} type={} target={}", event.eventId(), type, event.target());
        } catch (JsonProcessingException e) {
            log.error("[BUS] Failed to serialize event type={}: {}", type, e.getOriginalMessage());
        } catch (RuntimeException e) {
            log.error("[BUS] Failed to publish event type={}: {}", type, e.getMessage());
        }

        handleEvent(event);
        return event;
    }

    public boolean publishProgressUpdate(String operationId, ObjectNode fields) {
        return publishProgressUpdate(operationId, fields, null);
    }

    /**
     * @param target null means broadcast; followers of one operation join
     *               {@link ProgressUpdate#roomFor(String)}
     * @return false if the backbone rejected the message
     */
    public boolean publishProgressUpdate(String operationId, ObjectNode fields, EventTarget target) {
        ProgressUpdate update = new ProgressUpdate(operationId, clock.instant(), fields, target);
        try {
            backbone.publish(topic(PROGRESS), codec.encodeProgress(update));
            return true;
        } catch (JsonProcessingException e) {
            log.error("[BUS] Failed to serialize progress for {}: {}", operationId, e.getOriginalMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("[BUS] Failed to publish progress for {}: {}", operationId, e.getMessage());
            return false;
        }
    }

    /**
     * @return false if the backbone rejected the message
     */
    public boolean publishNotification(NotificationLevel level, String title, String message,
                                       String actionUrl, EventTarget target) {
        Notification notification = new Notification(null, level, title, message, actionUrl,
            clock.instant(), target);
        try {
            backbone.publish(topic(NOTIFICATIONS), codec.encodeNotification(notification));
            return true;
        } catch (JsonProcessingException e) {
            log.error("[BUS] Failed to serialize notification '{}': {}", title, e.getOriginalMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("[BUS] Failed to publish notification '{}': {}", title, e.getMessage());
            return false;
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // LISTENERS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Register a callback invoked for every event this instance handles.
     */
    public void addEventListener(Consumer<Event> listener) {
        listeners.add(listener);
    }

    public void removeEventListener(Consumer<Event> listener) {
        listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    // ═══════════════════════════════════════════════════════════════
    // SUBSCRIBERS
    // ═══════════════════════════════════════════════════════════════

    public synchronized void startSubscribers() {
        if (!loops.isEmpty()) {
            log.warn("[BUS] Subscribers already started");
            return;
        }
        loops.add(newLoop(EVENTS, this::onEventMessage));
        loops.add(newLoop(PROGRESS, this::onProgressMessage));
        loops.add(newLoop(NOTIFICATIONS, this::onNotificationMessage));
        for (SubscriberLoop loop : loops) {
            loop.start();
        }
    }

    /**
     * Stop all subscriber loops and wait for them. Idempotent.
     */
    public synchronized void stopSubscribers() {
        for (SubscriberLoop loop : loops) {
            loop.stop();
        }
        loops.clear();
    }

    public synchronized boolean isRunning() {
        return !loops.isEmpty() && loops.stream().allMatch(SubscriberLoop::isRunning);
    }

    /**
     * @return subscription state per topic kind
     */
    public synchronized Map<String, Boolean> subscriberStates() {
        Map<String, Boolean> states = new LinkedHashMap<>();
        for (String kind : List.of(EVENTS, PROGRESS, NOTIFICATIONS)) {
            states.put(kind, false);
        }
        for (SubscriberLoop loop : loops) {
            states.put(loop.getName(), loop.isSubscribed());
        }
        return states;
    }

    private SubscriberLoop newLoop(String kind, Consumer<String> handler) {
        return new SubscriberLoop(kind, topic(kind), backbone, handler, policyFactory.get(), pollTimeout);
    }

    // ═══════════════════════════════════════════════════════════════
    // DISPATCH
    // ═══════════════════════════════════════════════════════════════

    void onEventMessage(String payload) {
        Event event;
        try {
            event = codec.decodeEvent(payload);
        } catch (BusCodec.MalformedBusMessageException e) {
            log.warn("[BUS] Skipping malformed event: {}", e.getMessage());
            metrics.busMessage(EVENTS, "malformed");
            return;
        }

        if (instanceId.equals(event.origin())) {
            metrics.busMessage(EVENTS, "skipped");
            return;
        }
        handleEvent(event);
    }

    void onProgressMessage(String payload) {
        ProgressUpdate update;
        try {
            update = codec.decodeProgress(payload);
        } catch (BusCodec.MalformedBusMessageException e) {
            log.warn("[BUS] Skipping malformed progress update: {}", e.getMessage());
            metrics.busMessage(PROGRESS, "malformed");
            return;
        }

        int sent = connections.deliver(update.target(),
            OutboundMessage.of(new MessagePayload.Progress(update)), null);
        metrics.busMessage(PROGRESS, "delivered");
        log.debug("[BUS] Progress {} delivered to {} connections", update.operationId(), sent);
    }

    void onNotificationMessage(String payload) {
        Notification notification;
        try {
            notification = codec.decodeNotification(payload);
        } catch (BusCodec.MalformedBusMessageException e) {
            log.warn("[BUS] Skipping malformed notification: {}", e.getMessage());
            metrics.busMessage(NOTIFICATIONS, "malformed");
            return;
        }

        int sent = connections.deliver(notification.target(),
            OutboundMessage.of(new MessagePayload.SystemNotification(notification)), null);
        metrics.busMessage(NOTIFICATIONS, "delivered");
        log.debug("[BUS] Notification {} delivered to {} connections", notification.id(), sent);
    }

    private void handleEvent(Event event) {
        int sent = connections.deliver(event.target(),
            OutboundMessage.of(new MessagePayload.EventDelivery(event)),
            info -> info.acceptsEventType(event.type()));
        metrics.busMessage(EVENTS, "delivered");
        log.debug("[BUS] Event {} delivered to {} connections", event.eventId(), sent);

        for (Consumer<Event> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("[BUS] Event listener failed for event {}", event.eventId(), e);
            }
        }
    }
}
