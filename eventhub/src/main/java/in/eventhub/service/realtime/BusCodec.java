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

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * JSON form of the three bus message kinds.
 *
 * <pre>
 * events:        {"id","type","timestamp","data","target":{"scope","id"},"origin"}
 * progress:      {"operation_id","timestamp","fields":{...},"target":{...}}
 * notifications: {"id","level","title","message","action_url","timestamp","target":{...}}
 * </pre>
 *
 * Decoders throw {@link MalformedBusMessageException} for anything they cannot use.
 */
public final class BusCodec {
    private final ObjectMapper mapper;

    public BusCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    // ═══════════════════════════════════════════════════════════════
    // EVENTS
    // ═══════════════════════════════════════════════════════════════

    public String encodeEvent(Event event) throws JsonProcessingException {
        ObjectNode root = mapper.createObjectNode();
        root.put("id", event.eventId());
        root.put("type", event.type());
        root.put("timestamp", event.timestamp().toString());
        root.set("data", event.data());
        root.set("target", targetNode(event.target()));
        if (event.origin() != null) {
            root.put("origin", event.origin());
        }
        return mapper.writeValueAsString(root);
    }

    public Event decodeEvent(String json) {
        JsonNode root = parse(json);
        String type = requiredText(root, "type");
        return new Event(
            text(root, "id"),
            type,
            timestamp(root),
            root.get("data"),
            target(root),
            text(root, "origin"));
    }

    // ═══════════════════════════════════════════════════════════════
    // PROGRESS
    // ═══════════════════════════════════════════════════════════════

    public String encodeProgress(ProgressUpdate update) throws JsonProcessingException {
        ObjectNode root = mapper.createObjectNode();
        root.put("operation_id", update.operationId());
        root.put("timestamp", update.timestamp().toString());
        root.set("fields", update.fields());
        root.set("target", targetNode(update.target()));
        return mapper.writeValueAsString(root);
    }

    public ProgressUpdate decodeProgress(String json) {
        JsonNode root = parse(json);
        String operationId = requiredText(root, "operation_id");
        JsonNode fields = root.get("fields");
        if (fields != null && !fields.isNull() && !fields.isObject()) {
            throw new MalformedBusMessageException("progress fields must be an object");
        }
        return new ProgressUpdate(operationId, timestamp(root),
            fields == null || fields.isNull() ? null : (ObjectNode) fields, target(root));
    }

    // ═══════════════════════════════════════════════════════════════
    // NOTIFICATIONS
    // ═══════════════════════════════════════════════════════════════

    public String encodeNotification(Notification notification) throws JsonProcessingException {
        ObjectNode root = mapper.createObjectNode();
        root.put("id", notification.id());
        root.put("level", notification.level().wireName());
        root.put("title", notification.title());
        root.put("message", notification.message());
        if (notification.actionUrl() != null) {
            root.put("action_url", notification.actionUrl());
        }
        root.put("timestamp", notification.timestamp().toString());
        root.set("target", targetNode(notification.target()));
        return mapper.writeValueAsString(root);
    }

    public Notification decodeNotification(String json) {
        JsonNode root = parse(json);
        if (!root.hasNonNull("title") && !root.hasNonNull("message")) {
            throw new MalformedBusMessageException("notification has neither title nor message");
        }
        return new Notification(
            text(root, "id"),
            NotificationLevel.parse(text(root, "level")),
            text(root, "title"),
            text(root, "message"),
            text(root, "action_url"),
            timestamp(root),
            target(root));
    }

    // ═══════════════════════════════════════════════════════════════

    private ObjectNode targetNode(EventTarget target) {
        ObjectNode node = mapper.createObjectNode();
        node.put("scope", target.scope().name().toLowerCase(Locale.ROOT));
        if (target.id() != null) {
            node.put("id", target.id());
        }
        return node;
    }

    private JsonNode parse(String json) {
        if (json == null) {
            throw new MalformedBusMessageException("empty bus message");
        }
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedBusMessageException("invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedBusMessageException("bus message is not a JSON object");
        }
        return root;
    }

    private static EventTarget target(JsonNode root) {
        JsonNode target = root.get("target");
        if (target == null || target.isNull()) {
            return EventTarget.broadcast();
        }
        try {
            return EventTarget.of(text(target, "scope"), text(target, "id"));
        } catch (IllegalArgumentException e) {
            throw new MalformedBusMessageException("invalid target: " + e.getMessage(), e);
        }
    }

    private static Instant timestamp(JsonNode root) {
        String value = text(root, "timestamp");
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new MalformedBusMessageException("invalid timestamp: " + value, e);
        }
    }

    private static String requiredText(JsonNode root, String field) {
        String value = text(root, field);
        if (value == null || value.isBlank()) {
            throw new MalformedBusMessageException("missing " + field);
        }
        return value;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    /**
     * Bus payload that cannot be turned into a domain object.
     */
    public static final class MalformedBusMessageException extends RuntimeException {
        public MalformedBusMessageException(String message) {
            super(message);
        }

        public MalformedBusMessageException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
