package in.eventhub.domain.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable event envelope distributed over the bus.
 *
 * @param origin instance id of the publisher, used to skip the publisher's own copy
 */
public record Event(
    String eventId,
    String type,
    Instant timestamp,
    JsonNode data,
    EventTarget target,
    String origin
) {
    public Event {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Event type is required");
        }
        if (eventId == null) {
            eventId = UUID.randomUUID().toString();
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        if (data == null) {
            data = JsonNodeFactory.instance.objectNode();
        }
        if (target == null) {
            target = EventTarget.broadcast();
        }
    }

    public static Event create(String type, JsonNode data, EventTarget target, String origin, Instant now) {
        return new Event(UUID.randomUUID().toString(), type, now, data, target, origin);
    }
}
