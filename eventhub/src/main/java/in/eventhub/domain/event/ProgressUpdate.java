package in.eventhub.domain.event;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * Progress tick for a long-running operation.
 *
 * @param fields free-form progress fields (percentage, processed_items, phase, ...)
 */
public record ProgressUpdate(String operationId, Instant timestamp, ObjectNode fields, EventTarget target) {
    public ProgressUpdate {
        if (operationId == null || operationId.isBlank()) {
            throw new IllegalArgumentException("operationId is required");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        if (fields == null) {
            fields = JsonNodeFactory.instance.objectNode();
        }
        if (target == null) {
            target = EventTarget.broadcast();
        }
    }

    /**
     * Room joined by clients following one operation.
     */
    public static String roomFor(String operationId) {
        return "progress:" + operationId;
    }
}
