package in.eventhub.domain.message;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.eventhub.domain.event.Event;
import in.eventhub.domain.event.Notification;
import in.eventhub.domain.event.ProgressUpdate;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Typed body of an outbound message, one variant per {@link MessageType}.
 */
public sealed interface MessagePayload {

    MessageType type();

    record Connected(String connectionId, String message, Map<String, String> context) implements MessagePayload {
        public Connected {
            Objects.requireNonNull(connectionId, "connectionId");
            context = context == null ? Map.of() : Map.copyOf(context);
        }

        @Override
        public MessageType type() {
            return MessageType.CONNECT;
        }
    }

    record EventDelivery(Event event) implements MessagePayload {
        public EventDelivery {
            Objects.requireNonNull(event, "event");
        }

        @Override
        public MessageType type() {
            return MessageType.EVENT;
        }
    }

    record Progress(ProgressUpdate update) implements MessagePayload {
        public Progress {
            Objects.requireNonNull(update, "update");
        }

        @Override
        public MessageType type() {
            return MessageType.PROGRESS_UPDATE;
        }
    }

    record SystemNotification(Notification notification) implements MessagePayload {
        public SystemNotification {
            Objects.requireNonNull(notification, "notification");
        }

        @Override
        public MessageType type() {
            return MessageType.SYSTEM_NOTIFICATION;
        }
    }

    record Ping(Instant serverTime) implements MessagePayload {
        @Override
        public MessageType type() {
            return MessageType.PING;
        }
    }

    record Pong(Instant serverTime, String nonce) implements MessagePayload {
        @Override
        public MessageType type() {
            return MessageType.PONG;
        }
    }

    record Ack(String action, String connectionId, Set<String> rooms, Set<String> eventTypes) implements MessagePayload {
        public Ack {
            rooms = rooms == null ? Set.of() : Set.copyOf(rooms);
            eventTypes = eventTypes == null ? Set.of() : Set.copyOf(eventTypes);
        }

        @Override
        public MessageType type() {
            return MessageType.ACK;
        }
    }

    record ErrorReport(String code, String message) implements MessagePayload {
        @Override
        public MessageType type() {
            return MessageType.ERROR;
        }
    }

    /**
     * Join, leave, update and cursor messages of a collaborative session.
     */
    record Collaboration(MessageType kind, String sessionId, String userId, String connectionId,
                         ObjectNode data) implements MessagePayload {
        public Collaboration {
            if (kind == null || !kind.isCollaboration()) {
                throw new IllegalArgumentException("Not a collaboration message type: " + kind);
            }
            if (data == null) {
                data = JsonNodeFactory.instance.objectNode();
            }
        }

        @Override
        public MessageType type() {
            return kind;
        }
    }
}
