package in.eventhub.domain.message;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Message sent to a client: {@code {type, data, timestamp, message_id}} on the wire.
 */
public record OutboundMessage(String messageId, Instant timestamp, MessagePayload payload) {

    public OutboundMessage {
        Objects.requireNonNull(payload, "payload");
        if (messageId == null) {
            messageId = UUID.randomUUID().toString();
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static OutboundMessage of(MessagePayload payload) {
        return new OutboundMessage(UUID.randomUUID().toString(), Instant.now(), payload);
    }

    public MessageType type() {
        return payload.type();
    }
}
