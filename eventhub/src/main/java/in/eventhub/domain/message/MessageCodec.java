package in.eventhub.domain.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.eventhub.domain.event.Event;
import in.eventhub.domain.event.EventTarget;
import in.eventhub.domain.event.Notification;
import in.eventhub.domain.event.ProgressUpdate;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Serializes outbound messages to the client wire format:
 * <pre>
 * {"type":"event","data":{...},"timestamp":"2024-01-01T00:00:00Z","message_id":"..."}
 * </pre>
 */
public final class MessageCodec {
    private final ObjectMapper mapper;

    public MessageCodec() {
        this(new ObjectMapper());
    }

    public MessageCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(OutboundMessage message) throws JsonProcessingException {
        return mapper.writeValueAsString(toJson(message));
    }

    public ObjectNode toJson(OutboundMessage message) {
        ObjectNode root = mapper.createObjectNode();
        root.put("type", message.type().wireName());
        root.set("data", dataOf(message.payload()));
        root.put("timestamp", message.timestamp().toString());
        root.put("message_id", message.messageId());
        return root;
    }

    private ObjectNode dataOf(MessagePayload payload) {
        ObjectNode data = mapper.createObjectNode();
        switch (payload.type()) {
            case CONNECT -> {
                MessagePayload.Connected p = (MessagePayload.Connected) payload;
                data.put("connection_id", p.connectionId());
                data.put("message", p.message());
                for (Map.Entry<String, String> e : p.context().entrySet()) {
                    data.put(e.getKey(), e.getValue());
                }
            }
            case EVENT -> {
                Event e = ((MessagePayload.EventDelivery) payload).event();
                data.put("id", e.eventId());
                data.put("type", e.type());
                data.put("timestamp", e.timestamp().toString());
                data.set("data", e.data());
                putTarget(data, e.target());
            }
            case PROGRESS_UPDATE -> {
                ProgressUpdate u = ((MessagePayload.Progress) payload).update();
                data.setAll(u.fields());
                data.put("operation_id", u.operationId());
                data.put("timestamp", u.timestamp().toString());
            }
            case SYSTEM_NOTIFICATION -> {
                Notification n = ((MessagePayload.SystemNotification) payload).notification();
                data.put("id", n.id());
                data.put("level", n.level().wireName());
                data.put("title", n.title());
                data.put("message", n.message());
                if (n.actionUrl() != null) {
                    data.put("action_url", n.actionUrl());
                }
                data.put("timestamp", n.timestamp().toString());
            }
            case PING -> {
                Instant serverTime = ((MessagePayload.Ping) payload).serverTime();
                data.put("timestamp", serverTime.toString());
                data.put("server_time", serverTime.toString());
            }
            case PONG -> {
                MessagePayload.Pong p = (MessagePayload.Pong) payload;
                data.put("timestamp", p.serverTime().toString());
                if (p.nonce() != null) {
                    data.put("nonce", p.nonce());
                }
            }
            case ACK -> {
                MessagePayload.Ack p = (MessagePayload.Ack) payload;
                data.put("action", p.action());
                data.put("connection_id", p.connectionId());
                data.set("rooms", mapper.valueToTree(new TreeSet<>(p.rooms())));
                data.set("event_types", mapper.valueToTree(new TreeSet<>(p.eventTypes())));
            }
            case ERROR -> {
                MessagePayload.ErrorReport p = (MessagePayload.ErrorReport) payload;
                data.put("code", p.code());
                data.put("message", p.message());
            }
            case COLLABORATION_JOIN, COLLABORATION_LEAVE, COLLABORATION_UPDATE, COLLABORATION_CURSOR -> {
                MessagePayload.Collaboration p = (MessagePayload.Collaboration) payload;
                data.setAll(p.data());
                data.put("session_id", p.sessionId());
                data.put("user_id", p.userId());
                data.put("connection_id", p.connectionId());
            }
        }
        return data;
    }

    private static void putTarget(ObjectNode data, EventTarget target) {
        if (target.isBroadcast()) {
            return;
        }
        data.put("scope", target.scope().name().toLowerCase(Locale.ROOT));
        data.put("target", target.id());
    }
}
