package in.eventhub.transport.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.eventhub.auth.AuthResult;
import in.eventhub.domain.connection.ClientTransport;
import in.eventhub.domain.connection.ConnectionInfo;
import in.eventhub.domain.message.MessagePayload;
import in.eventhub.domain.message.MessageType;
import in.eventhub.domain.message.OutboundMessage;
import in.eventhub.service.realtime.ConnectionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Client side of a connection's life: open, inbound frames, close.
 *
 * Inbound frames are JSON {@code {"type": ..., "data": {...}}}:
 * <pre>
 * ping                      → pong
 * join_room / leave_room    data.room         → ack
 * subscribe / unsubscribe   data.event_types  → ack
 * collaboration_update      data.*            → relayed to the rest of the session
 * cursor_update             data.*            → relayed to the rest of the session
 * </pre>
 * Anything else gets an ERROR reply; the connection stays open.
 */
public final class InboundMessageRouter {
    private static final Logger log = LoggerFactory.getLogger(InboundMessageRouter.class);

    public static final String INVALID_MESSAGE = "INVALID_MESSAGE";
    public static final String UNKNOWN_MESSAGE_TYPE = "UNKNOWN_MESSAGE_TYPE";

    private final ConnectionManager connections;
    private final ObjectMapper mapper;
    private final Clock clock;

    // connectionId -> route and user, for close handling; outlives the manager's entry
    private final ConcurrentMap<String, OpenStream> routes = new ConcurrentHashMap<>();

    private record OpenStream(StreamRoute route, String userId) {
    }

    public InboundMessageRouter(ConnectionManager connections, ObjectMapper mapper, Clock clock) {
        this.connections = connections;
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * Register the connection, join the route's room and send the welcome message.
     *
     * @param auth null for anonymous streams
     * @return false if the connection manager refused the connection
     */
    public boolean open(ClientTransport transport, String connectionId, AuthResult auth, StreamRoute route) {
        String userId = auth == null ? null : auth.userId();
        String sessionId = route.isSession() ? route.key() : (auth == null ? null : auth.sessionId());

        if (!connections.connect(transport, connectionId, userId, sessionId)) {
            return false;
        }
        routes.put(connectionId, new OpenStream(route, userId));

        String room = route.room();
        if (room != null) {
            connections.joinRoom(connectionId, room);
        }

        Map<String, String> context = new LinkedHashMap<>();
        context.put("stream", route.kind().name().toLowerCase(Locale.ROOT));
        if (userId != null) {
            context.put("user_id", userId);
        }
        String message = switch (route.kind()) {
            case EVENTS -> "Connected to event stream";
            case PROGRESS -> {
                context.put("operation_id", route.key());
                yield "Connected to progress updates";
            }
            case NOTIFICATIONS -> "Connected to notifications";
            case SESSION -> {
                context.put("session_id", route.key());
                yield "Connected to collaborative session";
            }
        };

        if (route.isSession()) {
            connections.sendToSession(route.key(), OutboundMessage.of(new MessagePayload.Collaboration(
                MessageType.COLLABORATION_JOIN, route.key(), userId, connectionId, null)), Set.of(connectionId));
        }
        connections.sendToConnection(connectionId,
            OutboundMessage.of(new MessagePayload.Connected(connectionId, message, context)));
        return true;
    }

    /**
     * Handle one text frame from the client.
     */
    public void onText(String connectionId, String raw) {
        ConnectionInfo info = connections.connection(connectionId);
        if (info == null) {
            return;
        }
        connections.recordInbound(connectionId, raw.getBytes(StandardCharsets.UTF_8).length);

        JsonNode msg;
        try {
            msg = mapper.readTree(raw);
        } catch (Exception e) {
            sendError(connectionId, INVALID_MESSAGE, "Invalid JSON message");
            return;
        }
        if (msg == null || !msg.isObject() || !msg.path("type").isTextual()) {
            sendError(connectionId, INVALID_MESSAGE, "Message must be an object with a 'type'");
            return;
        }

        String type = msg.get("type").asText();
        JsonNode data = msg.path("data");

        switch (type) {
            case "ping" -> {
                JsonNode nonce = data.get("nonce");
                connections.sendToConnection(connectionId, OutboundMessage.of(
                    new MessagePayload.Pong(clock.instant(), nonce == null || nonce.isNull() ? null : nonce.asText())));
            }
            case "join_room" -> {
                String room = data.path("room").asText("");
                if (room.isBlank()) {
                    sendError(connectionId, INVALID_MESSAGE, "join_room requires data.room");
                    return;
                }
                connections.joinRoom(connectionId, room);
                sendAck(connectionId, "join_room", info);
            }
            case "leave_room" -> {
                String room = data.path("room").asText("");
                if (room.isBlank()) {
                    sendError(connectionId, INVALID_MESSAGE, "leave_room requires data.room");
                    return;
                }
                connections.leaveRoom(connectionId, room);
                sendAck(connectionId, "leave_room", info);
            }
            case "subscribe" -> {
                info.subscribeEventTypes(eventTypes(data));
                sendAck(connectionId, "subscribe", info);
            }
            case "unsubscribe" -> {
                info.unsubscribeEventTypes(eventTypes(data));
                sendAck(connectionId, "unsubscribe", info);
            }
            case "collaboration_update" -> relay(connectionId, info, MessageType.COLLABORATION_UPDATE, data);
            case "cursor_update" -> relay(connectionId, info, MessageType.COLLABORATION_CURSOR, data);
            default -> sendError(connectionId, UNKNOWN_MESSAGE_TYPE, "Unknown message type: " + type);
        }
    }

    /**
     * Channel closed, by the client, a failed socket or the server. Idempotent.
     * Session members are told about the leave even if the server already unregistered the connection.
     */
    public void onClose(String connectionId) {
        OpenStream stream = routes.remove(connectionId);
        if (stream == null) {
            return;
        }
        connections.disconnect(connectionId);
        StreamRoute route = stream.route();
        if (route.isSession()) {
            connections.sendToSession(route.key(), OutboundMessage.of(new MessagePayload.Collaboration(
                MessageType.COLLABORATION_LEAVE, route.key(), stream.userId(), connectionId, null)),
                Set.of(connectionId));
        }
    }

    int trackedRoutes() {
        return routes.size();
    }

    private void relay(String connectionId, ConnectionInfo info, MessageType kind, JsonNode data) {
        OpenStream stream = routes.get(connectionId);
        StreamRoute route = stream == null ? null : stream.route();
        if (route == null || !route.isSession()) {
            sendError(connectionId, UNKNOWN_MESSAGE_TYPE, kind.wireName() + " is only accepted on session streams");
            return;
        }
        ObjectNode body = data.isObject() ? ((ObjectNode) data).deepCopy() : mapper.createObjectNode();
        int sent = connections.sendToSession(route.key(), OutboundMessage.of(new MessagePayload.Collaboration(
            kind, route.key(), info.getUserId(), connectionId, body)), Set.of(connectionId));
        log.debug("Relayed {} from {} to {} session members", kind.wireName(), connectionId, sent);
    }

    private static Set<String> eventTypes(JsonNode data) {
        Set<String> types = new LinkedHashSet<>();
        JsonNode node = data.path("event_types");
        if (node.isArray()) {
            node.forEach(t -> {
                if (t.isTextual() && !t.asText().isBlank()) {
                    types.add(t.asText());
                }
            });
        } else if (node.isTextual() && !node.asText().isBlank()) {
            types.add(node.asText());
        }
        return types;
    }

    private void sendAck(String connectionId, String action, ConnectionInfo info) {
        connections.sendToConnection(connectionId, OutboundMessage.of(
            new MessagePayload.Ack(action, connectionId, info.getRooms(), info.getEventTypes())));
    }

    private void sendError(String connectionId, String code, String message) {
        connections.sendToConnection(connectionId, OutboundMessage.of(new MessagePayload.ErrorReport(code, message)));
    }
}
