package in.eventhub.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.eventhub.domain.common.NotificationLevel;
import in.eventhub.domain.connection.ConnectionDetails;
import in.eventhub.domain.event.Event;
import in.eventhub.domain.event.EventTarget;
import in.eventhub.domain.event.Notification;
import in.eventhub.domain.message.MessagePayload;
import in.eventhub.domain.message.OutboundMessage;
import in.eventhub.service.realtime.RealTimeService;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Deque;

/**
 * HTTP handlers for operating the real-time core.
 *
 * - GET  /api/realtime/stats                    - connection statistics
 * - GET  /api/realtime/status                   - service status
 * - GET  /api/realtime/connections/{id}         - one connection's metadata and counters
 * - POST /api/realtime/connections/{id}/close   - force-close one connection
 * - POST /api/realtime/broadcast                - system notification to every local connection
 * - POST /api/realtime/events                   - publish an event through the bus
 * - GET  /health                                - liveness
 *
 * Must run on a worker thread (wrap in a BlockingHandler): delivery writes block.
 */
public final class RealtimeAdminHandlers {
    private static final Logger log = LoggerFactory.getLogger(RealtimeAdminHandlers.class);

    private final RealTimeService service;
    private final ObjectMapper mapper;

    public RealtimeAdminHandlers(RealTimeService service, ObjectMapper mapper) {
        this.service = service;
        this.mapper = mapper;
    }

    /**
     * GET /api/realtime/stats
     */
    public void getStats(HttpServerExchange exchange) {
        try {
            sendJson(exchange, StatusCodes.OK, service.getStats());
        } catch (Exception e) {
            log.error("Failed to get realtime stats: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to get stats: " + e.getMessage());
        }
    }

    /**
     * GET /api/realtime/status
     */
    public void getStatus(HttpServerExchange exchange) {
        try {
            sendJson(exchange, StatusCodes.OK, service.getServiceStatus());
        } catch (Exception e) {
            log.error("Failed to get realtime status: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to get status: " + e.getMessage());
        }
    }

    /**
     * GET /api/realtime/connections/{id}
     */
    public void getConnection(HttpServerExchange exchange) {
        String connectionId = pathParam(exchange, "id");
        ConnectionDetails details = service.connectionManager().describe(connectionId);
        if (details == null) {
            sendError(exchange, StatusCodes.NOT_FOUND, "Connection not found: " + connectionId);
            return;
        }

        try {
            sendJson(exchange, StatusCodes.OK, details);
        } catch (Exception e) {
            log.error("Failed to describe connection {}: {}", connectionId, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to get connection");
        }
    }

    /**
     * POST /api/realtime/connections/{id}/close
     */
    public void closeConnection(HttpServerExchange exchange) {
        String connectionId = pathParam(exchange, "id");
        if (connectionId == null || !service.connectionManager().isConnected(connectionId)) {
            sendError(exchange, StatusCodes.NOT_FOUND, "Connection not found: " + connectionId);
            return;
        }

        try {
            service.connectionManager().disconnect(connectionId);
            ObjectNode body = mapper.createObjectNode();
            body.put("success", true);
            body.put("message", "Connection " + connectionId + " closed successfully");
            sendJson(exchange, StatusCodes.OK, body);
            log.info("POST /api/realtime/connections/{}/close → 200 OK", connectionId);
        } catch (Exception e) {
            log.error("Failed to close connection {}: {}", connectionId, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to close connection");
        }
    }

    /**
     * POST /api/realtime/broadcast
     *
     * Body: {"title", "message", "level"?, "action_url"?}
     */
    public void broadcast(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                JsonNode json = readObject(body);
                String title = json.path("title").asText(null);
                String message = json.path("message").asText(null);
                if (title == null && message == null) {
                    sendError(ex, StatusCodes.BAD_REQUEST, "title or message is required");
                    return;
                }

                Notification notification = new Notification(null,
                    NotificationLevel.parse(json.path("level").asText(null)),
                    title, message, json.path("action_url").asText(null),
                    Instant.now(), EventTarget.broadcast());
                int sent = service.connectionManager().broadcast(
                    OutboundMessage.of(new MessagePayload.SystemNotification(notification)));

                ObjectNode result = mapper.createObjectNode();
                result.put("success", true);
                result.put("notification_id", notification.id());
                result.put("sent_to", sent);
                sendJson(ex, StatusCodes.OK, result);
                log.info("POST /api/realtime/broadcast → 200 OK (sent to {} connections)", sent);

            } catch (IllegalArgumentException e) {
                log.warn("Invalid broadcast request: {}", e.getMessage());
                sendError(ex, StatusCodes.BAD_REQUEST, "Invalid request: " + e.getMessage());
            } catch (Exception e) {
                log.error("Failed to broadcast: {}", e.getMessage(), e);
                sendError(ex, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to broadcast: " + e.getMessage());
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * POST /api/realtime/events
     *
     * Body: {"type", "data"?, "scope"?, "target"?}
     */
    public void publishEvent(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                JsonNode json = readObject(body);
                String type = json.path("type").asText("");
                if (type.isBlank()) {
                    sendError(ex, StatusCodes.BAD_REQUEST, "type is required");
                    return;
                }
                EventTarget target = EventTarget.of(json.path("scope").asText(null), json.path("target").asText(null));

                Event event = service.publishEvent(type, json.get("data"), target);

                ObjectNode result = mapper.createObjectNode();
                result.put("success", true);
                result.put("event_id", event.eventId());
                result.put("timestamp", event.timestamp().toString());
                sendJson(ex, StatusCodes.ACCEPTED, result);
                log.info("POST /api/realtime/events → 202 Accepted (type={}, target={})", type, target);

            } catch (IllegalArgumentException e) {
                log.warn("Invalid event request: {}", e.getMessage());
                sendError(ex, StatusCodes.BAD_REQUEST, "Invalid request: " + e.getMessage());
            } catch (Exception e) {
                log.error("Failed to publish event: {}", e.getMessage(), e);
                sendError(ex, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to publish event: " + e.getMessage());
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * GET /health
     */
    public void health(HttpServerExchange exchange) {
        exchange.setStatusCode(service.isRunning() ? StatusCodes.OK : StatusCodes.SERVICE_UNAVAILABLE);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(service.isRunning() ? "OK" : "STOPPED", StandardCharsets.UTF_8);
    }

    private JsonNode readObject(String body) {
        JsonNode json;
        try {
            json = body == null || body.isBlank() ? null : mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed JSON body");
        }
        if (json == null || !json.isObject()) {
            throw new IllegalArgumentException("body must be a JSON object");
        }
        return json;
    }

    private static String pathParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null ? null : values.peekFirst();
    }

    private void sendJson(HttpServerExchange exchange, int status, Object data) throws JsonProcessingException {
        String json = mapper.writeValueAsString(data);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        ObjectNode body = mapper.createObjectNode();
        body.put("success", false);
        body.put("error", message);
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
    }
}
