package in.eventhub.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.eventhub.auth.JwtService;
import in.eventhub.config.RealtimeConfig;
import in.eventhub.infrastructure.metrics.PrometheusMetricsHandler;
import in.eventhub.infrastructure.metrics.PrometheusRealtimeMetrics;
import in.eventhub.infrastructure.pubsub.InMemoryPubSubBackbone;
import in.eventhub.infrastructure.pubsub.PubSubBackbone;
import in.eventhub.infrastructure.pubsub.RedisPubSubBackbone;
import in.eventhub.service.realtime.RealTimeService;
import in.eventhub.transport.http.RealtimeAdminHandlers;
import in.eventhub.transport.ws.InboundMessageRouter;
import in.eventhub.transport.ws.RealtimeWebSocketEndpoint;
import in.eventhub.transport.ws.StreamKind;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * EventHub real-time server.
 *
 * Wires:
 * - Pub/sub backbone (Redis via Lettuce, or in-memory)
 * - Real-time service (connections, event bus, heartbeat)
 * - WebSocket endpoints under /ws
 * - Admin API under /api/realtime, /metrics, /health
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== EventHub Real-Time Core Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        RealtimeConfig config = RealtimeConfig.fromEnv();
        ObjectMapper mapper = objectMapper();

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusRealtimeMetrics metrics = new PrometheusRealtimeMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Pub/Sub Backbone
        // ═══════════════════════════════════════════════════════════════
        PubSubBackbone backbone = config.useRedis()
            ? new RedisPubSubBackbone(config.redisUri())
            : new InMemoryPubSubBackbone();
        log.info("✓ Pub/sub backbone: {} (prefix={}, instance={})",
            config.useRedis() ? config.redisUri() : "in-memory", config.channelPrefix(), config.instanceId());

        // ═══════════════════════════════════════════════════════════════
        // Real-Time Service
        // ═══════════════════════════════════════════════════════════════
        RealTimeService service = RealTimeService.create(config, backbone, metrics, mapper);
        service.start();
        log.info("✓ Real-time service started (rate limit {}/min, heartbeat {}s)",
            config.rateLimitPerMinute(), config.heartbeatInterval().getSeconds());

        JwtService jwtService = new JwtService(config.jwtSecret());
        InboundMessageRouter router = new InboundMessageRouter(service.connectionManager(), mapper, Clock.systemUTC());
        RealtimeWebSocketEndpoint ws = new RealtimeWebSocketEndpoint(router, jwtService);
        RealtimeAdminHandlers admin = new RealtimeAdminHandlers(service, mapper);
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());

        // ═══════════════════════════════════════════════════════════════
        // HTTP / WebSocket Server
        // ═══════════════════════════════════════════════════════════════
        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/health", admin::health)
            .get("/api/realtime/stats", admin::getStats)
            .get("/api/realtime/status", admin::getStatus)
            .get("/api/realtime/connections/{id}", new BlockingHandler(admin::getConnection))
            .post("/api/realtime/connections/{id}/close", new BlockingHandler(admin::closeConnection))
            .post("/api/realtime/broadcast", new BlockingHandler(admin::broadcast))
            .post("/api/realtime/events", new BlockingHandler(admin::publishEvent));
        for (StreamKind kind : StreamKind.values()) {
            routes.get(kind.pathTemplate(), ws.handler(kind));
        }
        int port = config.port();
        routes.setFallbackHandler(exchange -> {
            exchange.setStatusCode(StatusCodes.NOT_FOUND);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
            exchange.getResponseSender().send(
                "EventHub Real-Time Core\n\n" +
                "WS:    ws://localhost:" + port + "/ws[?token=<jwt>]\n" +
                "       /ws/progress/{operationId}, /ws/notifications, /ws/session/{sessionId}?token=<jwt>\n" +
                "Admin: GET /api/realtime/stats, /api/realtime/status, /api/realtime/connections/{id}, /metrics, /health\n"
            );
        });

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(routes)
            .build();
        server.start();
        log.info("✓ EventHub started on http://localhost:{}/", port);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down EventHub...");
            service.stop();
            server.stop();
            backbone.close();
            log.info("EventHub stopped");
        }, "shutdown"));
    }

    static ObjectMapper objectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    private App() {}
}
