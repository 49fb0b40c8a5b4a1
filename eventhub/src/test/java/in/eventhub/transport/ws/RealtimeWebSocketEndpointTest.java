package in.eventhub.transport.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.eventhub.auth.JwtService;
import in.eventhub.config.RealtimeConfig;
import in.eventhub.domain.event.EventTarget;
import in.eventhub.infrastructure.metrics.RealtimeMetrics;
import in.eventhub.infrastructure.pubsub.InMemoryPubSubBackbone;
import in.eventhub.service.realtime.RealTimeService;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end test of the WebSocket endpoints over a real Undertow listener.
 *
 * Tests:
 * - Welcome message and progress delivery
 * - Token checks on session streams
 * - Client ping / pong
 * - Disconnect cleanup
 */
class RealtimeWebSocketEndpointTest {

    private static final int TEST_PORT = 19192;
    private static final String SECRET = "ws-test-secret";
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private InMemoryPubSubBackbone backbone;
    private RealTimeService service;
    private JwtService jwt;
    private Undertow server;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() throws InterruptedException {
        backbone = new InMemoryPubSubBackbone();
        RealtimeConfig config = new RealtimeConfig(TEST_PORT, "memory", null, "test:ws", 1000,
            Duration.ofMinutes(5), Duration.ZERO, SECRET, "ws-1");
        service = RealTimeService.create(config, backbone, RealtimeMetrics.noop(), MAPPER);
        service.start();
        long deadline = System.currentTimeMillis() + 5_000;
        while (!service.eventBus().subscriberStates().values().stream().allMatch(s -> s)) {
            if (System.currentTimeMillis() > deadline) {
                fail("Bus subscribers did not come up");
            }
            Thread.sleep(10);
        }

        jwt = new JwtService(SECRET);
        InboundMessageRouter router = new InboundMessageRouter(service.connectionManager(), MAPPER, Clock.systemUTC());
        RealtimeWebSocketEndpoint ws = new RealtimeWebSocketEndpoint(router, jwt);

        RoutingHandler routes = Handlers.routing();
        for (StreamKind kind : StreamKind.values()) {
            routes.get(kind.pathTemplate(), ws.handler(kind));
        }
        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(routes)
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    void tearDown() {
        service.stop();
        if (server != null) {
            server.stop();
        }
        backbone.close();
    }

    /**
     * Client side of one socket: collects text messages and the close code.
     */
    private static final class Client implements WebSocket.Listener {
        final BlockingQueue<String> messages = new LinkedBlockingQueue<>();
        final CompletableFuture<Integer> closed = new CompletableFuture<>();
        private final StringBuilder partial = new StringBuilder();
        WebSocket socket;

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                messages.add(partial.toString());
                partial.setLength(0);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            closed.complete(statusCode);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            closed.completeExceptionally(error);
        }

        JsonNode next() throws Exception {
            String message = messages.poll(5, TimeUnit.SECONDS);
            assertNotNull(message, "No message within 5s");
            return MAPPER.readTree(message);
        }

        void send(String text) {
            socket.sendText(text, true).join();
        }
    }

    private Client connect(String path) throws Exception {
        Client client = new Client();
        client.socket = httpClient.newWebSocketBuilder()
            .buildAsync(URI.create("ws://localhost:" + TEST_PORT + path), client)
            .get(5, TimeUnit.SECONDS);
        return client;
    }

    private void awaitConnections(int expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (service.connectionManager().connectionCount() != expected) {
            if (System.currentTimeMillis() > deadline) {
                fail("Expected " + expected + " connections, found " + service.connectionManager().connectionCount());
            }
            Thread.sleep(10);
        }
    }

    @Test
    void testProgressStream() throws Exception {
        Client client = connect("/ws/progress/op-42");

        JsonNode welcome = client.next();
        assertEquals("connect", welcome.path("type").asText());
        assertEquals("op-42", welcome.path("data").path("operation_id").asText());

        service.publishProgressUpdate("op-42", MAPPER.createObjectNode().put("percentage", 50),
            EventTarget.room("progress:op-42"));

        JsonNode progress = client.next();
        assertEquals("progress_update", progress.path("type").asText());
        assertEquals(50, progress.path("data").path("percentage").asInt());
    }

    @Test
    void testPingPong() throws Exception {
        Client client = connect("/ws");
        client.next();

        client.send("{\"type\":\"ping\",\"data\":{\"nonce\":\"abc\"}}");

        JsonNode pong = client.next();
        assertEquals("pong", pong.path("type").asText());
        assertEquals("abc", pong.path("data").path("nonce").asText());
    }

    @Test
    void testAuthenticatedEventStream() throws Exception {
        String token = jwt.generateToken("u-7", null, List.of(), Duration.ofMinutes(5));
        Client client = connect("/ws?token=" + token);

        JsonNode welcome = client.next();
        assertEquals("u-7", welcome.path("data").path("user_id").asText());

        service.publishUserEvent("inbox.new", "u-7", Map.of("count", 3));

        JsonNode event = client.next();
        assertEquals("event", event.path("type").asText());
        assertEquals("inbox.new", event.path("data").path("type").asText());
    }

    @Test
    void testSessionStreamRequiresToken() throws Exception {
        Client client = connect("/ws/session/s-1");

        assertEquals(RealtimeWebSocketEndpoint.CLOSE_AUTH_FAILED, client.closed.get(5, TimeUnit.SECONDS));
        assertEquals(0, service.connectionManager().connectionCount());
    }

    @Test
    void testInvalidTokenRejected() throws Exception {
        Client client = connect("/ws/notifications?token=forged.token.value");

        assertEquals(RealtimeWebSocketEndpoint.CLOSE_AUTH_FAILED, client.closed.get(5, TimeUnit.SECONDS));
    }

    @Test
    void testSessionCollaboration() throws Exception {
        String aliceToken = jwt.generateToken("alice", null, List.of(), Duration.ofMinutes(5));
        String bobToken = jwt.generateToken("bob", null, List.of(), Duration.ofMinutes(5));

        Client alice = connect("/ws/session/doc-1?token=" + aliceToken);
        assertEquals("doc-1", alice.next().path("data").path("session_id").asText());
        Client bob = connect("/ws/session/doc-1?token=" + bobToken);
        bob.next();

        JsonNode joined = alice.next();
        assertEquals("collaboration_join", joined.path("type").asText());
        assertEquals("bob", joined.path("data").path("user_id").asText());

        bob.send("{\"type\":\"cursor_update\",\"data\":{\"line\":3}}");

        JsonNode cursor = alice.next();
        assertEquals("collaboration_cursor", cursor.path("type").asText());
        assertEquals(3, cursor.path("data").path("line").asInt());
    }

    @Test
    void testClientCloseRemovesConnection() throws Exception {
        Client client = connect("/ws");
        client.next();
        awaitConnections(1);

        client.socket.sendClose(WebSocket.NORMAL_CLOSURE, "bye").get(5, TimeUnit.SECONDS);

        awaitConnections(0);
    }
}
