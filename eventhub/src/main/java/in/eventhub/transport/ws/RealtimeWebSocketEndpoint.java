package in.eventhub.transport.ws;

import in.eventhub.auth.AuthResult;
import in.eventhub.auth.Authenticator;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Undertow-native WebSocket endpoint:
 * - Optional token authentication (?token=xxx), required on session streams
 * - One handshake handler per {@link StreamKind}
 * - Inbound frames handled off the I/O thread, in order, per connection
 */
public final class RealtimeWebSocketEndpoint {
    private static final Logger log = LoggerFactory.getLogger(RealtimeWebSocketEndpoint.class);

    public static final int CLOSE_AUTH_FAILED = 4001;
    public static final int CLOSE_BAD_REQUEST = 4000;

    private final InboundMessageRouter router;
    private final Authenticator authenticator;

    public RealtimeWebSocketEndpoint(InboundMessageRouter router, Authenticator authenticator) {
        this.router = router;
        this.authenticator = authenticator;
    }

    public WebSocketProtocolHandshakeHandler handler(StreamKind kind) {
        return new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                accept(kind, exchange, channel);
            }
        });
    }

    private void accept(StreamKind kind, WebSocketHttpExchange exchange, WebSocketChannel channel) {
        Map<String, List<String>> params = exchange.getRequestParameters();

        StreamRoute route;
        try {
            route = StreamRoute.fromParameters(kind, params);
        } catch (IllegalArgumentException e) {
            reject(channel, CLOSE_BAD_REQUEST, e.getMessage());
            return;
        }

        AuthResult auth = null;
        String token = StreamRoute.first(params, "token");
        if (token != null) {
            auth = authenticator.authenticate(token);
            if (auth == null) {
                reject(channel, CLOSE_AUTH_FAILED, "Authentication failed");
                return;
            }
        } else if (kind.requiresToken()) {
            reject(channel, CLOSE_AUTH_FAILED, "Authentication required");
            return;
        }
        if (route.isSession() && auth.userId() == null) {
            reject(channel, CLOSE_AUTH_FAILED, "User ID required");
            return;
        }

        String connectionId = UUID.randomUUID().toString();
        UndertowTransport transport = new UndertowTransport(channel, exchange.getRequestHeader("User-Agent"));
        SerialExecutor inbound = new SerialExecutor(channel.getWorker());
        AuthResult identity = auth;

        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                String text = message.getData();
                inbound.execute(() -> router.onText(connectionId, text));
            }

            @Override
            protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                inbound.execute(() -> router.onClose(connectionId));
                super.onCloseMessage(cm, ch);
            }

            @Override
            protected void onError(WebSocketChannel ch, Throwable error) {
                log.warn("WS error on {}: {}", connectionId, error.toString());
                inbound.execute(() -> router.onClose(connectionId));
                super.onError(ch, error);
            }
        });
        channel.addCloseTask(ch -> inbound.execute(() -> router.onClose(connectionId)));

        inbound.execute(() -> {
            if (!router.open(transport, connectionId, identity, route)) {
                reject(channel, CloseMessage.UNEXPECTED_ERROR, "Connection refused");
            }
        });
        channel.resumeReceives();
    }

    private static void reject(WebSocketChannel channel, int code, String reason) {
        log.warn("WS connection rejected from {}: {}", channel.getSourceAddress(), reason);
        WebSockets.sendClose(code, reason, channel, null);
        // read the peer's close reply so the channel can finish closing
        channel.getReceiveSetter().set(new AbstractReceiveListener() {
        });
        channel.resumeReceives();
    }
}
