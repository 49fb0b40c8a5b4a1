package in.eventhub.transport.ws;

import in.eventhub.domain.connection.ClientTransport;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;

import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * {@link ClientTransport} over an Undertow WebSocket channel.
 *
 * Sends are blocking so that a dead peer surfaces as an IOException to the caller; they must
 * not run on the channel's I/O thread. {@code synchronized} keeps frames from interleaving.
 */
final class UndertowTransport implements ClientTransport {
    private final WebSocketChannel channel;
    private final String userAgent;

    UndertowTransport(WebSocketChannel channel, String userAgent) {
        this.channel = channel;
        this.userAgent = userAgent;
    }

    @Override
    public void handshake() throws IOException {
        // Undertow has completed the upgrade before the connection callback runs
        if (!channel.isOpen()) {
            throw new IOException("WebSocket channel closed before registration");
        }
    }

    @Override
    public synchronized void send(String text) throws IOException {
        if (!isOpen()) {
            throw new IOException("WebSocket channel is closed");
        }
        WebSockets.sendTextBlocking(text, channel);
    }

    @Override
    public synchronized void close(int code, String reason) throws IOException {
        if (channel.isCloseFrameSent()) {
            return;
        }
        WebSockets.sendClose(code, reason, channel, null);
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen() && !channel.isCloseFrameSent();
    }

    @Override
    public String remoteAddress() {
        InetSocketAddress address = channel.getSourceAddress();
        return address == null ? null : address.getHostString() + ":" + address.getPort();
    }

    @Override
    public String userAgent() {
        return userAgent;
    }
}
