package in.eventhub.domain.connection;

import java.io.IOException;

/**
 * Duplex channel to one client, as seen by the connection manager.
 * Implementations must serialize {@link #send} so that writes to one socket never interleave.
 */
public interface ClientTransport {

    /**
     * Complete the protocol handshake. Nothing is registered if this throws.
     */
    void handshake() throws IOException;

    /**
     * Write one text frame. An IOException means the connection is dead.
     */
    void send(String text) throws IOException;

    void close(int code, String reason) throws IOException;

    boolean isOpen();

    String remoteAddress();

    String userAgent();
}
