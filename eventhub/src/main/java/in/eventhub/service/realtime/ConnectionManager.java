package in.eventhub.service.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import in.eventhub.config.RealtimeConfig;
import in.eventhub.domain.connection.ClientTransport;
import in.eventhub.domain.connection.ConnectionDetails;
import in.eventhub.domain.connection.ConnectionInfo;
import in.eventhub.domain.connection.ConnectionStatistics;
import in.eventhub.domain.connection.ConnectionStats;
import in.eventhub.domain.event.EventTarget;
import in.eventhub.domain.message.MessageCodec;
import in.eventhub.domain.message.MessageType;
import in.eventhub.domain.message.OutboundMessage;
import in.eventhub.infrastructure.metrics.RealtimeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Owns the live connections of this instance and provides addressed delivery.
 *
 * Failure policy: nothing in here throws to the caller. Unknown ids are no-ops, a rate-limited
 * message is dropped, and a transport write failure disconnects the connection.
 * Multi-connection sends iterate a snapshot copy of the relevant index, since a send can
 * disconnect (and so un-index) a connection mid-iteration.
 */
public final class ConnectionManager {
    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private static final int CLOSE_NORMAL = 1000;

    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final RateLimiter rateLimiter;
    private final MessageCodec codec;
    private final RealtimeMetrics metrics;
    private final Clock clock;

    public ConnectionManager() {
        this(new RateLimiter(RealtimeConfig.DEFAULT_RATE_LIMIT_PER_MINUTE, Clock.systemUTC()),
             new MessageCodec(), RealtimeMetrics.noop(), Clock.systemUTC());
    }

    public ConnectionManager(RateLimiter rateLimiter, MessageCodec codec, RealtimeMetrics metrics, Clock clock) {
        this.rateLimiter = rateLimiter;
        this.codec = codec;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Complete the handshake and register a connection.
     *
     * @return false if the handshake failed or the id is already registered; nothing is registered then
     */
    public boolean connect(ClientTransport transport, String connectionId, String userId, String sessionId) {
        if (transport == null || connectionId == null) {
            return false;
        }

        try {
            transport.handshake();
        } catch (Exception e) {
            log.error("WS handshake failed: connection={}, error={}", connectionId, e.toString());
            metrics.handshakeFailed();
            return false;
        }

        Instant now = clock.instant();
        ConnectionInfo info = new ConnectionInfo(connectionId, userId, sessionId,
            transport.remoteAddress(), transport.userAgent(), now);
        ConnectionEntry entry = new ConnectionEntry(transport, info,
            new ConnectionStatistics(), rateLimiter.newWindow());

        if (!registry.register(entry)) {
            log.warn("WS connection id already registered: {}", connectionId);
            return false;
        }

        metrics.connectionOpened();
        log.info("WS connected: {} (user={}, session={}, remote={})",
            connectionId, userId, sessionId, info.getRemoteAddress());
        return true;
    }

    /**
     * Remove a connection from the registry and every index, and close its transport.
     * Idempotent; safe to race from client close, failed writes and admin action.
     *
     * @return true if this call removed the connection
     */
    public boolean disconnect(String connectionId) {
        if (connectionId == null) {
            return false;
        }

        ConnectionEntry removed = registry.remove(connectionId);
        if (removed == null) {
            return false;
        }

        ClientTransport transport = removed.transport();
        try {
            if (transport.isOpen()) {
                transport.close(CLOSE_NORMAL, "Connection closed");
            }
        } catch (Exception e) {
            log.debug("WS close failed for {}: {}", connectionId, e.toString());
        }

        metrics.connectionClosed();
        ConnectionStatistics stats = removed.statistics();
        log.info("WS disconnected: {} (user={}, sent={}, received={}, errors={})",
            connectionId, removed.info().getUserId(),
            stats.getMessagesSent(), stats.getMessagesReceived(), stats.getErrors());
        return true;
    }

    // ═══════════════════════════════════════════════════════════════
    // DELIVERY
    // ═══════════════════════════════════════════════════════════════

    /**
     * Send one message to one connection.
     *
     * @return false if the id is unknown, the message was rate-limited, or the write failed
     */
    public boolean sendToConnection(String connectionId, OutboundMessage message) {
        if (connectionId == null || !registry.contains(connectionId)) {
            return false;
        }
        String json = encode(message);
        if (json == null) {
            ConnectionEntry entry = registry.get(connectionId);
            if (entry != null) {
                entry.statistics().recordError();
            }
            return false;
        }
        return sendEncoded(connectionId, json, message.type());
    }

    public int sendToUser(String userId, OutboundMessage message) {
        return sendAll(registry.snapshotUser(userId), message, null, null);
    }

    public int sendToSession(String sessionId, OutboundMessage message) {
        return sendAll(registry.snapshotSession(sessionId), message, null, null);
    }

    /**
     * Send to a session, skipping the given connections (typically the sender).
     */
    public int sendToSession(String sessionId, OutboundMessage message, Set<String> exclude) {
        return sendAll(registry.snapshotSession(sessionId), message, exclude, null);
    }

    public int sendToRoom(String room, OutboundMessage message) {
        return sendAll(registry.snapshotRoom(room), message, null, null);
    }

    public int broadcast(OutboundMessage message) {
        return broadcast(message, Set.of());
    }

    public int broadcast(OutboundMessage message, Set<String> exclude) {
        return sendAll(registry.snapshotIds(), message, exclude, null);
    }

    /**
     * Scope-directed fan-out.
     *
     * @param filter per-connection predicate (e.g. event-type subscriptions), null accepts all
     */
    public int deliver(EventTarget target, OutboundMessage message, Predicate<ConnectionInfo> filter) {
        EventTarget t = target == null ? EventTarget.broadcast() : target;
        List<String> ids = switch (t.scope()) {
            case BROADCAST -> registry.snapshotIds();
            case USER -> registry.snapshotUser(t.id());
            case SESSION -> registry.snapshotSession(t.id());
            case ROOM -> registry.snapshotRoom(t.id());
        };
        return sendAll(ids, message, null, filter);
    }

    private int sendAll(Collection<String> snapshot, OutboundMessage message,
                        Set<String> exclude, Predicate<ConnectionInfo> filter) {
        if (snapshot.isEmpty()) {
            return 0;
        }
        String json = encode(message);
        if (json == null) {
            return 0;
        }

        int sent = 0;
        for (String connectionId : snapshot) {
            if (exclude != null && exclude.contains(connectionId)) {
                continue;
            }
            if (filter != null) {
                ConnectionEntry entry = registry.get(connectionId);
                if (entry == null || !filter.test(entry.info())) {
                    continue;
                }
            }
            if (sendEncoded(connectionId, json, message.type())) {
                sent++;
            }
        }
        return sent;
    }

    private boolean sendEncoded(String connectionId, String json, MessageType type) {
        ConnectionEntry entry = registry.get(connectionId);
        if (entry == null) {
            return false;
        }

        if (!rateLimiter.tryAcquire(entry.rateWindow())) {
            log.warn("Rate limit exceeded for connection {} ({} msgs/window), dropping {}",
                connectionId, rateLimiter.getMaxMessages(), type.wireName());
            metrics.rateLimited();
            return false;
        }

        try {
            entry.transport().send(json);
        } catch (IOException e) {
            log.info("WS send failed, dropping connection {}: {}", connectionId, e.toString());
            metrics.sendFailed();
            disconnect(connectionId);
            return false;
        } catch (RuntimeException e) {
            log.error("WS send error for connection {}", connectionId, e);
            entry.statistics().recordError();
            return false;
        }

        int bytes = json.getBytes(StandardCharsets.UTF_8).length;
        entry.statistics().recordSent(bytes);
        entry.info().touch(clock.instant());
        metrics.messageSent(type, bytes);
        return true;
    }

    private String encode(OutboundMessage message) {
        try {
            return codec.encode(message);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize WS message type={}: {}", message.type().wireName(), e.toString());
            return null;
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // ROOMS & INBOUND
    // ═══════════════════════════════════════════════════════════════

    /**
     * Add a connection to a room. Idempotent.
     *
     * @return false if the connection is not registered
     */
    public boolean joinRoom(String connectionId, String room) {
        if (connectionId == null || room == null || room.isEmpty()) {
            return false;
        }
        boolean joined = registry.joinRoom(connectionId, room);
        if (joined) {
            log.debug("Connection {} joined room {}", connectionId, room);
        }
        return joined;
    }

    /**
     * Remove a connection from a room; the room is deleted when it empties. Idempotent.
     *
     * @return true if the connection was a member
     */
    public boolean leaveRoom(String connectionId, String room) {
        if (connectionId == null || room == null) {
            return false;
        }
        boolean left = registry.leaveRoom(connectionId, room);
        if (left) {
            log.debug("Connection {} left room {}", connectionId, room);
        }
        return left;
    }

    /**
     * Account for a frame received from the client.
     */
    public void recordInbound(String connectionId, int bytes) {
        ConnectionEntry entry = registry.get(connectionId);
        if (entry != null) {
            entry.statistics().recordReceived(bytes);
            entry.info().touchInbound(clock.instant());
        }
    }

    /**
     * Disconnect every connection that has not sent anything since {@code cutoff}.
     *
     * @return number of connections reaped
     */
    public int reapInactiveSince(Instant cutoff) {
        int reaped = 0;
        for (ConnectionEntry entry : registry.snapshot().entries()) {
            if (entry.info().getLastInboundAt().isBefore(cutoff) && disconnect(entry.id())) {
                log.info("Reaped idle connection {} (last inbound {})", entry.id(), entry.info().getLastInboundAt());
                reaped++;
            }
        }
        return reaped;
    }

    /**
     * Disconnect everything. Used on shutdown.
     */
    public int disconnectAll() {
        int closed = 0;
        for (String connectionId : registry.snapshotIds()) {
            if (disconnect(connectionId)) {
                closed++;
            }
        }
        return closed;
    }

    // ═══════════════════════════════════════════════════════════════
    // QUERIES
    // ═══════════════════════════════════════════════════════════════

    public boolean isConnected(String connectionId) {
        return connectionId != null && registry.contains(connectionId);
    }

    /**
     * @return metadata of a live connection, or null
     */
    public ConnectionInfo connection(String connectionId) {
        ConnectionEntry entry = connectionId == null ? null : registry.get(connectionId);
        return entry == null ? null : entry.info();
    }

    /**
     * @return counters of a live connection, or null
     */
    public ConnectionStatistics statistics(String connectionId) {
        ConnectionEntry entry = connectionId == null ? null : registry.get(connectionId);
        return entry == null ? null : entry.statistics();
    }

    /**
     * @return metadata and counters of a live connection, or null
     */
    public ConnectionDetails describe(String connectionId) {
        ConnectionEntry entry = connectionId == null ? null : registry.get(connectionId);
        return entry == null ? null : ConnectionDetails.of(entry.info(), entry.statistics());
    }

    public List<String> connectionIds() {
        return registry.snapshotIds();
    }

    public List<String> roomMembers(String room) {
        return registry.snapshotRoom(room);
    }

    public Set<String> rooms() {
        return registry.roomNames();
    }

    public int connectionCount() {
        return registry.snapshotIds().size();
    }

    /**
     * Aggregate counters. Holds the registry lock only for the snapshot copy.
     */
    public ConnectionStats getStats() {
        ConnectionRegistry.Snapshot snapshot = registry.snapshot();

        long sent = 0, received = 0, bytesSent = 0, bytesReceived = 0, errors = 0;
        for (ConnectionEntry entry : snapshot.entries()) {
            ConnectionStatistics s = entry.statistics();
            sent += s.getMessagesSent();
            received += s.getMessagesReceived();
            bytesSent += s.getBytesSent();
            bytesReceived += s.getBytesReceived();
            errors += s.getErrors();
        }

        return new ConnectionStats(snapshot.entries().size(), snapshot.users(), snapshot.sessions(),
            snapshot.rooms(), sent, received, bytesSent, bytesReceived, errors);
    }
}
