package in.eventhub.domain.connection;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metadata of one live connection.
 */
public final class ConnectionInfo {
    private final String connectionId;
    private final String userId;
    private final String sessionId;
    private final String remoteAddress;
    private final String userAgent;
    private final Instant connectedAt;
    private final Set<String> rooms;          // mirror of room index membership
    private final Set<String> eventTypes;     // subscribed event types, empty = all
    private volatile Instant lastActivity;    // volatile: written by I/O workers and fan-out threads
    private volatile Instant lastInboundAt;

    public ConnectionInfo(String connectionId, String userId, String sessionId,
                          String remoteAddress, String userAgent, Instant connectedAt) {
        this.connectionId = connectionId;
        this.userId = userId;
        this.sessionId = sessionId;
        this.remoteAddress = remoteAddress;
        this.userAgent = userAgent;
        this.connectedAt = connectedAt;
        this.rooms = ConcurrentHashMap.newKeySet();
        this.eventTypes = ConcurrentHashMap.newKeySet();
        this.lastActivity = connectedAt;
        this.lastInboundAt = connectedAt;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public String getUserId() {
        return userId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getRemoteAddress() {
        return remoteAddress;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public Instant getLastInboundAt() {
        return lastInboundAt;
    }

    public Set<String> getRooms() {
        return Collections.unmodifiableSet(rooms);
    }

    public Set<String> getEventTypes() {
        return Collections.unmodifiableSet(eventTypes);
    }

    public void touch(Instant now) {
        this.lastActivity = now;
    }

    public void touchInbound(Instant now) {
        this.lastActivity = now;
        this.lastInboundAt = now;
    }

    public void addRoom(String room) {
        rooms.add(room);
    }

    public void removeRoom(String room) {
        rooms.remove(room);
    }

    public void subscribeEventTypes(Set<String> types) {
        eventTypes.addAll(types);
    }

    public void unsubscribeEventTypes(Set<String> types) {
        eventTypes.removeAll(types);
    }

    /**
     * Check if this connection wants events of the given type.
     */
    public boolean acceptsEventType(String eventType) {
        return eventTypes.isEmpty() || eventTypes.contains(eventType);
    }
}
