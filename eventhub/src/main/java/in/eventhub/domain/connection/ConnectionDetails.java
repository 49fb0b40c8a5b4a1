package in.eventhub.domain.connection;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Set;

/**
 * Point-in-time view of one live connection: metadata plus traffic counters.
 */
public record ConnectionDetails(
    @JsonProperty("connection_id") String connectionId,
    @JsonProperty("user_id") String userId,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("remote_address") String remoteAddress,
    @JsonProperty("user_agent") String userAgent,
    @JsonProperty("connected_at") Instant connectedAt,
    @JsonProperty("last_activity") Instant lastActivity,
    @JsonProperty("last_inbound_at") Instant lastInboundAt,
    @JsonProperty("rooms") Set<String> rooms,
    @JsonProperty("event_types") Set<String> eventTypes,
    @JsonProperty("messages_sent") long messagesSent,
    @JsonProperty("messages_received") long messagesReceived,
    @JsonProperty("bytes_sent") long bytesSent,
    @JsonProperty("bytes_received") long bytesReceived,
    @JsonProperty("errors") long errors
) {
    public ConnectionDetails {
        rooms = rooms == null ? Set.of() : Set.copyOf(rooms);
        eventTypes = eventTypes == null ? Set.of() : Set.copyOf(eventTypes);
    }

    public static ConnectionDetails of(ConnectionInfo info, ConnectionStatistics stats) {
        return new ConnectionDetails(info.getConnectionId(), info.getUserId(), info.getSessionId(),
            info.getRemoteAddress(), info.getUserAgent(), info.getConnectedAt(),
            info.getLastActivity(), info.getLastInboundAt(), info.getRooms(), info.getEventTypes(),
            stats.getMessagesSent(), stats.getMessagesReceived(),
            stats.getBytesSent(), stats.getBytesReceived(), stats.getErrors());
    }
}
