package in.eventhub.domain.connection;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate view over all live connections of this instance.
 */
public record ConnectionStats(
    @JsonProperty("total_connections") int totalConnections,
    @JsonProperty("total_users") int totalUsers,
    @JsonProperty("total_sessions") int totalSessions,
    @JsonProperty("total_rooms") int totalRooms,
    @JsonProperty("total_messages_sent") long totalMessagesSent,
    @JsonProperty("total_messages_received") long totalMessagesReceived,
    @JsonProperty("total_bytes_sent") long totalBytesSent,
    @JsonProperty("total_bytes_received") long totalBytesReceived,
    @JsonProperty("total_errors") long totalErrors
) {
}
