package in.eventhub.service.realtime;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.eventhub.domain.connection.ConnectionStats;

import java.time.Instant;
import java.util.Map;

/**
 * Health view of one instance, served by the admin API.
 */
public record ServiceStatus(
    @JsonProperty("running") boolean running,
    @JsonProperty("instance_id") String instanceId,
    @JsonProperty("uptime_seconds") long uptimeSeconds,
    @JsonProperty("heartbeat_running") boolean heartbeatRunning,
    @JsonProperty("last_heartbeat_at") Instant lastHeartbeatAt,
    @JsonProperty("subscribers") Map<String, Boolean> subscribers,
    @JsonProperty("event_listeners") int eventListeners,
    @JsonProperty("stats") ConnectionStats stats
) {
    public ServiceStatus {
        subscribers = subscribers == null ? Map.of() : Map.copyOf(subscribers);
    }
}
