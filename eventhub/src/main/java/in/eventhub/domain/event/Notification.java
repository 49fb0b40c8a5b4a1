package in.eventhub.domain.event;

import in.eventhub.domain.common.NotificationLevel;

import java.time.Instant;
import java.util.UUID;

/**
 * System notification shown to users.
 */
public record Notification(
    String id,
    NotificationLevel level,
    String title,
    String message,
    String actionUrl,
    Instant timestamp,
    EventTarget target
) {
    public Notification {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (level == null) {
            level = NotificationLevel.INFO;
        }
        if (title == null) {
            title = "";
        }
        if (message == null) {
            message = "";
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        if (target == null) {
            target = EventTarget.broadcast();
        }
    }
}
