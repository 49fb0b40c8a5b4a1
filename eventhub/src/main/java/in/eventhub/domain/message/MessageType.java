package in.eventhub.domain.message;

import java.util.Locale;

/**
 * Discriminator of outbound WebSocket messages.
 * The wire name is the lower-case enum name.
 */
public enum MessageType {
    CONNECT,
    EVENT,
    PROGRESS_UPDATE,
    SYSTEM_NOTIFICATION,
    PING,
    PONG,
    ACK,
    ERROR,
    COLLABORATION_JOIN,
    COLLABORATION_LEAVE,
    COLLABORATION_UPDATE,
    COLLABORATION_CURSOR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isCollaboration() {
        return this == COLLABORATION_JOIN || this == COLLABORATION_LEAVE
            || this == COLLABORATION_UPDATE || this == COLLABORATION_CURSOR;
    }
}
