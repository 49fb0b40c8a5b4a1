package in.eventhub.domain.event;

import in.eventhub.domain.common.EventScope;

import java.util.Locale;

/**
 * Addressing of an event: broadcast, or one user / session / room.
 */
public record EventTarget(EventScope scope, String id) {

    private static final EventTarget BROADCAST = new EventTarget(EventScope.BROADCAST, null);

    public EventTarget {
        if (scope == null) {
            scope = EventScope.BROADCAST;
        }
        if (scope == EventScope.BROADCAST) {
            id = null;
        } else if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(scope + " target requires an id");
        }
    }

    public static EventTarget broadcast() {
        return BROADCAST;
    }

    public static EventTarget user(String userId) {
        return new EventTarget(EventScope.USER, userId);
    }

    public static EventTarget session(String sessionId) {
        return new EventTarget(EventScope.SESSION, sessionId);
    }

    public static EventTarget room(String room) {
        return new EventTarget(EventScope.ROOM, room);
    }

    /**
     * Parse a wire scope name ("user", "room", ...). Missing scope means broadcast.
     *
     * @throws IllegalArgumentException for an unknown scope or a missing id
     */
    public static EventTarget of(String scope, String id) {
        if (scope == null || scope.isBlank()) {
            return BROADCAST;
        }
        return new EventTarget(EventScope.valueOf(scope.trim().toUpperCase(Locale.ROOT)), id);
    }

    public boolean isBroadcast() {
        return scope == EventScope.BROADCAST;
    }
}
