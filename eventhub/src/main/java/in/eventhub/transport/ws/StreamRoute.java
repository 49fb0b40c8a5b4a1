package in.eventhub.transport.ws;

import in.eventhub.domain.event.ProgressUpdate;

import java.util.List;
import java.util.Map;

/**
 * Resolved endpoint of one connection: the stream kind plus its path key
 * (operation id or session id).
 */
public record StreamRoute(StreamKind kind, String key) {

    public static final String NOTIFICATIONS_ROOM = "notifications";

    public StreamRoute {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (kind.pathParam() != null && (key == null || key.isBlank())) {
            throw new IllegalArgumentException(kind + " stream requires " + kind.pathParam());
        }
    }

    public static StreamRoute events() {
        return new StreamRoute(StreamKind.EVENTS, null);
    }

    /**
     * Build from handshake request parameters (query string plus routed path parameters).
     *
     * @throws IllegalArgumentException if the path parameter is missing
     */
    public static StreamRoute fromParameters(StreamKind kind, Map<String, ? extends List<String>> params) {
        String key = kind.pathParam() == null ? null : first(params, kind.pathParam());
        return new StreamRoute(kind, key);
    }

    /**
     * Room the connection joins on open, or null.
     */
    public String room() {
        return switch (kind) {
            case EVENTS -> null;
            case PROGRESS -> ProgressUpdate.roomFor(key);
            case NOTIFICATIONS -> NOTIFICATIONS_ROOM;
            case SESSION -> "session:" + key;
        };
    }

    public boolean isSession() {
        return kind == StreamKind.SESSION;
    }

    static String first(Map<String, ? extends List<String>> params, String name) {
        if (params == null) {
            return null;
        }
        List<String> values = params.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
