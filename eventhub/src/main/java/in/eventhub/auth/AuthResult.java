package in.eventhub.auth;

import java.util.List;

/**
 * Identity established once at WebSocket handshake.
 * The real-time core trusts it for the lifetime of the connection.
 */
public record AuthResult(String userId, List<String> permissions, String sessionId) {
    public AuthResult {
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }

    public boolean hasPermission(String permission) {
        return permissions.contains(permission);
    }
}
