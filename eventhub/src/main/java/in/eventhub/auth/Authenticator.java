package in.eventhub.auth;

/**
 * Validates a handshake token.
 */
@FunctionalInterface
public interface Authenticator {
    /**
     * @return the authenticated identity, or null if the token is invalid
     */
    AuthResult authenticate(String token);
}
