package in.eventhub.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * HS256 JWT validation for WebSocket handshakes.
 *
 * Claims read: {@code sub} (user id), {@code session_id}, {@code permissions} (array), {@code exp}.
 * Token issuance lives in the auth service; {@link #generateToken} exists for local tooling and tests.
 */
public final class JwtService implements Authenticator {
    private static final Logger log = LoggerFactory.getLogger(JwtService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final byte[] secret;
    private final Clock clock;

    public JwtService(String secret) {
        this(secret, Clock.systemUTC());
    }

    public JwtService(String secret, Clock clock) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("JWT secret must not be empty");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.clock = clock;
    }

    /**
     * Generate a token carrying the claims this service validates.
     */
    public String generateToken(String userId, String sessionId, List<String> permissions, Duration ttl) {
        long now = clock.millis() / 1000;

        ObjectNode header = MAPPER.createObjectNode();
        header.put("alg", "HS256");
        header.put("typ", "JWT");

        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("sub", userId);
        if (sessionId != null) {
            payload.put("session_id", sessionId);
        }
        ArrayNode perms = payload.putArray("permissions");
        if (permissions != null) {
            permissions.forEach(perms::add);
        }
        payload.put("iat", now);
        payload.put("exp", now + ttl.getSeconds());

        String signingInput = base64Encode(header.toString()) + "." + base64Encode(payload.toString());
        return signingInput + "." + sign(signingInput);
    }

    /**
     * Validate token and extract the handshake identity.
     * Returns null if invalid.
     */
    @Override
    public AuthResult authenticate(String token) {
        if (token == null || token.isEmpty()) {
            return null;
        }

        if (token.startsWith("Bearer ")) {
            token = token.substring(7);
        }

        try {
            String[] parts = token.split("\\.");
            if (parts.length != 3) {
                log.debug("Invalid token format");
                return null;
            }

            String expectedSig = sign(parts[0] + "." + parts[1]);
            if (!MessageDigest.isEqual(expectedSig.getBytes(StandardCharsets.UTF_8),
                                       parts[2].getBytes(StandardCharsets.UTF_8))) {
                log.debug("Invalid token signature");
                return null;
            }

            JsonNode claims = MAPPER.readTree(base64Decode(parts[1]));
            String sub = claims.path("sub").asText(null);
            if (sub == null || sub.isEmpty() || !claims.hasNonNull("exp")) {
                log.debug("Missing required claims");
                return null;
            }

            if (clock.millis() / 1000 > claims.get("exp").asLong()) {
                log.debug("Token expired");
                return null;
            }

            List<String> permissions = new ArrayList<>();
            for (JsonNode p : claims.path("permissions")) {
                permissions.add(p.asText());
            }

            return new AuthResult(sub, permissions, claims.path("session_id").asText(null));

        } catch (Exception e) {
            log.debug("Token validation error: {}", e.getMessage());
            return null;
        }
    }

    private String sign(String data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret, "HmacSHA256"));
            byte[] hash = mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to sign JWT", e);
        }
    }

    private static String base64Encode(String data) {
        return Base64.getUrlEncoder().withoutPadding()
            .encodeToString(data.getBytes(StandardCharsets.UTF_8));
    }

    private static String base64Decode(String data) {
        return new String(Base64.getUrlDecoder().decode(data), StandardCharsets.UTF_8);
    }
}
