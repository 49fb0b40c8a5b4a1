package in.eventhub.config;

import in.eventhub.util.Env;

import java.time.Duration;
import java.util.UUID;

/**
 * Runtime settings for the real-time core.
 *
 * <pre>
 * PORT                        HTTP / WebSocket listener port (9090)
 * PUBSUB_MODE                 redis | memory (redis)
 * REDIS_URI                   redis://localhost:6379
 * PUBSUB_CHANNEL_PREFIX       prefix of the three bus topics (eventhub:realtime)
 * RATE_LIMIT_PER_MINUTE       per-connection send budget (60)
 * HEARTBEAT_INTERVAL_SECONDS  ping interval (30)
 * IDLE_TIMEOUT_SECONDS        reap connections silent for this long, 0 disables (0)
 * JWT_SECRET                  HS256 secret for handshake tokens
 * INSTANCE_ID                 identity of this instance on the bus (random)
 * </pre>
 */
public record RealtimeConfig(
    int port,
    String pubsubMode,
    String redisUri,
    String channelPrefix,
    int rateLimitPerMinute,
    Duration heartbeatInterval,
    Duration idleTimeout,
    String jwtSecret,
    String instanceId
) {
    public static final int DEFAULT_RATE_LIMIT_PER_MINUTE = 60;
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(30);
    public static final String DEFAULT_CHANNEL_PREFIX = "eventhub:realtime";

    public RealtimeConfig {
        if (rateLimitPerMinute <= 0) {
            throw new IllegalArgumentException("rateLimitPerMinute must be positive");
        }
        if (heartbeatInterval == null || heartbeatInterval.isNegative() || heartbeatInterval.isZero()) {
            throw new IllegalArgumentException("heartbeatInterval must be positive");
        }
        if (idleTimeout == null || idleTimeout.isNegative()) {
            idleTimeout = Duration.ZERO;
        }
        if (channelPrefix == null || channelPrefix.isBlank()) {
            channelPrefix = DEFAULT_CHANNEL_PREFIX;
        }
        if (instanceId == null || instanceId.isBlank()) {
            instanceId = UUID.randomUUID().toString();
        }
    }

    public static RealtimeConfig fromEnv() {
        return new RealtimeConfig(
            Env.getInt("PORT", 9090),
            Env.get("PUBSUB_MODE", "redis"),
            Env.get("REDIS_URI", "redis://localhost:6379"),
            Env.get("PUBSUB_CHANNEL_PREFIX", DEFAULT_CHANNEL_PREFIX),
            Env.getInt("RATE_LIMIT_PER_MINUTE", DEFAULT_RATE_LIMIT_PER_MINUTE),
            Env.getSeconds("HEARTBEAT_INTERVAL_SECONDS", DEFAULT_HEARTBEAT_INTERVAL),
            Env.getSeconds("IDLE_TIMEOUT_SECONDS", Duration.ZERO),
            Env.get("JWT_SECRET", "eventhub-secret-key-change-in-production"),
            Env.get("INSTANCE_ID", null)
        );
    }

    /**
     * Defaults suitable for a single in-process instance.
     */
    public static RealtimeConfig defaults() {
        return new RealtimeConfig(9090, "memory", null, DEFAULT_CHANNEL_PREFIX,
            DEFAULT_RATE_LIMIT_PER_MINUTE, DEFAULT_HEARTBEAT_INTERVAL, Duration.ZERO,
            "eventhub-secret-key-change-in-production", null);
    }

    public boolean useRedis() {
        return "redis".equalsIgnoreCase(pubsubMode);
    }
}
