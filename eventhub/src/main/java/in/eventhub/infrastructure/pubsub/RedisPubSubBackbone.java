package in.eventhub.infrastructure.pubsub;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.pubsub.RedisPubSubAdapter;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Redis pub/sub over Lettuce.
 *
 * Publishing shares one lazily opened connection; each subscription gets its own pub/sub
 * connection whose listener feeds a local queue drained by {@link Subscription#poll}.
 */
public final class RedisPubSubBackbone implements PubSubBackbone {
    private static final Logger log = LoggerFactory.getLogger(RedisPubSubBackbone.class);

    private static final int SUBSCRIPTION_BUFFER = 10_000;

    private final RedisClient client;
    private StatefulRedisConnection<String, String> publishConnection;  // guarded by this

    public RedisPubSubBackbone(String redisUri) {
        this(RedisClient.create(redisUri));
    }

    public RedisPubSubBackbone(RedisClient client) {
        this.client = client;
    }

    @Override
    public long publish(String topic, String payload) {
        try {
            Long receivers = publishConnection().sync().publish(topic, payload);
            return receivers == null ? 0 : receivers;
        } catch (RedisException e) {
            throw new PubSubException("Redis publish failed on " + topic + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Subscription subscribe(String topic) {
        StatefulRedisPubSubConnection<String, String> connection;
        try {
            connection = client.connectPubSub();
        } catch (RedisException e) {
            throw new PubSubException("Redis subscribe connection failed for " + topic + ": " + e.getMessage(), e);
        }

        RedisSubscription subscription = new RedisSubscription(topic, connection);
        connection.addListener(subscription.listener);
        try {
            connection.sync().subscribe(topic);
        } catch (RedisException e) {
            subscription.close();
            throw new PubSubException("Redis SUBSCRIBE failed for " + topic + ": " + e.getMessage(), e);
        }
        log.info("[PUBSUB] Subscribed to Redis channel {}", topic);
        return subscription;
    }

    @Override
    public synchronized void close() {
        if (publishConnection != null) {
            try {
                publishConnection.close();
            } catch (RedisException e) {
                log.debug("[PUBSUB] Error closing publish connection: {}", e.toString());
            }
            publishConnection = null;
        }
        client.shutdown();
    }

    private synchronized StatefulRedisConnection<String, String> publishConnection() {
        if (publishConnection == null || !publishConnection.isOpen()) {
            publishConnection = client.connect();
        }
        return publishConnection;
    }

    private static final class RedisSubscription implements Subscription {
        private final String topic;
        private final StatefulRedisPubSubConnection<String, String> connection;
        private final BlockingQueue<String> queue = new LinkedBlockingQueue<>(SUBSCRIPTION_BUFFER);
        private volatile boolean open = true;

        private final RedisPubSubAdapter<String, String> listener = new RedisPubSubAdapter<>() {
            @Override
            public void message(String channel, String message) {
                if (!queue.offer(message)) {
                    log.warn("[PUBSUB] Subscriber buffer full on {}, dropping message", channel);
                }
            }
        };

        RedisSubscription(String topic, StatefulRedisPubSubConnection<String, String> connection) {
            this.topic = topic;
            this.connection = connection;
        }

        @Override
        public String poll(Duration timeout) throws InterruptedException {
            if (!open || !connection.isOpen()) {
                throw new PubSubException("Redis subscription lost: " + topic);
            }
            return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public String topic() {
            return topic;
        }

        @Override
        public void close() {
            if (!open) {
                return;
            }
            open = false;
            connection.removeListener(listener);
            try {
                connection.close();
            } catch (RedisException e) {
                log.debug("[PUBSUB] Error closing subscription {}: {}", topic, e.toString());
            }
        }
    }
}
