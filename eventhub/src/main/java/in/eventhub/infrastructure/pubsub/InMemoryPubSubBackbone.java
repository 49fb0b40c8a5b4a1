package in.eventhub.infrastructure.pubsub;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-process backbone. Several service instances sharing one of these behave like instances
 * sharing a Redis server; used for single-node deployments and tests.
 *
 * Each subscription buffers up to {@code capacity} messages; on overflow the oldest is dropped.
 */
public final class InMemoryPubSubBackbone implements PubSubBackbone {
    private static final Logger log = LoggerFactory.getLogger(InMemoryPubSubBackbone.class);

    public static final int DEFAULT_CAPACITY = 10_000;

    private final int capacity;
    private final Map<String, Set<QueueSubscription>> subscribers = new ConcurrentHashMap<>();
    private volatile boolean closed = false;

    public InMemoryPubSubBackbone() {
        this(DEFAULT_CAPACITY);
    }

    public InMemoryPubSubBackbone(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    @Override
    public long publish(String topic, String payload) {
        ensureOpen();
        Set<QueueSubscription> subs = subscribers.get(topic);
        if (subs == null) {
            return 0;
        }
        long delivered = 0;
        for (QueueSubscription sub : subs) {
            if (sub.offer(payload)) {
                delivered++;
            }
        }
        return delivered;
    }

    @Override
    public Subscription subscribe(String topic) {
        ensureOpen();
        QueueSubscription sub = new QueueSubscription(topic);
        subscribers.computeIfAbsent(topic, t -> new CopyOnWriteArraySet<>()).add(sub);
        log.debug("[PUBSUB] In-memory subscription opened: {}", topic);
        return sub;
    }

    @Override
    public void close() {
        closed = true;
        for (Set<QueueSubscription> subs : subscribers.values()) {
            for (QueueSubscription sub : subs) {
                sub.close();
            }
        }
        subscribers.clear();
    }

    public int subscriberCount(String topic) {
        Set<QueueSubscription> subs = subscribers.get(topic);
        return subs == null ? 0 : subs.size();
    }

    private void ensureOpen() {
        if (closed) {
            throw new PubSubException("In-memory backbone is closed");
        }
    }

    private final class QueueSubscription implements Subscription {
        private final String topic;
        private final BlockingQueue<String> queue = new LinkedBlockingQueue<>(capacity);
        private volatile boolean open = true;

        QueueSubscription(String topic) {
            this.topic = topic;
        }

        boolean offer(String payload) {
            if (!open) {
                return false;
            }
            while (!queue.offer(payload)) {
                String dropped = queue.poll();
                if (dropped != null) {
                    log.warn("[PUBSUB] Subscriber buffer full on {}, dropping oldest message", topic);
                }
            }
            return true;
        }

        @Override
        public String poll(Duration timeout) throws InterruptedException {
            if (!open) {
                throw new PubSubException("Subscription closed: " + topic);
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
            Set<QueueSubscription> subs = subscribers.get(topic);
            if (subs != null) {
                subs.remove(this);
            }
            queue.clear();
        }
    }
}
