package in.eventhub.service.realtime;

import in.eventhub.infrastructure.pubsub.PubSubBackbone;
import in.eventhub.infrastructure.pubsub.ReconnectionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Long-running consumer of one bus topic on its own daemon thread.
 *
 * Per-message failures are logged and skipped. Subscribe failures and lost subscriptions are
 * retried with exponential backoff; when the policy's circuit opens the loop cools down for the
 * policy's max delay and starts over. Only {@link #stop()} ends the loop.
 */
public final class SubscriberLoop {
    private static final Logger log = LoggerFactory.getLogger(SubscriberLoop.class);

    private static final long JOIN_TIMEOUT_MS = 5_000;

    private final String name;
    private final String topic;
    private final PubSubBackbone backbone;
    private final Consumer<String> handler;
    private final ReconnectionPolicy policy;
    private final Duration pollTimeout;

    private final AtomicLong handled = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private volatile boolean running = false;
    private volatile boolean subscribed = false;
    private volatile PubSubBackbone.Subscription current;
    private Thread thread;

    public SubscriberLoop(String name, String topic, PubSubBackbone backbone, Consumer<String> handler,
                          ReconnectionPolicy policy, Duration pollTimeout) {
        this.name = name;
        this.topic = topic;
        this.backbone = backbone;
        this.handler = handler;
        this.policy = policy;
        this.pollTimeout = pollTimeout;
    }

    public synchronized void start() {
        if (running) {
            log.warn("[BUS:{}] Subscriber loop already running", name);
            return;
        }
        running = true;
        thread = new Thread(this::run, "bus-" + name);
        thread.setDaemon(true);
        thread.start();
        log.info("[BUS:{}] Subscriber loop started on {}", name, topic);
    }

    /**
     * Stop the loop and wait for its thread to finish. Idempotent.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;

        PubSubBackbone.Subscription sub = current;
        if (sub != null) {
            sub.close();
        }

        Thread t = thread;
        thread = null;
        if (t != null) {
            t.interrupt();
            try {
                t.join(JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (t.isAlive()) {
                log.warn("[BUS:{}] Subscriber thread did not stop within {}ms", name, JOIN_TIMEOUT_MS);
            }
        }
        log.info("[BUS:{}] Subscriber loop stopped (handled={}, failed={})", name, handled.get(), failed.get());
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isSubscribed() {
        return subscribed;
    }

    public String getName() {
        return name;
    }

    public long getHandledCount() {
        return handled.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    private void run() {
        while (running) {
            PubSubBackbone.Subscription sub;
            try {
                sub = backbone.subscribe(topic);
            } catch (RuntimeException e) {
                log.warn("[BUS:{}] Subscribe to {} failed: {}", name, topic, e.getMessage());
                if (!backoff()) {
                    break;
                }
                continue;
            }

            current = sub;
            subscribed = true;
            policy.reset();
            log.info("[BUS:{}] Subscribed to {}", name, topic);

            try {
                consume(sub);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                if (running) {
                    log.warn("[BUS:{}] Subscription to {} lost: {}", name, topic, e.getMessage());
                }
            } finally {
                subscribed = false;
                current = null;
                sub.close();
            }

            if (running && !backoff()) {
                break;
            }
        }
        subscribed = false;
    }

    private void consume(PubSubBackbone.Subscription sub) throws InterruptedException {
        while (running) {
            String payload = sub.poll(pollTimeout);
            if (payload == null) {
                continue;
            }
            try {
                handler.accept(payload);
                handled.incrementAndGet();
            } catch (Exception e) {
                failed.incrementAndGet();
                log.error("[BUS:{}] Failed to handle message from {}: {}", name, topic, e.toString());
            }
        }
    }

    /**
     * Sleep before the next subscribe attempt.
     *
     * @return false if interrupted or stopped while waiting
     */
    private boolean backoff() {
        Duration delay;
        if (policy.isCircuitOpen()) {
            delay = policy.getMaxDelay();
            log.error("[BUS:{}] Circuit open after {} failures, cooling down for {}ms",
                name, policy.getAttemptCount(), delay.toMillis());
            policy.reset();
        } else {
            delay = policy.getNextDelay();
            policy.recordFailure();
            log.info("[BUS:{}] Retrying subscribe in {}ms (attempt {})", name, delay.toMillis(), policy.getAttemptCount());
        }

        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return running;
    }
}
