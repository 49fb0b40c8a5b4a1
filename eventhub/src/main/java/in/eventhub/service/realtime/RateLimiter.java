package in.eventhub.service.realtime;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;

/**
 * Sliding-window admission control for outbound messages.
 *
 * Each connection owns a {@link Window} of recent send timestamps. On every attempt the
 * timestamps older than the window are evicted; the send is admitted if fewer than
 * {@code maxMessages} remain, and only an admitted send is recorded.
 * Rejected messages are dropped by the caller, never queued.
 */
public final class RateLimiter {
    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

    private final int maxMessages;
    private final long windowMillis;
    private final Clock clock;

    public RateLimiter(int maxMessagesPerMinute, Clock clock) {
        this(maxMessagesPerMinute, DEFAULT_WINDOW, clock);
    }

    public RateLimiter(int maxMessages, Duration window, Clock clock) {
        if (maxMessages <= 0) {
            throw new IllegalArgumentException("maxMessages must be positive");
        }
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.maxMessages = maxMessages;
        this.windowMillis = window.toMillis();
        this.clock = clock;
    }

    public Window newWindow() {
        return new Window();
    }

    /**
     * Try to admit one message against the connection's window.
     *
     * @return true if admitted (and recorded), false if the budget is exhausted
     */
    public boolean tryAcquire(Window window) {
        long now = clock.millis();
        synchronized (window) {
            window.evictOlderThan(now - windowMillis);
            if (window.timestamps.size() >= maxMessages) {
                return false;
            }
            window.timestamps.addLast(now);
            return true;
        }
    }

    public int getMaxMessages() {
        return maxMessages;
    }

    /**
     * Recent send timestamps of one connection. Guarded by its own monitor.
     */
    public static final class Window {
        private final ArrayDeque<Long> timestamps = new ArrayDeque<>();

        private Window() {
        }

        private void evictOlderThan(long cutoff) {
            while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
                timestamps.pollFirst();
            }
        }

        public synchronized int size() {
            return timestamps.size();
        }
    }
}
