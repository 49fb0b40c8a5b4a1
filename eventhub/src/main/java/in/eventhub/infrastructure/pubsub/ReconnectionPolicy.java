package in.eventhub.infrastructure.pubsub;

import java.time.Duration;

/**
 * Exponential backoff for re-subscribing to the pub/sub backbone.
 *
 * The n-th consecutive failure waits {@code initialDelay * multiplier^n}, capped at
 * {@code maxDelay}. After {@code maxAttempts} failures the circuit opens: the caller cools down
 * for {@link #getMaxDelay()} and calls {@link #reset()}. A successful subscribe also resets.
 *
 * <pre>
 * if (policy.isCircuitOpen()) {
 *     sleep(policy.getMaxDelay());
 *     policy.reset();
 * } else {
 *     Duration delay = policy.getNextDelay();
 *     policy.recordFailure();
 *     sleep(delay);
 * }
 * </pre>
 */
public class ReconnectionPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int failures = 0;

    private ReconnectionPolicy(Duration initialDelay, Duration maxDelay,
                               double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay to wait before the next subscribe attempt.
     */
    public synchronized Duration getNextDelay() {
        double millis = initialDelay.toMillis() * Math.pow(multiplier, failures);
        return Duration.ofMillis((long) Math.min(millis, maxDelay.toMillis()));
    }

    public synchronized void recordFailure() {
        failures++;
    }

    /**
     * Back to the initial delay with the circuit closed.
     */
    public synchronized void reset() {
        failures = 0;
    }

    public synchronized boolean isCircuitOpen() {
        return failures >= maxAttempts;
    }

    /**
     * @return consecutive failures since the last reset
     */
    public synchronized int getAttemptCount() {
        return failures;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Defaults for a bus subscriber loop: 1s, doubling, capped at 30s, circuit after 10 failures.
     */
    public static ReconnectionPolicy forSubscriber() {
        return builder().build();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 2.0;
        private int maxAttempts = 10;

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = positive(initialDelay, "Initial delay");
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = positive(maxDelay, "Max delay");
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public ReconnectionPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
        }

        private static Duration positive(Duration value, String name) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
