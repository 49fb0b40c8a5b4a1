package in.eventhub.infrastructure.pubsub;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ReconnectionPolicy.
 *
 * Tests:
 * - Exponential backoff calculations
 * - Circuit breaker behavior
 * - Reset functionality
 * - Builder validation
 */
class ReconnectionPolicyTest {

    @Test
    void testInitialState() {
        ReconnectionPolicy policy = ReconnectionPolicy.forSubscriber();

        assertEquals(0, policy.getAttemptCount(), "Initial attempt count should be 0");
        assertFalse(policy.isCircuitOpen(), "Circuit should be closed initially");
        assertEquals(Duration.ofSeconds(1), policy.getNextDelay());
        assertEquals(Duration.ofSeconds(30), policy.getMaxDelay());
    }

    @Test
    void testExponentialBackoffCapped() {
        ReconnectionPolicy policy = ReconnectionPolicy.forSubscriber();

        assertEquals(Duration.ofSeconds(1), policy.getNextDelay());
        policy.recordFailure();
        assertEquals(Duration.ofSeconds(2), policy.getNextDelay());
        policy.recordFailure();
        assertEquals(Duration.ofSeconds(4), policy.getNextDelay());
        policy.recordFailure();
        policy.recordFailure();
        assertEquals(Duration.ofSeconds(16), policy.getNextDelay());
        policy.recordFailure();

        // 32s would exceed the cap
        assertEquals(Duration.ofSeconds(30), policy.getNextDelay(), "Delay capped at max");
        assertEquals(5, policy.getAttemptCount());
    }

    @Test
    void testCircuitOpensAfterMaxAttempts() {
        ReconnectionPolicy policy = ReconnectionPolicy.builder()
            .initialDelay(Duration.ofMillis(100))
            .maxDelay(Duration.ofSeconds(1))
            .maxAttempts(3)
            .build();

        policy.recordFailure();
        policy.recordFailure();
        assertFalse(policy.isCircuitOpen());
        assertEquals(Duration.ofMillis(400), policy.getNextDelay());

        policy.recordFailure();
        assertTrue(policy.isCircuitOpen(), "Circuit opens after 3 failures");
        assertEquals(Duration.ofSeconds(1), policy.getMaxDelay(), "Cooldown is the max delay");
    }

    @Test
    void testResetClosesCircuit() {
        ReconnectionPolicy policy = ReconnectionPolicy.builder()
            .initialDelay(Duration.ofMillis(100))
            .maxDelay(Duration.ofSeconds(1))
            .maxAttempts(2)
            .build();

        policy.recordFailure();
        policy.recordFailure();
        assertTrue(policy.isCircuitOpen());

        policy.reset();

        assertFalse(policy.isCircuitOpen());
        assertEquals(0, policy.getAttemptCount());
        assertEquals(Duration.ofMillis(100), policy.getNextDelay());
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder().initialDelay(Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder().maxDelay(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder().multiplier(1.0));
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder().maxAttempts(0));
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder()
                .initialDelay(Duration.ofMinutes(2))
                .maxDelay(Duration.ofMinutes(1))
                .build(),
            "Initial delay cannot exceed max delay");
    }
}
