package in.eventhub.service.realtime;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RateLimiter.
 */
class RateLimiterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));

    @Test
    void testAdmitsUpToLimit() {
        RateLimiter limiter = new RateLimiter(3, clock);
        RateLimiter.Window window = limiter.newWindow();

        assertTrue(limiter.tryAcquire(window));
        assertTrue(limiter.tryAcquire(window));
        assertTrue(limiter.tryAcquire(window));
        assertFalse(limiter.tryAcquire(window), "Fourth message within the window is rejected");
        assertEquals(3, window.size(), "Rejected attempts are not recorded");
    }

    @Test
    void testWindowSlides() {
        RateLimiter limiter = new RateLimiter(2, clock);
        RateLimiter.Window window = limiter.newWindow();

        limiter.tryAcquire(window);
        clock.advance(Duration.ofSeconds(30));
        limiter.tryAcquire(window);
        assertFalse(limiter.tryAcquire(window));

        clock.advance(Duration.ofSeconds(30));
        assertTrue(limiter.tryAcquire(window), "First timestamp is 60s old and evicted");
        assertFalse(limiter.tryAcquire(window));
    }

    @Test
    void testWindowsAreIndependent() {
        RateLimiter limiter = new RateLimiter(1, clock);
        RateLimiter.Window a = limiter.newWindow();
        RateLimiter.Window b = limiter.newWindow();

        assertTrue(limiter.tryAcquire(a));
        assertFalse(limiter.tryAcquire(a));
        assertTrue(limiter.tryAcquire(b), "One connection's budget does not affect another");
    }

    @Test
    void testCustomWindow() {
        RateLimiter limiter = new RateLimiter(1, Duration.ofSeconds(5), clock);
        RateLimiter.Window window = limiter.newWindow();

        assertTrue(limiter.tryAcquire(window));
        clock.advance(Duration.ofSeconds(4));
        assertFalse(limiter.tryAcquire(window));
        clock.advance(Duration.ofSeconds(1));
        assertTrue(limiter.tryAcquire(window));
    }

    @Test
    void testInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(0, clock));
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(10, Duration.ZERO, clock));
    }
}
