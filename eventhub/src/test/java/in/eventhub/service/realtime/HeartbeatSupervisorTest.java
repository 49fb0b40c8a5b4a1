package in.eventhub.service.realtime;

import in.eventhub.domain.message.MessageCodec;
import in.eventhub.infrastructure.metrics.RealtimeMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for HeartbeatSupervisor.
 *
 * Tests:
 * - Ping broadcast to every connection
 * - Dead connections removed on failed ping
 * - Idle reaping based on inbound activity
 * - Lifecycle management
 */
class HeartbeatSupervisorTest {

    private MutableClock clock;
    private RealtimeMetrics metrics;
    private ConnectionManager connections;
    private HeartbeatSupervisor heartbeat;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        metrics = mock(RealtimeMetrics.class);
        connections = new ConnectionManager(new RateLimiter(1000, clock), new MessageCodec(), metrics, clock);
    }

    @AfterEach
    void tearDown() {
        if (heartbeat != null) {
            heartbeat.stop();
        }
    }

    private RecordingTransport connect(String id) {
        RecordingTransport transport = new RecordingTransport();
        assertTrue(connections.connect(transport, id, "user-" + id, null));
        return transport;
    }

    @Test
    void testInitialState() {
        heartbeat = new HeartbeatSupervisor(connections, Duration.ofSeconds(30), Duration.ZERO, metrics, clock);

        assertFalse(heartbeat.isRunning());
        assertNull(heartbeat.getLastBeatAt(), "No round before start");
        assertEquals(0, heartbeat.getBeatCount());
        assertEquals(Duration.ofSeconds(30), heartbeat.getInterval());
    }

    @Test
    void testRejectsNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class,
            () -> new HeartbeatSupervisor(connections, Duration.ZERO, Duration.ZERO, metrics, clock));
    }

    @Test
    void testBeatPingsEveryConnection() {
        RecordingTransport first = connect("c1");
        RecordingTransport second = connect("c2");
        heartbeat = new HeartbeatSupervisor(connections, Duration.ofSeconds(30), Duration.ZERO, metrics, clock);

        assertEquals(2, heartbeat.beatOnce());

        assertEquals("ping", first.last().path("type").asText());
        assertEquals("ping", second.last().path("type").asText());
        assertEquals(clock.instant(), heartbeat.getLastBeatAt());
        assertEquals(1, heartbeat.getBeatCount());
        verify(metrics).heartbeat(2);
    }

    @Test
    void testFailedPingDisconnects() {
        RecordingTransport healthy = connect("c1");
        RecordingTransport dead = connect("c2").failSends();
        heartbeat = new HeartbeatSupervisor(connections, Duration.ofSeconds(30), Duration.ZERO, metrics, clock);

        assertEquals(1, heartbeat.beatOnce());

        assertTrue(connections.isConnected("c1"));
        assertFalse(connections.isConnected("c2"), "Write failure removes the connection");
        assertEquals(1, healthy.sentCount());
        assertEquals(0, dead.sentCount());
    }

    @Test
    void testIdleConnectionsReaped() {
        connect("quiet");
        connect("chatty");
        heartbeat = new HeartbeatSupervisor(connections, Duration.ofSeconds(30), Duration.ofMinutes(2), metrics, clock);

        clock.advance(Duration.ofMinutes(1));
        connections.recordInbound("chatty", 16);
        clock.advance(Duration.ofSeconds(90));

        heartbeat.beatOnce();

        assertFalse(connections.isConnected("quiet"), "No inbound frame for 150s");
        assertTrue(connections.isConnected("chatty"), "Inbound frame 90s ago");
    }

    @Test
    void testNoReapingWhenIdleTimeoutDisabled() {
        connect("quiet");
        heartbeat = new HeartbeatSupervisor(connections, Duration.ofSeconds(30), Duration.ZERO, metrics, clock);

        clock.advance(Duration.ofHours(6));
        heartbeat.beatOnce();

        assertTrue(connections.isConnected("quiet"));
    }

    @Test
    void testScheduledRounds() {
        RecordingTransport transport = connect("c1");
        heartbeat = new HeartbeatSupervisor(connections, Duration.ofMillis(50), Duration.ZERO, metrics, clock);

        heartbeat.start();
        assertTrue(heartbeat.isRunning());

        verify(metrics, timeout(2_000).atLeast(3)).heartbeat(1);
        assertTrue(transport.sentCount() >= 3, "Should ping at least 3 times");
    }

    @Test
    void testStartStopIdempotent() {
        heartbeat = new HeartbeatSupervisor(connections, Duration.ofMillis(50), Duration.ZERO, metrics, clock);

        heartbeat.stop();
        assertFalse(heartbeat.isRunning(), "Stop before start is a no-op");

        heartbeat.start();
        heartbeat.start();
        assertTrue(heartbeat.isRunning());

        heartbeat.stop();
        heartbeat.stop();
        assertFalse(heartbeat.isRunning());
    }

    @Test
    void testNoPingsAfterStop() throws InterruptedException {
        RecordingTransport transport = connect("c1");
        heartbeat = new HeartbeatSupervisor(connections, Duration.ofMillis(50), Duration.ZERO, metrics, clock);

        heartbeat.start();
        verify(metrics, timeout(2_000).atLeastOnce()).heartbeat(1);
        heartbeat.stop();

        int sent = transport.sentCount();
        Thread.sleep(200);
        assertEquals(sent, transport.sentCount(), "No pings after stop");
    }
}
