package in.eventhub.service.realtime;

import in.eventhub.domain.message.MessagePayload;
import in.eventhub.domain.message.OutboundMessage;
import in.eventhub.infrastructure.metrics.RealtimeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps client connections alive and detects dead ones.
 *
 * Every interval a PING is broadcast to all live connections; a connection whose write fails is
 * disconnected by the send path. With a positive idle timeout, connections that have not sent
 * anything for that long are reaped as well.
 *
 * <pre>
 * HeartbeatSupervisor heartbeat = new HeartbeatSupervisor(connections, Duration.ofSeconds(30),
 *     Duration.ZERO, metrics, Clock.systemUTC());
 * heartbeat.start();
 * ...
 * heartbeat.stop();
 * </pre>
 */
public class HeartbeatSupervisor {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatSupervisor.class);

    private final ConnectionManager connections;
    private final Duration interval;
    private final Duration idleTimeout;
    private final RealtimeMetrics metrics;
    private final Clock clock;

    private final AtomicLong beatCount = new AtomicLong();
    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> beatTask;
    private volatile Instant lastBeatAt;
    private volatile boolean running = false;

    public HeartbeatSupervisor(ConnectionManager connections, Duration interval, Duration idleTimeout,
                               RealtimeMetrics metrics, Clock clock) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Heartbeat interval must be positive");
        }
        this.connections = connections;
        this.interval = interval;
        this.idleTimeout = idleTimeout == null ? Duration.ZERO : idleTimeout;
        this.metrics = metrics;
        this.clock = clock;
    }

    public synchronized void start() {
        if (running) {
            log.warn("[HEARTBEAT] Supervisor already running");
            return;
        }

        log.info("[HEARTBEAT] Starting supervisor (interval: {}s, idle timeout: {}s)",
            interval.getSeconds(), idleTimeout.getSeconds());

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "heartbeat-supervisor");
            t.setDaemon(true);
            return t;
        });
        running = true;

        beatTask = scheduler.scheduleAtFixedRate(() -> {
            try {
                beatOnce();
            } catch (Exception e) {
                // an escaped exception would cancel the schedule
                log.error("[HEARTBEAT] Heartbeat round failed", e);
            }
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stop the schedule and wait for an in-flight round. Idempotent.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        log.info("[HEARTBEAT] Stopping supervisor after {} rounds", beatCount.get());
        running = false;

        if (beatTask != null) {
            beatTask.cancel(false);
            beatTask = null;
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
    }

    /**
     * One heartbeat round: broadcast PING, then reap idle connections if enabled.
     *
     * @return number of connections that received the ping
     */
    public int beatOnce() {
        Instant now = clock.instant();
        int delivered = connections.broadcast(OutboundMessage.of(new MessagePayload.Ping(now)));
        lastBeatAt = now;
        beatCount.incrementAndGet();
        metrics.heartbeat(delivered);
        log.debug("[HEARTBEAT] Ping delivered to {} connections", delivered);

        if (!idleTimeout.isZero()) {
            int reaped = connections.reapInactiveSince(now.minus(idleTimeout));
            if (reaped > 0) {
                log.info("[HEARTBEAT] Reaped {} idle connections (idle > {}s)", reaped, idleTimeout.getSeconds());
            }
        }
        return delivered;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * @return time of the latest round, or null before the first one
     */
    public Instant getLastBeatAt() {
        return lastBeatAt;
    }

    public long getBeatCount() {
        return beatCount.get();
    }

    public Duration getInterval() {
        return interval;
    }
}
