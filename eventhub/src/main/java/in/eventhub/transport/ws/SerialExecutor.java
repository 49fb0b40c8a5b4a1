package in.eventhub.transport.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs tasks one at a time, in submission order, on a shared executor.
 * Gives each connection ordered inbound handling without a thread of its own.
 */
final class SerialExecutor implements Executor {
    private static final Logger log = LoggerFactory.getLogger(SerialExecutor.class);

    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private final Executor executor;
    private Runnable active;

    SerialExecutor(Executor executor) {
        this.executor = executor;
    }

    @Override
    public synchronized void execute(Runnable r) {
        tasks.add(() -> {
            try {
                r.run();
            } catch (RuntimeException e) {
                log.error("WS task failed", e);
            } finally {
                scheduleNext();
            }
        });
        if (active == null) {
            scheduleNext();
        }
    }

    private synchronized void scheduleNext() {
        if ((active = tasks.poll()) != null) {
            try {
                executor.execute(active);
            } catch (RejectedExecutionException e) {
                // worker is shutting down; nothing queued here can run any more
                log.warn("WS task rejected, dropping {} queued tasks: {}", tasks.size() + 1, e.toString());
                tasks.clear();
                active = null;
            }
        }
    }
}
