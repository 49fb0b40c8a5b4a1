package in.eventhub.transport.ws;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SerialExecutorTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void testTasksRunInOrderOneAtATime() throws InterruptedException {
        SerialExecutor serial = new SerialExecutor(pool);
        List<Integer> order = new CopyOnWriteArrayList<>();
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(50);

        for (int i = 0; i < 50; i++) {
            int n = i;
            serial.execute(() -> {
                maxConcurrent.accumulateAndGet(concurrent.incrementAndGet(), Math::max);
                order.add(n);
                concurrent.decrementAndGet();
                done.countDown();
            });
        }

        assertTrue(done.await(5, TimeUnit.SECONDS), "All tasks should run");
        assertEquals(1, maxConcurrent.get(), "Never more than one task at a time");
        for (int i = 0; i < 50; i++) {
            assertEquals(i, order.get(i));
        }
    }

    @Test
    void testFailingTaskDoesNotBlockQueue() throws InterruptedException {
        SerialExecutor serial = new SerialExecutor(pool);
        CountDownLatch after = new CountDownLatch(1);

        serial.execute(() -> {
            throw new IllegalStateException("boom");
        });
        serial.execute(after::countDown);

        assertTrue(after.await(5, TimeUnit.SECONDS), "Next task runs after a failure");
    }

    @Test
    void testRejectedTaskDoesNotWedgeExecutor() throws InterruptedException {
        AtomicBoolean rejecting = new AtomicBoolean(true);
        SerialExecutor serial = new SerialExecutor(task -> {
            if (rejecting.get()) {
                throw new RejectedExecutionException("worker shut down");
            }
            pool.execute(task);
        });
        CountDownLatch ran = new CountDownLatch(1);

        assertDoesNotThrow(() -> serial.execute(() -> fail("Rejected task must not run")));

        rejecting.set(false);
        serial.execute(ran::countDown);

        assertTrue(ran.await(5, TimeUnit.SECONDS), "Queue drains after a rejection");
    }
}
