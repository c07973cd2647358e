package me.golemcore.reasoning.adapter.outbound.scheduling;

import me.golemcore.reasoning.port.outbound.SchedulerPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutorSchedulerAdapterTest {

    private ExecutorSchedulerAdapter scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new ExecutorSchedulerAdapter();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void shouldRunDelayedTaskOnce() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        scheduler.schedule(latch::countDown, Duration.ofMillis(10));

        assertTrue(latch.await(2, TimeUnit.SECONDS));
    }

    @Test
    void shouldNotRunCancelledTask() throws InterruptedException {
        AtomicInteger runs = new AtomicInteger();

        SchedulerPort.ScheduledTask task = scheduler.schedule(runs::incrementAndGet, Duration.ofMillis(200));
        task.cancel();
        Thread.sleep(400);

        assertTrue(task.isCancelled());
        assertEquals(0, runs.get());
    }

    @Test
    void shouldKeepPeriodicTaskAliveAfterFailure() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(3);

        SchedulerPort.ScheduledTask task = scheduler.scheduleAtFixedRate(() -> {
            latch.countDown();
            throw new IllegalStateException("boom");
        }, Duration.ofMillis(10));

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        task.cancel();
        assertTrue(task.isCancelled());
    }
}
