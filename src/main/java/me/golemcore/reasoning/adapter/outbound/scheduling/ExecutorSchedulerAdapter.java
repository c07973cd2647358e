/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.reasoning.adapter.outbound.scheduling;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reasoning.port.outbound.SchedulerPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link SchedulerPort} backed by a small pool of daemon threads. Task failures
 * are logged and never kill a periodic task.
 */
@Component
@Slf4j
public class ExecutorSchedulerAdapter implements SchedulerPort {

    private static final int POOL_SIZE = 2;

    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ScheduledExecutorService scheduler;

    public ExecutorSchedulerAdapter() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(POOL_SIZE, r -> {
            Thread t = new Thread(r, "reasoning-scheduler-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        executor.setRemoveOnCancelPolicy(true);
        this.scheduler = Executors.unconfigurableScheduledExecutorService(executor);
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = scheduler.schedule(guarded(task), delay.toMillis(), TimeUnit.MILLISECONDS);
        return new FutureTask(future);
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(Runnable task, Duration period) {
        long millis = period.toMillis();
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(guarded(task), millis, millis,
                TimeUnit.MILLISECONDS);
        return new FutureTask(future);
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
        log.info("[Scheduler] Shut down");
    }

    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("[Scheduler] Scheduled task failed", e);
            }
        };
    }

    private record FutureTask(ScheduledFuture<?> future) implements ScheduledTask {

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
