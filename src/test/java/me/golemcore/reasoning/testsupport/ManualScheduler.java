package me.golemcore.reasoning.testsupport;

import me.golemcore.reasoning.port.outbound.SchedulerPort;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Scheduler that only runs tasks when asked to.
 */
public class ManualScheduler implements SchedulerPort {

    private final List<Task> tasks = new ArrayList<>();

    @Override
    public synchronized ScheduledTask schedule(Runnable task, Duration delay) {
        Task scheduled = new Task(task, delay, false);
        tasks.add(scheduled);
        return scheduled;
    }

    @Override
    public synchronized ScheduledTask scheduleAtFixedRate(Runnable task, Duration period) {
        Task scheduled = new Task(task, period, true);
        tasks.add(scheduled);
        return scheduled;
    }

    /**
     * Runs every live task once. One-shot tasks are consumed.
     *
     * @return number of tasks run
     */
    public int runPending() {
        List<Task> due;
        synchronized (this) {
            due = new ArrayList<>(tasks);
            tasks.removeIf(t -> !t.periodic || t.cancelled);
        }
        int ran = 0;
        for (Task task : due) {
            if (!task.cancelled) {
                if (!task.periodic) {
                    task.cancelled = true;
                }
                task.runnable.run();
                ran++;
            }
        }
        return ran;
    }

    public synchronized int pendingCount() {
        return (int) tasks.stream().filter(t -> !t.cancelled).count();
    }

    public synchronized List<Duration> pendingDelays() {
        return tasks.stream().filter(t -> !t.cancelled).map(t -> t.delay).toList();
    }

    private static final class Task implements ScheduledTask {

        private final Runnable runnable;
        private final Duration delay;
        private final boolean periodic;
        private volatile boolean cancelled;

        private Task(Runnable runnable, Duration delay, boolean periodic) {
            this.runnable = runnable;
            this.delay = delay;
            this.periodic = periodic;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
