package com.questrail.simmonitor.time;

import com.questrail.simmonitor.internal.time.Cancellable;
import com.questrail.simmonitor.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deterministic scheduler driven by a ManualMonotonicClock.
 *
 * Tasks execute ONLY when {@link #runDueTasks()} or {@link #advance(Duration)}
 * is called, on the calling thread. Tasks with equal deadlines run in
 * scheduling order.
 */
public final class DeterministicScheduler implements MonotonicScheduler {

    private final ManualMonotonicClock clock;
    private final PriorityQueue<Scheduled> queue = new PriorityQueue<>();
    private long sequence;

    public DeterministicScheduler(ManualMonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Scheduled scheduled = new Scheduled(deadlineNanos, sequence++, task);
        queue.add(scheduled);
        return scheduled;
    }

    /**
     * Run all tasks whose deadlines are <= current clock time.
     */
    public void runDueTasks() {
        Scheduled next;
        while ((next = pollDue(clock.nowNanos())) != null) {
            if (!next.cancelled.get()) {
                next.task.run();
            }
        }
    }

    /**
     * Advances the clock by {@code delta}, stopping at every deadline on the
     * way so each task observes the clock at its own deadline.
     */
    public void advance(Duration delta) {
        long target = clock.nowNanos() + delta.toNanos();
        Scheduled next;
        while ((next = pollDue(target)) != null) {
            clock.advanceTo(next.deadlineNanos);
            if (!next.cancelled.get()) {
                next.task.run();
            }
        }
        clock.advanceTo(target);
    }

    public void advanceSeconds(long seconds) {
        advance(Duration.ofSeconds(seconds));
    }

    /**
     * Number of scheduled tasks that have not run and are not cancelled.
     */
    public synchronized int pendingCount() {
        return (int) queue.stream().filter(s -> !s.cancelled.get()).count();
    }

    private synchronized Scheduled pollDue(long limit) {
        Scheduled head = queue.peek();
        if (head == null || head.deadlineNanos > limit) {
            return null;
        }
        return queue.poll();
    }

    private static final class Scheduled implements Comparable<Scheduled>, Cancellable {
        private final long deadlineNanos;
        private final long sequence;
        private final Runnable task;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        private Scheduled(long deadlineNanos, long sequence, Runnable task) {
            this.deadlineNanos = deadlineNanos;
            this.sequence = sequence;
            this.task = task;
        }

        @Override
        public boolean cancel() {
            return cancelled.compareAndSet(false, true);
        }

        @Override
        public int compareTo(Scheduled o) {
            int byDeadline = Long.compare(this.deadlineNanos, o.deadlineNanos);
            return byDeadline != 0 ? byDeadline : Long.compare(this.sequence, o.sequence);
        }
    }
}
