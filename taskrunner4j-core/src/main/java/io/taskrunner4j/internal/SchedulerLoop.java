package io.taskrunner4j.internal;

import io.taskrunner4j.core.Task;
import io.taskrunner4j.utils.TriggerCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-threaded timer that fires active tasks at their computed times.
 *
 * <p>All schedule state is owned by the {@code taskrunner.scheduler} thread. Other threads talk to it through a
 * command mailbox, which also doubles as the wake-up signal: the loop sleeps until either the earliest fire time
 * or the next command, never on a fixed tick.
 *
 * <p>An overdue fire (e.g. after a restart or a long pause) runs once, then the schedule continues from the
 * present without replaying the missed occurrences.
 */
public final class SchedulerLoop {
    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    // re-check the clock at least this often, even with nothing due
    private static final Duration MAX_SLEEP = Duration.ofMinutes(1);

    /**
     * Receives each fire. Called on the scheduler thread; must not block for long.
     */
    @FunctionalInterface
    public interface FireHandler {
        void fire(Task task, Instant scheduledAt);
    }

    private final FireHandler fireHandler;
    private final Clock clock;
    private final Duration misfireThreshold;

    private final BlockingQueue<Runnable> mailbox = new LinkedBlockingQueue<>();
    private final AtomicBoolean started = new AtomicBoolean(false);

    // scheduler-thread confined
    private final PriorityQueue<Entry> heap = new PriorityQueue<>(Comparator.comparing(Entry::at));
    private final Map<String, Entry> entries = new HashMap<>();
    private int systemErrorCount = 0;

    private Thread schedulerThread;

    public SchedulerLoop(FireHandler fireHandler, Clock clock, Duration misfireThreshold) {
        this.fireHandler = Objects.requireNonNull(fireHandler, "fireHandler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.misfireThreshold = Objects.requireNonNull(misfireThreshold, "misfireThreshold must not be null");
    }

    public void start() {
        Thread previous = schedulerThread;
        if (previous != null && previous.isAlive()) {
            throw new IllegalStateException("previous scheduler thread has not exited yet");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        schedulerThread = new Thread(this::loop);
        schedulerThread.setName("taskrunner.scheduler");
        schedulerThread.setDaemon(true);
        schedulerThread.start();
    }

    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        Thread t = schedulerThread;
        if (t != null) {
            t.interrupt();
            try {
                t.join(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (t.isAlive()) {
                log.warn("taskrunner scheduler thread did not exit within 5s");
            }
        }
    }

    public boolean isRunning() {
        return started.get();
    }

    /**
     * Schedule {@code task}, replacing any previous schedule for the same id. Inactive tasks are removed.
     */
    public void addOrReplace(Task task) {
        Objects.requireNonNull(task, "task must not be null");
        Objects.requireNonNull(task.id(), "task.id must not be null");
        submit(() -> {
            if (!task.active()) {
                entries.remove(task.id());
                return;
            }
            Optional<Instant> next = TriggerCalculator.nextFireTime(task.schedule(), clock.instant(), task.lastFiredAt());
            if (next.isEmpty()) {
                entries.remove(task.id());
                log.debug("Task id={} has no upcoming fire; not scheduled", task.id());
                return;
            }
            put(new Entry(task, next.get()));
        });
    }

    /**
     * Unschedule a task. The returned future completes once no fire of the task can start anymore.
     */
    public CompletableFuture<Void> remove(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        CompletableFuture<Void> done = new CompletableFuture<>();
        submit(() -> {
            entries.remove(taskId);
            done.complete(null);
        });
        return done;
    }

    /**
     * Next fire time as currently scheduled, or empty when the task is not scheduled.
     */
    public CompletableFuture<Optional<Instant>> nextFireTime(String taskId) {
        CompletableFuture<Optional<Instant>> result = new CompletableFuture<>();
        if (!started.get()) {
            result.complete(Optional.empty());
            return result;
        }
        submit(() -> {
            Entry e = entries.get(taskId);
            result.complete(e == null ? Optional.empty() : Optional.of(e.at()));
        });
        return result;
    }

    private void submit(Runnable command) {
        if (!started.get()) {
            throw new IllegalStateException("scheduler is not running");
        }
        mailbox.add(command);
    }

    private void put(Entry entry) {
        entries.put(entry.task().id(), entry);
        heap.add(entry);
    }

    private void loop() {
        try {
            runLoop();
        } finally {
            mailbox.clear();
            heap.clear();
            entries.clear();
        }
    }

    private void runLoop() {
        while (started.get()) {
            try {
                Runnable command = mailbox.poll(sleepMillis(), TimeUnit.MILLISECONDS);
                if (command != null) {
                    command.run();
                    Runnable more;
                    while ((more = mailbox.poll()) != null) {
                        more.run();
                    }
                }
                fireDue();
                systemErrorCount = 0;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("taskrunner scheduler iteration failed msg={}", e.getMessage(), e);
                try {
                    Thread.sleep(backoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    private long sleepMillis() {
        Entry head = peekLive();
        if (head == null) {
            return MAX_SLEEP.toMillis();
        }
        long untilDue = Duration.between(clock.instant(), head.at()).toMillis();
        return Math.max(0, Math.min(untilDue, MAX_SLEEP.toMillis()));
    }

    private void fireDue() {
        Instant now = clock.instant();
        Entry head;
        while ((head = peekLive()) != null && !head.at().isAfter(now)) {
            heap.poll();
            fire(head, now);
            if (!mailbox.isEmpty()) {
                // let edits (delete, pause) take effect before more fires
                return;
            }
        }
    }

    private void fire(Entry entry, Instant now) {
        Task task = entry.task();
        Duration lateness = Duration.between(entry.at(), now);
        if (lateness.compareTo(misfireThreshold) > 0) {
            log.warn("Task id={} fire at {} is {} late; firing once now", task.id(), entry.at(), lateness);
        }

        try {
            fireHandler.fire(task, entry.at());
        } catch (Exception e) {
            log.error("Task id={} fire failed msg={}", task.id(), e.getMessage(), e);
        }

        Optional<Instant> next;
        try {
            next = TriggerCalculator.nextFireTimeAfterFire(task.schedule(), clock.instant(), entry.at());
        } catch (RuntimeException e) {
            log.error("Task id={} next fire time failed; unscheduling msg={}", task.id(), e.getMessage(), e);
            next = Optional.empty();
        }

        if (next.isPresent()) {
            put(new Entry(task.withLastFiredAt(now), next.get()));
        } else {
            entries.remove(task.id(), entry);
            log.debug("Task id={} retired from schedule after final fire", task.id());
        }
    }

    // Discards heap entries replaced or removed since they were queued.
    private Entry peekLive() {
        Entry head;
        while ((head = heap.peek()) != null && entries.get(head.task().id()) != head) {
            heap.poll();
        }
        return head;
    }

    // Exponential backoff for repeated loop failures.
    private static Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    private record Entry(Task task, Instant at) {
        // identity matters: equal-looking entries for a re-added task must not be confused
        @Override
        public boolean equals(Object o) {
            return this == o;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(this);
        }
    }
}
