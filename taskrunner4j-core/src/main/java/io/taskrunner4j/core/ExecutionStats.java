package io.taskrunner4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;

/**
 * Aggregated execution counters for one task.
 */
public record ExecutionStats(
        long total,
        long completed,
        long failed,
        long terminated,
        Duration averageDuration,
        ExecutionState lastState,
        Instant lastStartTime
) {

    public static ExecutionStats empty() {
        return new ExecutionStats(0, 0, 0, 0, Duration.ZERO, null, null);
    }

    public static ExecutionStats of(Collection<Execution> executions) {
        if (executions.isEmpty()) {
            return empty();
        }
        long completed = 0;
        long failed = 0;
        long terminated = 0;
        long completedNanos = 0;
        for (Execution e : executions) {
            switch (e.state()) {
                case COMPLETED -> {
                    completed++;
                    Duration d = e.duration();
                    if (d != null) {
                        completedNanos += d.toNanos();
                    }
                }
                case FAILED -> failed++;
                case TERMINATED -> terminated++;
                default -> {
                }
            }
        }
        Duration average = completed == 0 ? Duration.ZERO : Duration.ofNanos(completedNanos / completed);
        Execution last = executions.stream()
                .max(Comparator.comparing(Execution::startTime))
                .orElseThrow();
        return new ExecutionStats(executions.size(), completed, failed, terminated, average,
                last.state(), last.startTime());
    }
}
