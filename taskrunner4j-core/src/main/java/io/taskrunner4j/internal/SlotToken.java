package io.taskrunner4j.internal;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Concurrency permission for one execution, issued by {@link ConcurrencyRegistry}.
 * Carries the child process handle and the cancel signal while the execution is alive.
 */
public final class SlotToken {

    private final String taskId;
    private final String executionId;
    private final Instant acquiredAt;

    private final AtomicBoolean released = new AtomicBoolean(false);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private volatile Process process;

    SlotToken(String taskId, String executionId, Instant acquiredAt) {
        this.taskId = taskId;
        this.executionId = executionId;
        this.acquiredAt = acquiredAt;
    }

    public String taskId() {
        return taskId;
    }

    public String executionId() {
        return executionId;
    }

    public Instant acquiredAt() {
        return acquiredAt;
    }

    void attach(Process process) {
        this.process = process;
    }

    public Optional<Process> process() {
        return Optional.ofNullable(process);
    }

    /**
     * @return true for the first caller only
     */
    boolean requestCancel() {
        return cancelRequested.compareAndSet(false, true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public String toString() {
        return "SlotToken{taskId=" + taskId + ", executionId=" + executionId + "}";
    }
}
