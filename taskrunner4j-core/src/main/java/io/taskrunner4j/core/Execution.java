package io.taskrunner4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One run of a task's command. Instances are immutable; each state change yields a new instance.
 */
public record Execution(
        String id,
        String taskId,
        ExecutionState state,
        Instant startTime,
        Instant endTime,
        Integer exitCode,
        String errorMessage
) {
    public Execution {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(startTime, "startTime must not be null");
    }

    public static Execution pending(String id, String taskId, Instant admittedAt) {
        return new Execution(id, taskId, ExecutionState.PENDING, admittedAt, null, null, null);
    }

    public Execution running(Instant spawnedAt) {
        return transition(ExecutionState.RUNNING, spawnedAt, null, null, null);
    }

    public Execution completed(Instant endedAt, int exitCode) {
        return transition(ExecutionState.COMPLETED, startTime, endedAt, exitCode, null);
    }

    public Execution failed(Instant endedAt, Integer exitCode, String reason) {
        return transition(ExecutionState.FAILED, startTime, endedAt, exitCode, reason);
    }

    public Execution terminated(Instant endedAt, Integer exitCode, String reason) {
        return transition(ExecutionState.TERMINATED, startTime, endedAt, exitCode, reason);
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    /**
     * Wall-clock run time, or null while the execution is not terminal.
     */
    public Duration duration() {
        if (endTime == null) {
            return null;
        }
        return Duration.between(startTime, endTime);
    }

    private Execution transition(ExecutionState next, Instant start, Instant end, Integer code, String reason) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal execution transition " + state + " -> " + next + " id=" + id);
        }
        return new Execution(id, taskId, next, start, end, code, reason);
    }
}
