package io.taskrunner4j.internal;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Table of in-flight executions per task. All operations are atomic with respect to each other, so the number
 * of unreleased tokens for a task never exceeds the {@code maxInstances} it was acquired with.
 */
public final class ConcurrencyRegistry {

    private final Object lock = new Object();
    private final Map<String, Map<String, SlotToken>> byTask = new HashMap<>();
    private final Map<String, SlotToken> byExecution = new HashMap<>();
    private final Clock clock;

    public ConcurrencyRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public ConcurrencyRegistry() {
        this(Clock.systemUTC());
    }

    /**
     * Take a slot for {@code executionId} if fewer than {@code maxInstances} are held for {@code taskId}.
     */
    public Optional<SlotToken> tryAcquire(String taskId, String executionId, int maxInstances) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(executionId, "executionId must not be null");
        if (maxInstances < 1) {
            throw new IllegalArgumentException("maxInstances must be at least 1");
        }

        synchronized (lock) {
            if (byExecution.containsKey(executionId)) {
                throw new IllegalStateException("execution already holds a slot: " + executionId);
            }
            Map<String, SlotToken> held = byTask.computeIfAbsent(taskId, k -> new LinkedHashMap<>());
            if (held.size() >= maxInstances) {
                if (held.isEmpty()) {
                    byTask.remove(taskId);
                }
                return Optional.empty();
            }
            SlotToken token = new SlotToken(taskId, executionId, clock.instant());
            held.put(executionId, token);
            byExecution.put(executionId, token);
            return Optional.of(token);
        }
    }

    /**
     * Give a slot back. Safe to call more than once; only the first call has an effect.
     *
     * @return true if this call released the slot
     */
    public boolean release(SlotToken token) {
        Objects.requireNonNull(token, "token must not be null");
        if (!token.markReleased()) {
            return false;
        }
        synchronized (lock) {
            byExecution.remove(token.executionId());
            Map<String, SlotToken> held = byTask.get(token.taskId());
            if (held != null) {
                held.remove(token.executionId());
                if (held.isEmpty()) {
                    byTask.remove(token.taskId());
                }
            }
        }
        return true;
    }

    public int countRunning(String taskId) {
        synchronized (lock) {
            Map<String, SlotToken> held = byTask.get(taskId);
            return held == null ? 0 : held.size();
        }
    }

    /**
     * Execution ids holding a slot for {@code taskId}, in acquisition order.
     */
    public List<String> listRunning(String taskId) {
        synchronized (lock) {
            Map<String, SlotToken> held = byTask.get(taskId);
            return held == null ? List.of() : List.copyOf(held.keySet());
        }
    }

    public Optional<SlotToken> find(String executionId) {
        synchronized (lock) {
            return Optional.ofNullable(byExecution.get(executionId));
        }
    }

    public List<SlotToken> snapshot() {
        synchronized (lock) {
            return new ArrayList<>(byExecution.values());
        }
    }
}
