package io.taskrunner4j.internal;

import io.taskrunner4j.core.Execution;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Live view of one supervised execution.
 */
public final class ExecutionHandle {

    private final SlotToken token;
    private final AtomicReference<Execution> current;
    private final AtomicBoolean finished = new AtomicBoolean(false);
    private final CompletableFuture<Execution> completion = new CompletableFuture<>();

    ExecutionHandle(SlotToken token, Execution pending) {
        this.token = token;
        this.current = new AtomicReference<>(pending);
    }

    public String executionId() {
        return token.executionId();
    }

    public String taskId() {
        return token.taskId();
    }

    public Execution current() {
        return current.get();
    }

    /**
     * Completes with the terminal execution.
     */
    public CompletableFuture<Execution> completion() {
        return completion;
    }

    /**
     * Wait up to {@code timeout} for the terminal execution.
     */
    public Optional<Execution> await(Duration timeout) throws InterruptedException {
        try {
            return Optional.of(completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (ExecutionException e) {
            throw new IllegalStateException("execution completion failed: " + executionId(), e.getCause());
        }
    }

    SlotToken token() {
        return token;
    }

    Execution update(UnaryOperator<Execution> change) {
        return current.updateAndGet(change);
    }

    /**
     * @return true for the one caller allowed to finalize this execution
     */
    boolean claimFinish() {
        return finished.compareAndSet(false, true);
    }

    boolean isFinished() {
        return finished.get();
    }

    void complete(Execution terminal) {
        completion.complete(terminal);
    }
}
