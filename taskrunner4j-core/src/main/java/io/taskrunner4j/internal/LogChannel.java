package io.taskrunner4j.internal;

import io.taskrunner4j.core.LogLine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Per-execution state of the log pipeline: sequence counter, lines not yet persisted and live subscribers.
 */
final class LogChannel {

    record Seam(long sequence, List<LogLine> unpersisted) {
    }

    private final String executionId;
    private final List<BufferedLogSubscription> subscribers = new ArrayList<>();
    private final Deque<LogLine> unpersisted = new ArrayDeque<>();
    private long lastSequence;
    private long persistedSequence;
    private boolean closed;

    LogChannel(String executionId) {
        this.executionId = executionId;
    }

    String executionId() {
        return executionId;
    }

    /**
     * Number the line, hand it to {@code writer} and to every subscriber, in that order and under one lock so
     * sequence order equals persistence order.
     */
    synchronized LogLine append(LogLine captured, Consumer<LogLine> writer) {
        if (closed) {
            throw new IllegalStateException("log channel already closed: " + executionId);
        }
        LogLine line = captured.withSequence(++lastSequence);
        unpersisted.addLast(line);
        writer.accept(line);
        for (BufferedLogSubscription s : subscribers) {
            s.offer(line);
        }
        return line;
    }

    /**
     * Register a live subscriber and return the seam: every line up to {@code sequence} must come from history,
     * every later line will be pushed to the subscriber.
     */
    synchronized Seam register(BufferedLogSubscription subscription) {
        if (closed) {
            subscription.end();
        } else {
            subscribers.add(subscription);
        }
        return new Seam(lastSequence, List.copyOf(unpersisted));
    }

    synchronized void unregister(BufferedLogSubscription subscription) {
        subscribers.remove(subscription);
    }

    synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (BufferedLogSubscription s : subscribers) {
            s.end();
        }
        subscribers.clear();
        notifyAll();
    }

    synchronized void markPersisted(long sequence) {
        if (sequence > persistedSequence) {
            persistedSequence = sequence;
        }
        while (!unpersisted.isEmpty() && unpersisted.peekFirst().sequence() <= persistedSequence) {
            unpersisted.pollFirst();
        }
        notifyAll();
    }

    synchronized boolean isDrained() {
        return closed && persistedSequence >= lastSequence;
    }

    /**
     * Wait until every line appended so far is persisted.
     *
     * @return false on timeout
     */
    synchronized boolean awaitPersisted(long timeoutMillis) throws InterruptedException {
        long target = lastSequence;
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (persistedSequence < target) {
            long left = deadline - System.currentTimeMillis();
            if (left <= 0) {
                return false;
            }
            wait(left);
        }
        return true;
    }
}
