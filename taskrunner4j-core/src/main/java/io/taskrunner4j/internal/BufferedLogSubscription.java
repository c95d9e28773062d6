package io.taskrunner4j.internal;

import io.taskrunner4j.core.LogLine;
import io.taskrunner4j.core.LogSubscription;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Subscription backed by a replay list and a bounded live buffer. When the live buffer is full the oldest
 * buffered line is discarded, so a slow reader never holds up the producer.
 */
final class BufferedLogSubscription implements LogSubscription {

    private final String executionId;
    private final int capacity;
    private final Consumer<BufferedLogSubscription> onClose;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    // guarded by lock
    private final Deque<LogLine> replay = new ArrayDeque<>();
    private final Deque<LogLine> live = new ArrayDeque<>();
    private boolean replayReady;
    private boolean ended;
    private boolean closed;
    private long dropped;

    private LogLine peeked;

    BufferedLogSubscription(String executionId, int capacity, Consumer<BufferedLogSubscription> onClose) {
        this.executionId = executionId;
        this.capacity = capacity;
        this.onClose = onClose;
    }

    void offer(LogLine line) {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            if (live.size() >= capacity) {
                live.pollFirst();
                dropped++;
            }
            live.addLast(line);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void replay(Collection<LogLine> history) {
        lock.lock();
        try {
            replay.addAll(history);
            replayReady = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void end() {
        lock.lock();
        try {
            ended = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String executionId() {
        return executionId;
    }

    @Override
    public Optional<LogLine> poll(Duration timeout) throws InterruptedException {
        if (peeked != null) {
            LogLine line = peeked;
            peeked = null;
            return Optional.of(line);
        }
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (true) {
                if (closed) {
                    return Optional.empty();
                }
                if (replayReady) {
                    LogLine line = replay.pollFirst();
                    if (line == null) {
                        line = live.pollFirst();
                    }
                    if (line != null) {
                        return Optional.of(line);
                    }
                    if (ended) {
                        return Optional.empty();
                    }
                }
                if (remaining <= 0) {
                    return Optional.empty();
                }
                remaining = changed.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean hasNext() {
        if (peeked != null) {
            return true;
        }
        try {
            while (!isFinished()) {
                Optional<LogLine> next = poll(Duration.ofSeconds(1));
                if (next.isPresent()) {
                    peeked = next.get();
                    return true;
                }
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public LogLine next() {
        if (!hasNext()) {
            throw new NoSuchElementException("log subscription ended: " + executionId);
        }
        LogLine line = peeked;
        peeked = null;
        return line;
    }

    @Override
    public boolean isFinished() {
        if (peeked != null) {
            return false;
        }
        lock.lock();
        try {
            return closed || (replayReady && ended && replay.isEmpty() && live.isEmpty());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long droppedLines() {
        lock.lock();
        try {
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            replay.clear();
            live.clear();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        onClose.accept(this);
    }
}
