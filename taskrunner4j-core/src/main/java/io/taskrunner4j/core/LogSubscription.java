package io.taskrunner4j.core;

import java.time.Duration;
import java.util.Iterator;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Live view over the output of one execution: stored history first, then lines as they are captured.
 *
 * <p>{@link #hasNext()} blocks until a line is available or the execution has ended and every buffered
 * line was consumed. A slow consumer may miss lines (see {@link #droppedLines()}); stored history does not.
 */
public interface LogSubscription extends Iterator<LogLine>, AutoCloseable {

    String executionId();

    /**
     * Wait up to {@code timeout} for the next line.
     *
     * @return the next line, or empty if none arrived in time or the subscription has ended
     */
    Optional<LogLine> poll(Duration timeout) throws InterruptedException;

    /**
     * True once the execution is terminal and every line has been handed out.
     */
    boolean isFinished();

    /**
     * Lines discarded because this subscriber fell behind its buffer.
     */
    long droppedLines();

    /**
     * Stop receiving lines. Idempotent.
     */
    @Override
    void close();

    default Stream<LogLine> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED), false)
                .onClose(this::close);
    }
}
