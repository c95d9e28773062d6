package io.taskrunner4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * One captured output line.
 *
 * <p>{@code sequence} is assigned by the log pipeline, starts at 1 and is strictly increasing per execution.
 * A line that has not passed through the pipeline yet carries sequence 0.
 */
public record LogLine(
        String executionId,
        long sequence,
        Instant timestamp,
        LogStream stream,
        String text
) {
    public LogLine {
        Objects.requireNonNull(executionId, "executionId must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(stream, "stream must not be null");
        text = text == null ? "" : text;
    }

    public static LogLine captured(String executionId, LogStream stream, String text, Instant timestamp) {
        return new LogLine(executionId, 0, timestamp, stream, text);
    }

    public LogLine withSequence(long sequence) {
        return new LogLine(executionId, sequence, timestamp, stream, text);
    }
}
