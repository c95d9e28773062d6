package io.taskrunner4j.spi;

import io.taskrunner4j.core.LogLine;
import io.taskrunner4j.core.LogQuery;

import java.util.List;

/**
 * Append-only durable store of captured output.
 */
public interface LogStore {

    /**
     * Persist a batch. Lines of one execution arrive in sequence order.
     */
    void appendAll(List<LogLine> lines);

    /**
     * Lines of one execution matching {@code query}, ordered by sequence.
     */
    List<LogLine> find(String executionId, LogQuery query);

    long deleteByExecution(String executionId);
}
