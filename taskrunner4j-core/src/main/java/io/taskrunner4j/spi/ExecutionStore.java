package io.taskrunner4j.spi;

import io.taskrunner4j.core.Execution;
import io.taskrunner4j.core.ExecutionQuery;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of executions. Written only by the engine.
 */
public interface ExecutionStore {

    /**
     * Insert or replace by execution id.
     */
    void save(Execution execution);

    Optional<Execution> findById(String executionId);

    /**
     * Executions of one task matching {@code query}, newest first.
     */
    List<Execution> findByTask(String taskId, ExecutionQuery query);

    /**
     * Executions that never reached a terminal state.
     */
    List<Execution> findUnfinished();

    /**
     * @return ids of the removed executions
     */
    List<String> deleteByTask(String taskId);
}
