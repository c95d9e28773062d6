package io.taskrunner4j.spi;

import io.taskrunner4j.core.Task;
import io.taskrunner4j.core.TaskQuery;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * System of record for tasks. The engine reads active tasks from here at startup and writes every
 * registration, update, pause and resume through it.
 */
public interface TaskStore {

    /**
     * Insert or replace a task. A task without id is inserted and returned with its generated id.
     */
    Task save(Task task);

    Optional<Task> findById(String taskId);

    List<Task> findAll();

    List<Task> findActive();

    /**
     * Tasks matching {@code query}, most recently updated first.
     */
    List<Task> find(TaskQuery query);

    void markFired(String taskId, Instant firedAt);

    /**
     * @return true if a task was removed
     */
    boolean deleteById(String taskId);
}
