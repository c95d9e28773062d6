package io.taskrunner4j;

import io.taskrunner4j.core.Execution;
import io.taskrunner4j.core.ExecutionQuery;
import io.taskrunner4j.core.ExecutionStats;
import io.taskrunner4j.core.LogLine;
import io.taskrunner4j.core.LogQuery;
import io.taskrunner4j.core.LogSubscription;
import io.taskrunner4j.core.Task;
import io.taskrunner4j.core.TaskDefinition;
import io.taskrunner4j.core.TaskQuery;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Main engine API.
 *
 * <p>Registers commands with a schedule, runs them as child processes under a per-task concurrency limit, and
 * exposes their executions and captured output.
 *
 * <p>Definitions are validated synchronously: an invalid definition raises
 * {@link io.taskrunner4j.core.TaskValidationException} and leaves no trace in the store or the scheduler.
 * Operations on unknown task ids raise {@link io.taskrunner4j.core.TaskNotFoundException}.
 */
public interface TaskEngine {

    /**
     * Load active tasks and start firing them. Idempotent.
     */
    void start();

    /**
     * Stop firing. Running executions are terminated when {@code taskrunner.terminateOnShutdown} is set.
     * Idempotent.
     */
    void stop();

    /**
     * Whether the engine has been started and not stopped since.
     */
    boolean isRunning();

    /**
     * Start a fluent definition. Nothing is persisted until {@link TaskBuilder#save()}.
     */
    TaskBuilder create(String name);

    /**
     * Register a task. An active {@code Immediate} task fires before this returns.
     */
    Task createTask(TaskDefinition definition);

    /**
     * Replace the definition of an existing task and reschedule it. Running executions are unaffected.
     */
    Task updateTask(String taskId, TaskDefinition definition);

    /**
     * Remove a task along with its execution history and logs.
     *
     * @throws IllegalStateException if the task has running executions
     */
    void deleteTask(String taskId);

    /**
     * Stop scheduling the task. Running executions continue.
     */
    Task pauseTask(String taskId);

    /**
     * Re-activate a paused task; its next fire time is computed from now.
     */
    Task resumeTask(String taskId);

    /**
     * Fire the task once, outside its schedule. Subject to the concurrency limit.
     *
     * @return the new execution, or empty if the fire was dropped at the limit
     */
    Optional<Execution> runNow(String taskId);

    /**
     * Stop a running execution, forcibly after {@code gracePeriod}.
     *
     * @param gracePeriod null means {@code taskrunner.defaultGracePeriod}
     * @return false if the execution was not running
     */
    boolean terminateExecution(String executionId, Duration gracePeriod);

    /**
     * Ids of the task's executions currently holding a concurrency slot.
     */
    List<String> listRunning(String taskId);

    /**
     * Executions of a task, newest first.
     */
    List<Execution> getExecutionHistory(String taskId, ExecutionQuery query);

    /**
     * Replay stored output, then follow live output until the execution ends.
     */
    LogSubscription subscribeLogs(String executionId);

    Optional<Task> getTask(String taskId);

    List<Task> listTasks();

    /**
     * Tasks matching {@code query}, most recently updated first.
     */
    List<Task> listTasks(TaskQuery query);

    Optional<Execution> getExecution(String executionId);

    List<LogLine> getLogHistory(String executionId, LogQuery query);

    ExecutionStats getExecutionStats(String taskId);

    /**
     * Armed fire time; empty when the task is paused, retired or unknown.
     */
    Optional<Instant> nextFireTime(String taskId);
}
