package io.taskrunner4j;

import io.taskrunner4j.core.Task;
import io.taskrunner4j.core.TaskDefinition;

import java.time.Duration;
import java.time.Instant;

/**
 * Fluent builder for a task definition.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an in-memory definition, validated</li>
 *   <li>save(): build() + {@link TaskEngine#createTask}</li>
 * </ul>
 * The last schedule method called wins. Without one, the task is {@code Immediate}.
 */
public interface TaskBuilder {

    /**
     * Shell command line to run.
     */
    TaskBuilder command(String command);

    /**
     * Runtime handle resolved to a PATH prefix and working directory when the task runs.
     */
    TaskBuilder runtime(String runtimeRef);

    TaskBuilder description(String description);

    /**
     * Fire once, at registration.
     */
    TaskBuilder immediate();

    TaskBuilder every(Duration period);

    /**
     * Repeat every X amount of time.
     * Accepts human duration strings (e.g. "5 minutes", "1h30m") or plain seconds.
     */
    TaskBuilder every(String interval);

    /**
     * Fire once at {@code time}; a past time fires at registration.
     */
    TaskBuilder at(Instant time);

    /**
     * Five-field cron expression in the system time zone.
     */
    TaskBuilder cron(String expression);

    /**
     * Five-field cron expression in the given IANA time zone (e.g. "Asia/Taipei").
     */
    TaskBuilder cron(String expression, String zone);

    /**
     * Upper bound on concurrently running executions. Default 1.
     */
    TaskBuilder maxInstances(int maxInstances);

    /**
     * Register paused when false. Default true.
     */
    TaskBuilder active(boolean active);

    /**
     * @throws io.taskrunner4j.core.TaskValidationException listing every problem found
     */
    TaskDefinition build();

    Task save();
}
