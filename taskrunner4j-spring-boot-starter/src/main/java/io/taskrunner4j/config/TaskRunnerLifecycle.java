package io.taskrunner4j.config;

import io.taskrunner4j.TaskEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the task engine with the Spring context and stops it on context close.
 * <p>
 * Runs in the highest phase, so the engine starts after and stops before the other lifecycle beans.
 * With {@code taskrunner.auto-startup=false} the engine is left for the application to start.
 * Running state is read from the engine, so a manual start or stop is reflected here.
 */
public class TaskRunnerLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TaskRunnerLifecycle.class);

    private final TaskEngine taskEngine;
    private final boolean autoStartup;

    public TaskRunnerLifecycle(TaskEngine taskEngine, boolean autoStartup) {
        this.taskEngine = taskEngine;
        this.autoStartup = autoStartup;
        if (!autoStartup) {
            log.info("TaskRunner auto-startup disabled; call TaskEngine.start() to begin firing tasks");
        }
    }

    @Override
    public void start() {
        taskEngine.start();
    }

    @Override
    public void stop() {
        taskEngine.stop();
    }

    @Override
    public boolean isRunning() {
        return taskEngine.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }
}
