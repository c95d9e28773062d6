package io.taskrunner4j.internal;

import io.taskrunner4j.TaskBuilder;
import io.taskrunner4j.TaskEngine;
import io.taskrunner4j.config.TaskRunnerProperties;
import io.taskrunner4j.core.Execution;
import io.taskrunner4j.core.ExecutionQuery;
import io.taskrunner4j.core.ExecutionStats;
import io.taskrunner4j.core.LogLine;
import io.taskrunner4j.core.LogQuery;
import io.taskrunner4j.core.LogSubscription;
import io.taskrunner4j.core.ScheduleType;
import io.taskrunner4j.core.Task;
import io.taskrunner4j.core.TaskDefinition;
import io.taskrunner4j.core.TaskNotFoundException;
import io.taskrunner4j.core.TaskQuery;
import io.taskrunner4j.spi.ExecutionStore;
import io.taskrunner4j.spi.LogStore;
import io.taskrunner4j.spi.RuntimeResolver;
import io.taskrunner4j.spi.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link TaskEngine} wiring the scheduler loop, concurrency registry, process supervisor and log pipeline over
 * the given stores.
 *
 * <p>Every fire, scheduled or manual, goes through the same gate: acquire a slot, persist a {@code PENDING}
 * execution, hand it to the supervisor. A fire that finds the task at its limit is dropped.
 */
public class DefaultTaskEngine implements TaskEngine {
    private static final Logger log = LoggerFactory.getLogger(DefaultTaskEngine.class);

    static final String RECOVERED_REASON = "engine restarted while execution was running";

    private final TaskRunnerProperties props;
    private final TaskStore taskStore;
    private final ExecutionStore executionStore;
    private final LogStore logStore;
    private final RuntimeResolver runtimeResolver;
    private final Clock clock;

    private final TaskValidator validator;
    private final ConcurrencyRegistry registry;
    private final LogPipeline logPipeline;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Object mutationLock = new Object();
    private final Object lifecycleLock = new Object();

    private volatile ProcessSupervisor supervisor;
    private volatile SchedulerLoop scheduler;

    public DefaultTaskEngine(TaskRunnerProperties props,
                             TaskStore taskStore,
                             ExecutionStore executionStore,
                             LogStore logStore,
                             RuntimeResolver runtimeResolver) {
        this(props, taskStore, executionStore, logStore, runtimeResolver, Clock.systemUTC());
    }

    public DefaultTaskEngine(TaskRunnerProperties props,
                             TaskStore taskStore,
                             ExecutionStore executionStore,
                             LogStore logStore,
                             RuntimeResolver runtimeResolver,
                             Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.taskStore = Objects.requireNonNull(taskStore, "taskStore must not be null");
        this.executionStore = Objects.requireNonNull(executionStore, "executionStore must not be null");
        this.logStore = Objects.requireNonNull(logStore, "logStore must not be null");
        this.runtimeResolver = Objects.requireNonNull(runtimeResolver, "runtimeResolver must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.validator = new TaskValidator(runtimeResolver);
        this.registry = new ConcurrencyRegistry(clock);
        this.logPipeline = new LogPipeline(logStore, props.getSubscriberBufferSize(), props.getLogBatchSize());
    }

    /**
     * Start the log writer, recover executions orphaned by a previous process and arm every active task.
     * Idempotent.
     */
    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (!started.compareAndSet(false, true)) {
                return;
            }
            doStart();
        }
    }

    private void doStart() {
        try {
            props.validate();

            log.info("TaskRunner starting with shell={}, defaultGracePeriod={}, killTimeout={}, misfireThreshold={}, "
                            + "subscriberBufferSize={}, logBatchSize={}",
                    props.getShell(),
                    props.getDefaultGracePeriod(),
                    props.getKillTimeout(),
                    props.getMisfireThreshold(),
                    props.getSubscriberBufferSize(),
                    props.getLogBatchSize());

            logPipeline.start();
            supervisor = new ProcessSupervisor(props, runtimeResolver, registry, logPipeline, executionStore, clock);
            recoverUnfinished();

            SchedulerLoop loop = new SchedulerLoop(this::onScheduledFire, clock, props.getMisfireThreshold());
            loop.start();
            scheduler = loop;

            List<Task> active = taskStore.findActive();
            for (Task task : active) {
                loop.addOrReplace(task);
            }
            log.info("TaskRunner started successfully with {} active task(s).", active.size());
        } catch (RuntimeException e) {
            started.set(false);
            shutdownComponents(false);
            throw e;
        }
    }

    /**
     * Stop firing and, if configured, terminate running executions. Idempotent.
     */
    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!started.compareAndSet(true, false)) {
                return;
            }
            log.info("TaskRunner stopping...");
            shutdownComponents(props.isTerminateOnShutdown());
            log.info("TaskRunner stopped successfully.");
        }
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public TaskBuilder create(String name) {
        return new SimpleTaskBuilder(name, this::createTask);
    }

    @Override
    public Task createTask(TaskDefinition definition) {
        validator.validate(definition);
        requireStarted();

        synchronized (mutationLock) {
            Task task = taskStore.save(Task.from(definition, clock.instant()));
            log.info("Task registered id={} name={} schedule={} maxInstances={} active={}",
                    task.id(), task.name(), task.schedule(), task.maxInstances(), task.active());
            return arm(task);
        }
    }

    @Override
    public Task updateTask(String taskId, TaskDefinition definition) {
        validator.validate(definition);
        requireStarted();

        synchronized (mutationLock) {
            Task existing = requireTask(taskId);
            Task updated = existing.redefine(definition, clock.instant());
            if (!updated.schedule().type().isRecurring() && !updated.schedule().equals(existing.schedule())) {
                // a new one-shot schedule gets its own fire
                updated = updated.withLastFiredAt(null);
            }
            updated = taskStore.save(updated);
            log.info("Task updated id={} name={} schedule={} maxInstances={} active={}",
                    updated.id(), updated.name(), updated.schedule(), updated.maxInstances(), updated.active());
            return arm(updated);
        }
    }

    @Override
    public void deleteTask(String taskId) {
        requireStarted();

        synchronized (mutationLock) {
            Task task = requireTask(taskId);
            requireIdle(task);
            awaitUnscheduled(taskId);
            if (registry.countRunning(taskId) > 0) {
                // a fire slipped in before the scheduler saw the removal
                scheduler.addOrReplace(task);
                requireIdle(task);
            }

            taskStore.deleteById(taskId);
            List<String> executionIds = executionStore.deleteByTask(taskId);
            long lines = 0;
            for (String executionId : executionIds) {
                lines += logStore.deleteByExecution(executionId);
            }
            log.info("Task deleted id={} name={} executions={} logLines={}", taskId, task.name(),
                    executionIds.size(), lines);
        }
    }

    @Override
    public Task pauseTask(String taskId) {
        requireStarted();

        synchronized (mutationLock) {
            Task task = requireTask(taskId);
            if (!task.active()) {
                return task;
            }
            Task paused = taskStore.save(task.withActive(false, clock.instant()));
            scheduler.remove(taskId);
            log.info("Task paused id={} name={}", taskId, paused.name());
            return paused;
        }
    }

    @Override
    public Task resumeTask(String taskId) {
        requireStarted();

        synchronized (mutationLock) {
            Task task = requireTask(taskId);
            if (task.active()) {
                return task;
            }
            Task resumed = taskStore.save(task.withActive(true, clock.instant()));
            log.info("Task resumed id={} name={}", taskId, resumed.name());
            return arm(resumed);
        }
    }

    @Override
    public Optional<Execution> runNow(String taskId) {
        requireStarted();
        return fire(requireTask(taskId));
    }

    @Override
    public boolean terminateExecution(String executionId, Duration gracePeriod) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        Duration grace = gracePeriod != null ? gracePeriod : props.getDefaultGracePeriod();
        if (grace.isNegative()) {
            throw new IllegalArgumentException("gracePeriod must not be negative");
        }
        ProcessSupervisor s = supervisor;
        if (s == null) {
            return false;
        }
        return s.terminate(executionId, grace);
    }

    @Override
    public List<String> listRunning(String taskId) {
        requireTask(taskId);
        return registry.listRunning(taskId);
    }

    @Override
    public List<Execution> getExecutionHistory(String taskId, ExecutionQuery query) {
        requireTask(taskId);
        return executionStore.findByTask(taskId, query != null ? query : ExecutionQuery.all());
    }

    @Override
    public LogSubscription subscribeLogs(String executionId) {
        requireExecution(executionId);
        return logPipeline.subscribe(executionId);
    }

    @Override
    public Optional<Task> getTask(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        return taskStore.findById(taskId);
    }

    @Override
    public List<Task> listTasks() {
        return taskStore.findAll();
    }

    @Override
    public List<Task> listTasks(TaskQuery query) {
        return taskStore.find(query != null ? query : TaskQuery.all());
    }

    @Override
    public Optional<Execution> getExecution(String executionId) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        Optional<ExecutionHandle> live = supervisor == null ? Optional.empty() : supervisor.find(executionId);
        if (live.isPresent()) {
            return Optional.of(live.get().current());
        }
        return executionStore.findById(executionId);
    }

    @Override
    public List<LogLine> getLogHistory(String executionId, LogQuery query) {
        requireExecution(executionId);
        return logPipeline.history(executionId, query != null ? query : LogQuery.builder().build());
    }

    @Override
    public ExecutionStats getExecutionStats(String taskId) {
        requireTask(taskId);
        return ExecutionStats.of(executionStore.findByTask(taskId, ExecutionQuery.all()));
    }

    @Override
    public Optional<Instant> nextFireTime(String taskId) {
        SchedulerLoop loop = scheduler;
        if (loop == null || taskId == null) {
            return Optional.empty();
        }
        try {
            return loop.nextFireTime(taskId).get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("nextFireTime lookup failed task={} msg={}", taskId, e.getMessage());
            return Optional.empty();
        } catch (IllegalStateException e) {
            return Optional.empty();
        }
    }

    /**
     * Hand the task to the scheduler; an active {@code Immediate} task that has not fired yet fires here.
     */
    private Task arm(Task task) {
        if (!task.active()) {
            scheduler.remove(task.id());
            return task;
        }
        if (task.schedule().type() == ScheduleType.IMMEDIATE) {
            scheduler.remove(task.id());
            if (task.lastFiredAt() != null) {
                return task;
            }
            Instant firedAt = clock.instant();
            fire(task);
            markFired(task.id(), firedAt);
            return task.withLastFiredAt(firedAt);
        }
        scheduler.addOrReplace(task);
        return task;
    }

    private void onScheduledFire(Task task, Instant scheduledAt) {
        Instant firedAt = clock.instant();
        fire(task);
        markFired(task.id(), firedAt);
    }

    private Optional<Execution> fire(Task task) {
        String executionId = UUID.randomUUID().toString();
        Optional<SlotToken> acquired = registry.tryAcquire(task.id(), executionId, task.maxInstances());
        if (acquired.isEmpty()) {
            log.debug("Fire dropped task={} running={} maxInstances={}", task.id(),
                    registry.countRunning(task.id()), task.maxInstances());
            return Optional.empty();
        }

        SlotToken token = acquired.get();
        Execution pending = Execution.pending(executionId, task.id(), clock.instant());
        logPipeline.open(executionId);
        try {
            executionStore.save(pending);
        } catch (RuntimeException e) {
            registry.release(token);
            logPipeline.complete(executionId);
            log.error("Fire aborted task={} execution={}: saving execution failed msg={}", task.id(), executionId,
                    e.getMessage(), e);
            throw e;
        }
        supervisor.start(task, pending, token);
        return Optional.of(pending);
    }

    private void markFired(String taskId, Instant firedAt) {
        try {
            taskStore.markFired(taskId, firedAt);
        } catch (RuntimeException e) {
            log.error("Recording fire time failed task={} msg={}", taskId, e.getMessage(), e);
        }
    }

    private void recoverUnfinished() {
        int recovered = 0;
        for (Execution execution : executionStore.findUnfinished()) {
            if (registry.find(execution.id()).isPresent()) {
                // still running from before a stop() in this process
                continue;
            }
            executionStore.save(execution.failed(clock.instant(), null, RECOVERED_REASON));
            recovered++;
        }
        if (recovered > 0) {
            log.warn("Marked {} execution(s) left unfinished by a previous run as FAILED", recovered);
        }
    }

    private void shutdownComponents(boolean terminateRunning) {
        SchedulerLoop loop = scheduler;
        scheduler = null;
        if (loop != null) {
            loop.stop();
        }
        ProcessSupervisor s = supervisor;
        if (s == null) {
            logPipeline.stop(props.getKillTimeout());
            return;
        }
        // executions left running still append output; the writer stays up until they are finalized
        s.shutdown(terminateRunning, props.getDefaultGracePeriod())
                .whenComplete((v, t) -> stopLogPipelineUnlessRestarted());
    }

    private void stopLogPipelineUnlessRestarted() {
        synchronized (lifecycleLock) {
            if (started.get()) {
                return;
            }
            logPipeline.stop(props.getKillTimeout());
        }
    }

    private void awaitUnscheduled(String taskId) {
        try {
            scheduler.remove(taskId).get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while unscheduling task " + taskId, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("unscheduling task " + taskId + " failed", e);
        }
    }

    private void requireStarted() {
        if (!started.get() || scheduler == null) {
            throw new IllegalStateException("task engine is not started");
        }
    }

    private Task requireTask(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        return taskStore.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    private void requireIdle(Task task) {
        int running = registry.countRunning(task.id());
        if (running > 0) {
            throw new IllegalStateException("Task " + task.id() + " has " + running
                    + " running execution(s); terminate them before deleting");
        }
    }

    private void requireExecution(String executionId) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        if (logPipeline.isOpen(executionId)) {
            return;
        }
        if (executionStore.findById(executionId).isEmpty()) {
            throw new IllegalArgumentException("Execution not found: " + executionId);
        }
    }
}
