package io.taskrunner4j.internal;

import io.taskrunner4j.config.TaskRunnerProperties;
import io.taskrunner4j.core.Execution;
import io.taskrunner4j.core.ExecutionState;
import io.taskrunner4j.core.LogLine;
import io.taskrunner4j.core.LogStream;
import io.taskrunner4j.core.Task;
import io.taskrunner4j.spi.ExecutionStore;
import io.taskrunner4j.spi.ResolvedRuntime;
import io.taskrunner4j.spi.RuntimeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

/**
 * Spawns and watches the child process of each admitted execution.
 *
 * <p>Each execution gets one lifecycle thread (spawn, wait, finalize) and one pump thread per output stream.
 * Whatever way an execution ends, it is finalized exactly once: terminal state saved, slot released, log
 * channel completed.
 */
public final class ProcessSupervisor {
    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);

    public static final String TERMINATED_REASON = "terminated by request";

    /**
     * Spawns the child process for a prepared builder.
     */
    @FunctionalInterface
    interface ProcessStarter {
        Process start(ProcessBuilder builder) throws IOException;
    }

    private final TaskRunnerProperties props;
    private final RuntimeResolver runtimeResolver;
    private final ConcurrencyRegistry registry;
    private final LogPipeline logPipeline;
    private final ExecutionStore executionStore;
    private final Clock clock;
    private final Charset charset;
    private final ProcessStarter processStarter;

    private final ExecutorService lifecyclePool;
    private final ExecutorService pumpPool;
    private final ConcurrentHashMap<String, ExecutionHandle> handles = new ConcurrentHashMap<>();

    public ProcessSupervisor(TaskRunnerProperties props,
                             RuntimeResolver runtimeResolver,
                             ConcurrencyRegistry registry,
                             LogPipeline logPipeline,
                             ExecutionStore executionStore,
                             Clock clock) {
        this(props, runtimeResolver, registry, logPipeline, executionStore, clock, ProcessBuilder::start);
    }

    ProcessSupervisor(TaskRunnerProperties props,
                      RuntimeResolver runtimeResolver,
                      ConcurrencyRegistry registry,
                      LogPipeline logPipeline,
                      ExecutionStore executionStore,
                      Clock clock,
                      ProcessStarter processStarter) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.runtimeResolver = Objects.requireNonNull(runtimeResolver, "runtimeResolver must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.logPipeline = Objects.requireNonNull(logPipeline, "logPipeline must not be null");
        this.executionStore = Objects.requireNonNull(executionStore, "executionStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.charset = props.charset();
        this.processStarter = Objects.requireNonNull(processStarter, "processStarter must not be null");
        this.lifecyclePool = Executors.newCachedThreadPool(daemonThreads("taskrunner.execution"));
        this.pumpPool = Executors.newCachedThreadPool(daemonThreads("taskrunner.output"));
    }

    /**
     * Launch the execution asynchronously. The caller must hold {@code token} for it; the supervisor
     * releases it when the execution ends.
     */
    public ExecutionHandle start(Task task, Execution pending, SlotToken token) {
        Objects.requireNonNull(task, "task must not be null");
        Objects.requireNonNull(pending, "pending must not be null");
        Objects.requireNonNull(token, "token must not be null");
        if (pending.state() != ExecutionState.PENDING) {
            throw new IllegalArgumentException("execution must be PENDING to start: " + pending.state());
        }

        ExecutionHandle handle = new ExecutionHandle(token, pending);
        handles.put(pending.id(), handle);
        logPipeline.open(pending.id());
        try {
            lifecyclePool.execute(() -> supervise(task, handle));
        } catch (RuntimeException e) {
            finish(handle, ex -> ex.failed(clock.instant(), null, "could not schedule execution: " + e.getMessage()));
        }
        return handle;
    }

    public Optional<ExecutionHandle> find(String executionId) {
        return Optional.ofNullable(handles.get(executionId));
    }

    /**
     * Stop a running execution: graceful signal, then forced kill after {@code gracePeriod}.
     *
     * @return false if the execution is not currently RUNNING
     */
    public boolean terminate(String executionId, Duration gracePeriod) {
        Objects.requireNonNull(gracePeriod, "gracePeriod must not be null");
        ExecutionHandle handle = handles.get(executionId);
        if (handle == null || handle.current().state() != ExecutionState.RUNNING) {
            return false;
        }

        SlotToken token = handle.token();
        if (!token.requestCancel()) {
            // another caller is already terminating it
            awaitQuietly(handle, gracePeriod.plus(props.getKillTimeout()).plus(props.getOutputDrainTimeout()));
            return true;
        }

        Process process = token.process().orElse(null);
        if (process == null) {
            return false;
        }

        log.info("Terminating execution id={} task={} pid={} grace={}", executionId, handle.taskId(),
                process.pid(), gracePeriod);
        try {
            destroyTree(process, false);
            if (!process.waitFor(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                log.info("Execution id={} ignored graceful stop; killing", executionId);
                destroyTree(process, true);
                if (!process.waitFor(props.getKillTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Process pid={} of execution id={} still alive after forced kill; abandoning it as orphan",
                            process.pid(), executionId);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        // the lifecycle thread normally finalizes as soon as output is drained
        if (awaitQuietly(handle, props.getOutputDrainTimeout().plusMillis(500)).isEmpty()) {
            finish(handle, ex -> ex.terminated(clock.instant(), exitCodeOf(process), TERMINATED_REASON));
        }
        return true;
    }

    /**
     * Executions currently supervised.
     */
    public List<ExecutionHandle> active() {
        return new ArrayList<>(handles.values());
    }

    /**
     * Stop accepting work. With {@code terminateRunning}, running executions are terminated and waited for;
     * otherwise they are left to finish, and their output pumps stay available until they do.
     *
     * @return completes once every execution supervised at the time of the call has been finalized
     */
    public CompletableFuture<Void> shutdown(boolean terminateRunning, Duration gracePeriod) {
        lifecyclePool.shutdown();
        if (!terminateRunning) {
            List<ExecutionHandle> running = active();
            log.info("Supervisor stopping; {} execution(s) left to finish", running.size());
            return CompletableFuture.allOf(running.stream()
                            .map(ExecutionHandle::completion)
                            .toArray(CompletableFuture[]::new))
                    .whenComplete((v, t) -> pumpPool.shutdown());
        }
        for (ExecutionHandle h : active()) {
            terminate(h.executionId(), gracePeriod);
        }
        try {
            if (!lifecyclePool.awaitTermination(props.getKillTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                lifecyclePool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lifecyclePool.shutdownNow();
        }
        pumpPool.shutdownNow();
        return CompletableFuture.completedFuture(null);
    }

    private void supervise(Task task, ExecutionHandle handle) {
        String executionId = handle.executionId();
        SlotToken token = handle.token();
        Process process = null;
        try {
            try {
                process = processStarter.start(processBuilder(task));
            } catch (IOException | RuntimeException e) {
                log.warn("Execution id={} task={} failed to start msg={}", executionId, task.id(), e.getMessage());
                finish(handle, ex -> ex.failed(clock.instant(), null, "failed to start command: " + e.getMessage()));
                return;
            }

            Process child = process;
            token.attach(child);
            Execution running = handle.update(ex -> ex.running(clock.instant()));
            save(running);
            log.debug("Execution started id={} task={} pid={}", executionId, task.id(), child.pid());

            if (token.isCancelRequested()) {
                destroyTree(child, true);
            }

            Future<?> stdout = pumpPool.submit(() -> pump(executionId, child.getInputStream(), LogStream.STDOUT));
            Future<?> stderr = pumpPool.submit(() -> pump(executionId, child.getErrorStream(), LogStream.STDERR));

            int exitCode = child.waitFor();
            Throwable pumpFailure = drain(token, child, stdout, stderr);

            if (token.isCancelRequested()) {
                finish(handle, ex -> ex.terminated(clock.instant(), exitCode, TERMINATED_REASON));
            } else if (pumpFailure != null) {
                finish(handle, ex -> ex.failed(clock.instant(), exitCode,
                        "output capture failed: " + pumpFailure.getMessage()));
            } else if (exitCode == 0) {
                finish(handle, ex -> ex.completed(clock.instant(), 0));
            } else {
                finish(handle, ex -> ex.failed(clock.instant(), exitCode, "command exited with code " + exitCode));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                destroyTree(process, true);
            }
            Process p = process;
            finish(handle, ex -> token.isCancelRequested()
                    ? ex.terminated(clock.instant(), exitCodeOf(p), TERMINATED_REASON)
                    : ex.failed(clock.instant(), exitCodeOf(p), "execution interrupted"));
        } catch (Exception e) {
            log.error("Execution supervisor failed id={} task={} msg={}", executionId, task.id(), e.getMessage(), e);
            if (process != null && process.isAlive()) {
                destroyTree(process, true);
            }
            finish(handle, ex -> ex.failed(clock.instant(), null, "execution failed: " + e.getMessage()));
        } finally {
            if (!handle.isFinished()) {
                finish(handle, ex -> ex.failed(clock.instant(), null, "supervisor stopped unexpectedly"));
            }
        }
    }

    private ProcessBuilder processBuilder(Task task) {
        List<String> command = new ArrayList<>(props.getShell());
        command.add(task.command());
        ProcessBuilder pb = new ProcessBuilder(command);

        if (task.runtimeRef() != null && !task.runtimeRef().isBlank()) {
            ResolvedRuntime runtime = runtimeResolver.resolve(task.runtimeRef());
            Map<String, String> env = pb.environment();
            String pathKey = pathVariable(env);
            String current = env.get(pathKey);
            String binDir = runtime.binDir().toAbsolutePath().toString();
            env.put(pathKey, current == null || current.isEmpty()
                    ? binDir
                    : binDir + java.io.File.pathSeparator + current);
            if (runtime.workingDir() != null) {
                pb.directory(runtime.workingDir().toFile());
            }
        }
        return pb;
    }

    private static String pathVariable(Map<String, String> env) {
        // Windows environments may spell it "Path"
        for (String key : env.keySet()) {
            if (key.equalsIgnoreCase("PATH")) {
                return key;
            }
        }
        return "PATH";
    }

    private Void pump(String executionId, InputStream in, LogStream stream) throws IOException {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, charset))) {
            String line;
            while ((line = reader.readLine()) != null) {
                logPipeline.append(LogLine.captured(executionId, stream, line, clock.instant()));
            }
        }
        return null;
    }

    /**
     * Wait for both pumps after process exit. Output held open by leftover grandchildren is abandoned after the
     * drain timeout.
     *
     * @return the first pump failure, or null
     */
    private Throwable drain(SlotToken token, Process process, Future<?> stdout, Future<?> stderr)
            throws InterruptedException {
        String executionId = token.executionId();
        long deadline = System.nanoTime() + props.getOutputDrainTimeout().toNanos();
        Throwable failure = null;
        boolean abandoned = false;
        for (Future<?> pump : List.of(stdout, stderr)) {
            try {
                pump.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                abandoned = true;
            } catch (ExecutionException e) {
                if (failure == null && !token.isCancelRequested()) {
                    failure = e.getCause();
                }
            }
        }
        if (abandoned) {
            log.warn("Execution id={} output still open {} after exit; closing streams", executionId,
                    props.getOutputDrainTimeout());
            closeQuietly(process.getInputStream());
            closeQuietly(process.getErrorStream());
            stdout.cancel(true);
            stderr.cancel(true);
        }
        return failure;
    }

    private void finish(ExecutionHandle handle, UnaryOperator<Execution> toTerminal) {
        if (!handle.claimFinish()) {
            return;
        }
        Execution terminal = handle.current();
        try {
            terminal = handle.update(toTerminal);
            save(terminal);
            log.debug("Execution finished id={} task={} state={} reason={}", terminal.id(), terminal.taskId(),
                    terminal.state(), terminal.errorMessage());
        } catch (RuntimeException e) {
            log.error("Execution finalization failed id={} msg={}", handle.executionId(), e.getMessage(), e);
        } finally {
            registry.release(handle.token());
            logPipeline.complete(handle.executionId());
            handles.remove(handle.executionId(), handle);
            handle.complete(terminal);
        }
    }

    private void save(Execution execution) {
        try {
            executionStore.save(execution);
        } catch (RuntimeException e) {
            log.error("Saving execution failed id={} state={} msg={}", execution.id(), execution.state(),
                    e.getMessage(), e);
        }
    }

    private static Optional<Execution> awaitQuietly(ExecutionHandle handle, Duration timeout) {
        try {
            return handle.await(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    private static void destroyTree(Process process, boolean forcibly) {
        // collect descendants first: once the parent dies they are reparented and no longer reachable
        List<ProcessHandle> descendants = process.descendants().toList();
        for (ProcessHandle child : descendants) {
            if (forcibly) {
                child.destroyForcibly();
            } else {
                child.destroy();
            }
        }
        if (forcibly) {
            process.destroyForcibly();
        } else {
            process.destroy();
        }
    }

    private static Integer exitCodeOf(Process process) {
        if (process == null || process.isAlive()) {
            return null;
        }
        return process.exitValue();
    }

    private static void closeQuietly(InputStream in) {
        try {
            in.close();
        } catch (IOException e) {
            log.debug("closing process stream failed msg={}", e.getMessage());
        }
    }

    private static ThreadFactory daemonThreads(String name) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName(name + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
