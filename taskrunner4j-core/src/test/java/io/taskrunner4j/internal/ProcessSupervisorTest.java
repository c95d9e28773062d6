package io.taskrunner4j.internal;

import io.taskrunner4j.config.TaskRunnerProperties;
import io.taskrunner4j.core.Execution;
import io.taskrunner4j.core.ExecutionState;
import io.taskrunner4j.core.LogLine;
import io.taskrunner4j.core.LogQuery;
import io.taskrunner4j.core.LogStream;
import io.taskrunner4j.core.ScheduleSpec;
import io.taskrunner4j.core.Task;
import io.taskrunner4j.spi.ResolvedRuntime;
import io.taskrunner4j.support.InMemoryExecutionStore;
import io.taskrunner4j.support.InMemoryLogStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessSupervisorTest {

    @TempDir
    Path tmp;

    private TaskRunnerProperties props;
    private StaticRuntimeResolver runtimes;
    private ConcurrencyRegistry registry;
    private InMemoryExecutionStore executionStore;
    private InMemoryLogStore logStore;
    private LogPipeline pipeline;
    private ProcessSupervisor supervisor;

    @BeforeEach
    void setUp() throws Exception {
        Path bin = Files.createDirectory(tmp.resolve("bin"));
        Path script = bin.resolve("greet");
        Files.writeString(script, "#!/bin/sh\necho \"hello from $(pwd)\"\n");
        script.toFile().setExecutable(true);
        Path work = Files.createDirectory(tmp.resolve("work"));

        props = new TaskRunnerProperties();
        props.setKillTimeout(Duration.ofSeconds(2));
        registry = new ConcurrencyRegistry();
        executionStore = new InMemoryExecutionStore();
        logStore = new InMemoryLogStore();
        pipeline = new LogPipeline(logStore, 100, 50);
        pipeline.start();
        runtimes = new StaticRuntimeResolver(Map.of(
                "local", new ResolvedRuntime(bin, work),
                "missing-dir", new ResolvedRuntime(bin, tmp.resolve("does-not-exist"))));
        supervisor = newSupervisor(props);
    }

    @AfterEach
    void tearDown() {
        supervisor.shutdown(true, Duration.ofMillis(200));
        pipeline.stop(Duration.ofSeconds(2));
    }

    @Test
    void successfulCommandShouldCompleteAndCaptureBothStreams() throws Exception {
        ExecutionHandle handle = start(task("echo out; echo err 1>&2", null));

        Execution done = handle.await(Duration.ofSeconds(10)).orElseThrow();

        assertThat(done.state()).isEqualTo(ExecutionState.COMPLETED);
        assertThat(done.exitCode()).isZero();
        List<LogLine> lines = pipeline.history(done.id(), LogQuery.all());
        assertThat(lines).extracting(LogLine::text).containsExactlyInAnyOrder("out", "err");
        assertThat(lines).filteredOn(l -> l.stream() == LogStream.STDERR).extracting(LogLine::text)
                .containsExactly("err");
        assertThat(registry.countRunning(done.taskId())).isZero();
    }

    @Test
    void nonZeroExitShouldFailWithExitCodeInMessage() throws Exception {
        ExecutionHandle handle = start(task("exit 7", null));

        Execution done = handle.await(Duration.ofSeconds(10)).orElseThrow();

        assertThat(done.state()).isEqualTo(ExecutionState.FAILED);
        assertThat(done.exitCode()).isEqualTo(7);
        assertThat(done.errorMessage()).contains("7");
        assertThat(executionStore.findById(done.id())).contains(done);
    }

    @Test
    void terminateShouldStopLongRunningProcessWithinGracePeriod() throws Exception {
        ExecutionHandle handle = start(task("sleep 30", null));
        awaitRunning(handle);

        long startedAt = System.nanoTime();
        boolean terminated = supervisor.terminate(handle.executionId(), Duration.ofSeconds(2));
        Duration took = Duration.ofNanos(System.nanoTime() - startedAt);

        assertThat(terminated).isTrue();
        assertThat(took).isLessThan(Duration.ofMillis(2500));
        Execution done = handle.await(Duration.ofSeconds(1)).orElseThrow();
        assertThat(done.state()).isEqualTo(ExecutionState.TERMINATED);
        assertThat(done.errorMessage()).isEqualTo(ProcessSupervisor.TERMINATED_REASON);
        assertThat(registry.countRunning(done.taskId())).isZero();
    }

    @Test
    void processIgnoringGracefulStopShouldBeKilled() throws Exception {
        ExecutionHandle handle = start(task("trap '' TERM; sleep 30", null));
        awaitRunning(handle);

        assertThat(supervisor.terminate(handle.executionId(), Duration.ofMillis(500))).isTrue();

        Execution done = handle.await(Duration.ofSeconds(5)).orElseThrow();
        assertThat(done.state()).isEqualTo(ExecutionState.TERMINATED);
    }

    @Test
    void processSurvivingForcedKillShouldStillEndTerminated() throws Exception {
        TaskRunnerProperties quick = new TaskRunnerProperties();
        quick.setKillTimeout(Duration.ofMillis(200));
        quick.setOutputDrainTimeout(Duration.ofMillis(200));
        UnkillableProcess stubborn = new UnkillableProcess();
        ProcessSupervisor unkillable = new ProcessSupervisor(quick, runtimes, registry, pipeline, executionStore,
                Clock.systemUTC(), builder -> stubborn);
        try {
            ExecutionHandle handle = start(unkillable, task("sleep 30", null));
            awaitRunning(handle);

            long startedAt = System.nanoTime();
            assertThat(unkillable.terminate(handle.executionId(), Duration.ofMillis(200))).isTrue();
            Duration took = Duration.ofNanos(System.nanoTime() - startedAt);

            Execution done = handle.await(Duration.ofSeconds(1)).orElseThrow();
            assertThat(done.state()).isEqualTo(ExecutionState.TERMINATED);
            assertThat(done.exitCode()).isNull();
            assertThat(stubborn.forcedKills).isEqualTo(1);
            assertThat(took).isLessThan(Duration.ofSeconds(2));
            assertThat(registry.countRunning(done.taskId())).isZero();
        } finally {
            stubborn.exit();
            unkillable.shutdown(false, Duration.ZERO);
        }
    }

    @Test
    void outputCaptureCrashShouldFailExecutionAndReleaseSlot() throws Exception {
        LogPipeline broken = mock(LogPipeline.class);
        when(broken.append(any())).thenThrow(new IllegalStateException("log sink unavailable"));
        ProcessSupervisor crashing = new ProcessSupervisor(props, runtimes, registry, broken, executionStore,
                Clock.systemUTC());
        try {
            ExecutionHandle handle = start(crashing, task("echo out", null));

            Execution done = handle.await(Duration.ofSeconds(10)).orElseThrow();

            assertThat(done.state()).isEqualTo(ExecutionState.FAILED);
            assertThat(done.errorMessage()).isEqualTo("output capture failed: log sink unavailable");
            assertThat(registry.countRunning(done.taskId())).isZero();
            verify(broken).complete(done.id());
        } finally {
            crashing.shutdown(true, Duration.ofMillis(200));
        }
    }

    @Test
    void terminateOnFinishedExecutionShouldReturnFalse() throws Exception {
        ExecutionHandle handle = start(task("true", null));
        handle.await(Duration.ofSeconds(10)).orElseThrow();

        assertThat(supervisor.terminate(handle.executionId(), Duration.ofSeconds(1))).isFalse();
        assertThat(supervisor.terminate("unknown", Duration.ofSeconds(1))).isFalse();
    }

    @Test
    void spawnFailureShouldFailWithoutRunning() throws Exception {
        ExecutionHandle handle = start(task("echo never", "missing-dir"));

        Execution done = handle.await(Duration.ofSeconds(10)).orElseThrow();

        assertThat(done.state()).isEqualTo(ExecutionState.FAILED);
        assertThat(done.errorMessage()).startsWith("failed to start command");
        assertThat(executionStore.savedVersions(done.id()))
                .extracting(Execution::state)
                .doesNotContain(ExecutionState.RUNNING);
        assertThat(registry.countRunning(done.taskId())).isZero();
    }

    @Test
    void runtimeShouldPrefixPathAndSetWorkingDirectory() throws Exception {
        ExecutionHandle handle = start(task("greet", "local"));

        Execution done = handle.await(Duration.ofSeconds(10)).orElseThrow();

        assertThat(done.state()).isEqualTo(ExecutionState.COMPLETED);
        assertThat(pipeline.history(done.id(), LogQuery.all()))
                .extracting(LogLine::text)
                .singleElement()
                .asString()
                .startsWith("hello from ")
                .endsWith("work");
    }

    @Test
    void missingShellShouldFailExecution() throws Exception {
        props.setShell(List.of("/definitely/not/a/shell", "-c"));
        supervisor.shutdown(false, Duration.ZERO);
        supervisor = newSupervisor(props);

        Execution done = start(task("echo hi", null)).await(Duration.ofSeconds(10)).orElseThrow();

        assertThat(done.state()).isEqualTo(ExecutionState.FAILED);
        assertThat(done.errorMessage()).contains("failed to start command");
    }

    private ProcessSupervisor newSupervisor(TaskRunnerProperties p) {
        return new ProcessSupervisor(p, runtimes, registry, pipeline, executionStore, Clock.systemUTC());
    }

    private ExecutionHandle start(Task task) {
        return start(supervisor, task);
    }

    private ExecutionHandle start(ProcessSupervisor target, Task task) {
        String executionId = UUID.randomUUID().toString();
        SlotToken token = registry.tryAcquire(task.id(), executionId, task.maxInstances()).orElseThrow();
        Execution pending = Execution.pending(executionId, task.id(), Instant.now());
        executionStore.save(pending);
        return target.start(task, pending, token);
    }

    private static Task task(String command, String runtimeRef) {
        Instant now = Instant.now();
        return new Task(UUID.randomUUID().toString(), "test", null, command, runtimeRef,
                ScheduleSpec.immediate(), 1, true, now, now, null);
    }

    private static void awaitRunning(ExecutionHandle handle) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (handle.current().state() != ExecutionState.RUNNING && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertThat(handle.current().state()).isEqualTo(ExecutionState.RUNNING);
    }

    /**
     * A child that ignores every signal until {@link #exit()} is called.
     */
    private static final class UnkillableProcess extends Process {
        private final CountDownLatch exited = new CountDownLatch(1);
        private volatile int forcedKills;

        void exit() {
            exited.countDown();
        }

        @Override
        public OutputStream getOutputStream() {
            return OutputStream.nullOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return InputStream.nullInputStream();
        }

        @Override
        public InputStream getErrorStream() {
            return InputStream.nullInputStream();
        }

        @Override
        public int waitFor() throws InterruptedException {
            exited.await();
            return 137;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            return exited.await(timeout, unit);
        }

        @Override
        public int exitValue() {
            if (isAlive()) {
                throw new IllegalThreadStateException("process has not exited");
            }
            return 137;
        }

        @Override
        public boolean isAlive() {
            return exited.getCount() > 0;
        }

        @Override
        public void destroy() {
        }

        @Override
        public Process destroyForcibly() {
            forcedKills++;
            return this;
        }

        @Override
        public long pid() {
            return 4242;
        }

        @Override
        public Stream<ProcessHandle> descendants() {
            return Stream.empty();
        }
    }
}
