package io.taskrunner4j.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutionTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void runningThenCompletedShouldRecordTimesAndExitCode() {
        Execution done = Execution.pending("e1", "t1", T0)
                .running(T0.plusMillis(5))
                .completed(T0.plusSeconds(3), 0);

        assertThat(done.state()).isEqualTo(ExecutionState.COMPLETED);
        assertThat(done.exitCode()).isZero();
        assertThat(done.isTerminal()).isTrue();
        assertThat(done.duration()).isEqualTo(Duration.ofMillis(2995));
    }

    @Test
    void pendingMayFailWithoutRunning() {
        Execution failed = Execution.pending("e1", "t1", T0).failed(T0, null, "failed to start command: nope");

        assertThat(failed.state()).isEqualTo(ExecutionState.FAILED);
        assertThat(failed.errorMessage()).contains("nope");
    }

    @Test
    void terminalStateShouldNotTransitionAgain() {
        Execution done = Execution.pending("e1", "t1", T0).running(T0).completed(T0.plusSeconds(1), 0);

        assertThatThrownBy(() -> done.failed(T0.plusSeconds(2), 1, "late"))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> done.running(T0.plusSeconds(2)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void runningShouldNotGoBackToPending() {
        assertThat(ExecutionState.RUNNING.canTransitionTo(ExecutionState.PENDING)).isFalse();
        assertThat(ExecutionState.RUNNING.canTransitionTo(ExecutionState.TERMINATED)).isTrue();
    }
}
