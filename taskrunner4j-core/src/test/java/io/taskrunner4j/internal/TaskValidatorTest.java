package io.taskrunner4j.internal;

import io.taskrunner4j.core.ScheduleSpec;
import io.taskrunner4j.core.TaskDefinition;
import io.taskrunner4j.core.TaskValidationException;
import io.taskrunner4j.spi.ResolvedRuntime;
import io.taskrunner4j.spi.RuntimeResolver;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TaskValidatorTest {

    private final RuntimeResolver resolver = mock(RuntimeResolver.class);
    private final TaskValidator validator = new TaskValidator(resolver);

    @Test
    void knownRuntimeShouldPass() {
        when(resolver.resolve("py311")).thenReturn(new ResolvedRuntime(Path.of("/opt/py311/bin"), null));

        assertThatCode(() -> validator.validate(definition("py311"))).doesNotThrowAnyException();
        verify(resolver).resolve("py311");
    }

    @Test
    void unresolvableRuntimeShouldBeReportedAsViolation() {
        when(resolver.resolve("node18")).thenThrow(new IllegalArgumentException("unknown runtime: node18"));

        assertThatThrownBy(() -> validator.validate(definition("node18")))
                .isInstanceOf(TaskValidationException.class)
                .satisfies(ex -> assertThat(((TaskValidationException) ex).violations()).containsExactly(
                        "runtime cannot be resolved: unknown runtime: node18"));
    }

    @Test
    void tasksWithoutRuntimeShouldNotConsultResolver() {
        validator.validate(definition(null));

        verify(resolver, never()).resolve(anyString());
    }

    @Test
    void overlongNameShouldBeRejected() {
        TaskDefinition def = new TaskDefinition("x".repeat(TaskValidator.MAX_NAME_LENGTH + 1), null, "true", null,
                ScheduleSpec.immediate(), 1, true);

        assertThatThrownBy(() -> validator.validate(def))
                .isInstanceOf(TaskValidationException.class)
                .hasMessageContaining("at most 100 characters");
    }

    private static TaskDefinition definition(String runtimeRef) {
        return new TaskDefinition("job", null, "echo hi", runtimeRef, ScheduleSpec.every(Duration.ofSeconds(10)), 1,
                true);
    }
}
