package io.taskrunner4j.internal;

import io.taskrunner4j.core.TaskDefinition;
import io.taskrunner4j.core.TaskValidationException;
import io.taskrunner4j.spi.RuntimeResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks a definition before anything is stored or scheduled.
 */
public final class TaskValidator {

    public static final int MAX_NAME_LENGTH = 100;

    private final RuntimeResolver runtimeResolver;

    public TaskValidator(RuntimeResolver runtimeResolver) {
        this.runtimeResolver = Objects.requireNonNull(runtimeResolver, "runtimeResolver must not be null");
    }

    /**
     * @throws TaskValidationException listing every violation
     */
    public void validate(TaskDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        List<String> violations = violations(definition);
        if (definition.runtimeRef() != null && !definition.runtimeRef().isBlank()) {
            try {
                runtimeResolver.resolve(definition.runtimeRef());
            } catch (IllegalArgumentException e) {
                violations.add("runtime cannot be resolved: " + e.getMessage());
            }
        }
        if (!violations.isEmpty()) {
            throw new TaskValidationException(violations);
        }
    }

    /**
     * Checks that need no collaborator.
     */
    static List<String> violations(TaskDefinition definition) {
        List<String> violations = new ArrayList<>();
        if (definition.name() == null || definition.name().isBlank()) {
            violations.add("name must not be blank");
        } else if (definition.name().length() > MAX_NAME_LENGTH) {
            violations.add("name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        if (definition.command() == null || definition.command().isBlank()) {
            violations.add("command must not be blank");
        }
        if (definition.runtimeRef() != null && definition.runtimeRef().isBlank()) {
            violations.add("runtime must not be blank when set");
        }
        if (definition.schedule() == null) {
            violations.add("schedule must not be null");
        }
        if (definition.maxInstances() < 1) {
            violations.add("maxInstances must be at least 1");
        }
        return violations;
    }
}
