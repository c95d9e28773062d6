package io.taskrunner4j.core;

import java.util.List;

/**
 * A task definition was rejected before any scheduler state was touched.
 */
public class TaskValidationException extends IllegalArgumentException {

    private final List<String> violations;

    public TaskValidationException(List<String> violations) {
        super("Invalid task definition: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}
