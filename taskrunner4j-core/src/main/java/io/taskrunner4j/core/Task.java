package io.taskrunner4j.core;

import java.time.Instant;

/**
 * A registered task as persisted by the {@code TaskStore}.
 */
public record Task(
        String id,
        String name,
        String description,
        String command,
        String runtimeRef,
        ScheduleSpec schedule,
        int maxInstances,
        boolean active,
        Instant createdAt,
        Instant updatedAt,
        Instant lastFiredAt
) {

    public static Task from(TaskDefinition definition, Instant now) {
        return new Task(
                null,
                definition.name(),
                definition.description(),
                definition.command(),
                definition.runtimeRef(),
                definition.schedule(),
                definition.maxInstances(),
                definition.active(),
                now,
                now,
                null
        );
    }

    public Task withId(String id) {
        return new Task(id, name, description, command, runtimeRef, schedule, maxInstances, active,
                createdAt, updatedAt, lastFiredAt);
    }

    /**
     * Replace the definition while keeping identity, creation time and fire history.
     */
    public Task redefine(TaskDefinition definition, Instant now) {
        return new Task(id, definition.name(), definition.description(), definition.command(),
                definition.runtimeRef(), definition.schedule(), definition.maxInstances(), definition.active(),
                createdAt, now, lastFiredAt);
    }

    public Task withActive(boolean active, Instant now) {
        return new Task(id, name, description, command, runtimeRef, schedule, maxInstances, active,
                createdAt, now, lastFiredAt);
    }

    public Task withLastFiredAt(Instant firedAt) {
        return new Task(id, name, description, command, runtimeRef, schedule, maxInstances, active,
                createdAt, updatedAt, firedAt);
    }
}
