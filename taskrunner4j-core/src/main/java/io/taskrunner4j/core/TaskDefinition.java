package io.taskrunner4j.core;

/**
 * Immutable task definition produced by {@code TaskBuilder.build()} and accepted by
 * {@code TaskEngine.createTask/updateTask}. Pure data; validation happens in the engine.
 */
public record TaskDefinition(

        // identity
        String name,
        String description,

        // what to run
        String command,
        String runtimeRef,

        // when to run
        ScheduleSpec schedule,
        int maxInstances,
        boolean active
) {
}
