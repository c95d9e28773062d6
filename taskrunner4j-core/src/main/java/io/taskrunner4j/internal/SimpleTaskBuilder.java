package io.taskrunner4j.internal;

import io.taskrunner4j.TaskBuilder;
import io.taskrunner4j.core.ScheduleSpec;
import io.taskrunner4j.core.Task;
import io.taskrunner4j.core.TaskDefinition;
import io.taskrunner4j.core.TaskValidationException;
import io.taskrunner4j.utils.HumanDuration;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Default {@link TaskBuilder}. Schedule input is parsed at {@link #build()} so that every problem is reported at
 * once.
 */
public class SimpleTaskBuilder implements TaskBuilder {

    private final String name;
    private final Function<TaskDefinition, Task> persister;

    private String description;
    private String command;
    private String runtimeRef;
    private Supplier<ScheduleSpec> schedule = ScheduleSpec::immediate;
    private int maxInstances = 1;
    private boolean active = true;

    public SimpleTaskBuilder(String name, Function<TaskDefinition, Task> persister) {
        this.name = name;
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
    }

    @Override
    public TaskBuilder command(String command) {
        this.command = command;
        return this;
    }

    @Override
    public TaskBuilder runtime(String runtimeRef) {
        this.runtimeRef = runtimeRef;
        return this;
    }

    @Override
    public TaskBuilder description(String description) {
        this.description = description;
        return this;
    }

    @Override
    public TaskBuilder immediate() {
        this.schedule = ScheduleSpec::immediate;
        return this;
    }

    @Override
    public TaskBuilder every(Duration period) {
        this.schedule = () -> ScheduleSpec.every(period);
        return this;
    }

    @Override
    public TaskBuilder every(String interval) {
        this.schedule = () -> ScheduleSpec.every(HumanDuration.parse(interval));
        return this;
    }

    @Override
    public TaskBuilder at(Instant time) {
        this.schedule = () -> ScheduleSpec.at(time);
        return this;
    }

    @Override
    public TaskBuilder cron(String expression) {
        this.schedule = () -> ScheduleSpec.cron(expression);
        return this;
    }

    @Override
    public TaskBuilder cron(String expression, String zone) {
        this.schedule = () -> ScheduleSpec.cron(expression, zone);
        return this;
    }

    @Override
    public TaskBuilder maxInstances(int maxInstances) {
        this.maxInstances = maxInstances;
        return this;
    }

    @Override
    public TaskBuilder active(boolean active) {
        this.active = active;
        return this;
    }

    @Override
    public TaskDefinition build() {
        List<String> violations = new ArrayList<>();
        ScheduleSpec spec = null;
        try {
            spec = schedule.get();
        } catch (IllegalArgumentException | NullPointerException e) {
            violations.add("invalid schedule: " + e.getMessage());
        }

        TaskDefinition definition = new TaskDefinition(name, description, command, runtimeRef, spec,
                maxInstances, active);
        for (String v : TaskValidator.violations(definition)) {
            if (spec != null || !v.startsWith("schedule")) {
                violations.add(v);
            }
        }
        if (!violations.isEmpty()) {
            throw new TaskValidationException(violations);
        }
        return definition;
    }

    @Override
    public Task save() {
        return persister.apply(build());
    }
}
