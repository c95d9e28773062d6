package io.taskrunner4j.internal.mongo;

import io.taskrunner4j.core.ScheduleType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Mongo document model for registered tasks. The schedule is flattened: {@code scheduleType} says which of
 * {@code interval}, {@code runAt} or {@code cron}/{@code cronZone} is populated.
 */
@Document(collection = "tasks")
public class TaskDocument {

    @Id
    private String id;

    private String name;
    private String description;
    private String command;
    private String runtimeRef;

    private ScheduleType scheduleType;
    // ISO-8601, e.g. PT5M
    private String interval;
    private Instant runAt;
    private String cron;
    private String cronZone;

    private int maxInstances;
    private boolean active;

    private Instant createdAt;
    private Instant updatedAt;

    @Field(write = Field.Write.ALWAYS)
    private Instant lastFiredAt;

    public TaskDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getCommand() {
        return command;
    }

    public void setCommand(String command) {
        this.command = command;
    }

    public String getRuntimeRef() {
        return runtimeRef;
    }

    public void setRuntimeRef(String runtimeRef) {
        this.runtimeRef = runtimeRef;
    }

    public ScheduleType getScheduleType() {
        return scheduleType;
    }

    public void setScheduleType(ScheduleType scheduleType) {
        this.scheduleType = scheduleType;
    }

    public String getInterval() {
        return interval;
    }

    public void setInterval(String interval) {
        this.interval = interval;
    }

    public Instant getRunAt() {
        return runAt;
    }

    public void setRunAt(Instant runAt) {
        this.runAt = runAt;
    }

    public String getCron() {
        return cron;
    }

    public void setCron(String cron) {
        this.cron = cron;
    }

    public String getCronZone() {
        return cronZone;
    }

    public void setCronZone(String cronZone) {
        this.cronZone = cronZone;
    }

    public int getMaxInstances() {
        return maxInstances;
    }

    public void setMaxInstances(int maxInstances) {
        this.maxInstances = maxInstances;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getLastFiredAt() {
        return lastFiredAt;
    }

    public void setLastFiredAt(Instant lastFiredAt) {
        this.lastFiredAt = lastFiredAt;
    }
}
