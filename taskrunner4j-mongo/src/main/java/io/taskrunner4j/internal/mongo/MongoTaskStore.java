package io.taskrunner4j.internal.mongo;

import io.taskrunner4j.core.ScheduleSpec;
import io.taskrunner4j.core.Task;
import io.taskrunner4j.core.TaskQuery;
import io.taskrunner4j.spi.TaskStore;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * MongoDB persistence for tasks ({@code tasks} collection).
 */
public class MongoTaskStore implements TaskStore {

    private final MongoTemplate mongoTemplate;

    public MongoTaskStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Task save(Task task) {
        Objects.requireNonNull(task, "task must not be null");
        TaskDocument saved = mongoTemplate.save(toDocument(task));
        return task.id() != null ? task : task.withId(saved.getId());
    }

    @Override
    public Optional<Task> findById(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        return Optional.ofNullable(mongoTemplate.findById(taskId, TaskDocument.class)).map(MongoTaskStore::toTask);
    }

    @Override
    public List<Task> findAll() {
        Query q = new Query().with(Sort.by(Sort.Order.asc("createdAt")));
        return toTasks(mongoTemplate.find(q, TaskDocument.class));
    }

    @Override
    public List<Task> findActive() {
        Query q = new Query(Criteria.where("active").is(true)).with(Sort.by(Sort.Order.asc("createdAt")));
        return toTasks(mongoTemplate.find(q, TaskDocument.class));
    }

    @Override
    public List<Task> find(TaskQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        Criteria c = new Criteria();
        if (query.active() != null) {
            c = c.and("active").is(query.active());
        }
        if (query.runtimeRef() != null) {
            c = c.and("runtimeRef").is(query.runtimeRef());
        }
        if (query.search() != null) {
            String pattern = Pattern.quote(query.search());
            c = c.orOperator(
                    Criteria.where("name").regex(pattern, "i"),
                    Criteria.where("description").regex(pattern, "i"),
                    Criteria.where("command").regex(pattern, "i"));
        }
        Query q = new Query(c).with(Sort.by(Sort.Order.desc("updatedAt"), Sort.Order.desc("_id")));
        if (query.offset() > 0) {
            q.skip(query.offset());
        }
        if (query.limit() != Integer.MAX_VALUE) {
            q.limit(query.limit());
        }
        return toTasks(mongoTemplate.find(q, TaskDocument.class));
    }

    @Override
    public void markFired(String taskId, Instant firedAt) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(firedAt, "firedAt must not be null");
        Query q = new Query(Criteria.where("_id").is(taskId));
        mongoTemplate.updateFirst(q, new Update().set("lastFiredAt", firedAt), TaskDocument.class);
    }

    @Override
    public boolean deleteById(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Query q = new Query(Criteria.where("_id").is(taskId));
        return mongoTemplate.remove(q, TaskDocument.class).getDeletedCount() > 0;
    }

    private static List<Task> toTasks(List<TaskDocument> docs) {
        List<Task> tasks = new ArrayList<>(docs.size());
        for (TaskDocument d : docs) {
            tasks.add(toTask(d));
        }
        return tasks;
    }

    static TaskDocument toDocument(Task task) {
        TaskDocument doc = new TaskDocument();
        doc.setId(task.id());
        doc.setName(task.name());
        doc.setDescription(task.description());
        doc.setCommand(task.command());
        doc.setRuntimeRef(task.runtimeRef());
        doc.setMaxInstances(task.maxInstances());
        doc.setActive(task.active());
        doc.setCreatedAt(task.createdAt());
        doc.setUpdatedAt(task.updatedAt());
        doc.setLastFiredAt(task.lastFiredAt());

        ScheduleSpec schedule = task.schedule();
        doc.setScheduleType(schedule.type());
        if (schedule instanceof ScheduleSpec.Interval interval) {
            doc.setInterval(interval.period().toString());
        } else if (schedule instanceof ScheduleSpec.OneTime oneTime) {
            doc.setRunAt(oneTime.at());
        } else if (schedule instanceof ScheduleSpec.Cron cron) {
            doc.setCron(cron.expression());
            doc.setCronZone(cron.zone());
        }
        return doc;
    }

    static Task toTask(TaskDocument doc) {
        return new Task(
                doc.getId(),
                doc.getName(),
                doc.getDescription(),
                doc.getCommand(),
                doc.getRuntimeRef(),
                toSchedule(doc),
                doc.getMaxInstances(),
                doc.isActive(),
                doc.getCreatedAt(),
                doc.getUpdatedAt(),
                doc.getLastFiredAt()
        );
    }

    private static ScheduleSpec toSchedule(TaskDocument doc) {
        if (doc.getScheduleType() == null) {
            throw new IllegalStateException("task " + doc.getId() + " has no scheduleType");
        }
        return switch (doc.getScheduleType()) {
            case IMMEDIATE -> ScheduleSpec.immediate();
            case INTERVAL -> ScheduleSpec.every(Duration.parse(requireField(doc, doc.getInterval(), "interval")));
            case ONE_TIME -> ScheduleSpec.at(requireField(doc, doc.getRunAt(), "runAt"));
            case CRON -> ScheduleSpec.cron(requireField(doc, doc.getCron(), "cron"), doc.getCronZone());
        };
    }

    private static <T> T requireField(TaskDocument doc, T value, String field) {
        if (value == null) {
            throw new IllegalStateException("task " + doc.getId() + " of type " + doc.getScheduleType()
                    + " is missing " + field);
        }
        return value;
    }
}
