package io.taskrunner4j.internal.mongo;

import io.taskrunner4j.core.Execution;
import io.taskrunner4j.core.ExecutionQuery;
import io.taskrunner4j.core.ExecutionState;
import io.taskrunner4j.spi.ExecutionStore;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence for executions ({@code task_executions} collection).
 */
public class MongoExecutionStore implements ExecutionStore {

    private final MongoTemplate mongoTemplate;

    public MongoExecutionStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public void save(Execution execution) {
        Objects.requireNonNull(execution, "execution must not be null");
        mongoTemplate.save(toDocument(execution));
    }

    @Override
    public Optional<Execution> findById(String executionId) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        return Optional.ofNullable(mongoTemplate.findById(executionId, ExecutionDocument.class))
                .map(MongoExecutionStore::toExecution);
    }

    @Override
    public List<Execution> findByTask(String taskId, ExecutionQuery query) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(query, "query must not be null");

        Criteria c = Criteria.where("taskId").is(taskId);
        if (query.state() != null) {
            c = c.and("state").is(query.state());
        }
        Query q = new Query(c).with(Sort.by(Sort.Order.desc("startTime"), Sort.Order.desc("_id")));
        if (query.offset() > 0) {
            q.skip(query.offset());
        }
        if (query.limit() != Integer.MAX_VALUE) {
            q.limit(query.limit());
        }
        return toExecutions(mongoTemplate.find(q, ExecutionDocument.class));
    }

    @Override
    public List<Execution> findUnfinished() {
        Query q = new Query(Criteria.where("state").in(ExecutionState.PENDING, ExecutionState.RUNNING));
        return toExecutions(mongoTemplate.find(q, ExecutionDocument.class));
    }

    @Override
    public List<String> deleteByTask(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Query q = new Query(Criteria.where("taskId").is(taskId));
        q.fields().include("_id");

        List<String> ids = new ArrayList<>();
        for (ExecutionDocument d : mongoTemplate.find(q, ExecutionDocument.class)) {
            if (d != null && d.getId() != null) {
                ids.add(d.getId());
            }
        }
        if (!ids.isEmpty()) {
            mongoTemplate.remove(new Query(Criteria.where("_id").in(ids)), ExecutionDocument.class);
        }
        return ids;
    }

    private static List<Execution> toExecutions(List<ExecutionDocument> docs) {
        List<Execution> out = new ArrayList<>(docs.size());
        for (ExecutionDocument d : docs) {
            out.add(toExecution(d));
        }
        return out;
    }

    static ExecutionDocument toDocument(Execution execution) {
        ExecutionDocument doc = new ExecutionDocument();
        doc.setId(execution.id());
        doc.setTaskId(execution.taskId());
        doc.setState(execution.state());
        doc.setStartTime(execution.startTime());
        doc.setEndTime(execution.endTime());
        doc.setExitCode(execution.exitCode());
        doc.setErrorMessage(execution.errorMessage());
        return doc;
    }

    static Execution toExecution(ExecutionDocument doc) {
        return new Execution(
                doc.getId(),
                doc.getTaskId(),
                doc.getState(),
                doc.getStartTime(),
                doc.getEndTime(),
                doc.getExitCode(),
                doc.getErrorMessage()
        );
    }
}
