package io.taskrunner4j.config;

import io.taskrunner4j.internal.mongo.ExecutionDocument;
import io.taskrunner4j.internal.mongo.LogLineDocument;
import io.taskrunner4j.internal.mongo.TaskDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the task engine.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created at application startup unless
 * {@code taskrunner.ensure-indexes-on-startup=true}. In production they are usually managed by migrations or
 * ops scripts.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>idx_task_startTime</b> on {@code task_executions}: { taskId: 1, startTime: -1 }
 *       <br/>Execution history, newest first.</li>
 *   <li><b>idx_state</b> on {@code task_executions}: { state: 1 }
 *       <br/>Startup recovery of unfinished executions.</li>
 *   <li><b>ux_execution_sequence</b> (unique) on {@code task_logs}: { executionId: 1, sequence: 1 }
 *       <br/>Ordered log reads; makes retried log writes idempotent.</li>
 *   <li><b>idx_active</b> on {@code tasks}: { active: 1 }
 *       <br/>Loading active tasks at startup.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.task_executions.createIndex({ taskId: 1, startTime: -1 }, { name: "idx_task_startTime" });
 * db.task_executions.createIndex({ state: 1 }, { name: "idx_state" });
 * db.task_logs.createIndex({ executionId: 1, sequence: 1 }, { name: "ux_execution_sequence", unique: true });
 * db.tasks.createIndex({ active: 1 }, { name: "idx_active" });
 * </pre>
 */
public class TaskRunnerMongoIndexConfig {

    public static final String IDX_TASK_START_TIME = "idx_task_startTime";
    public static final String IDX_STATE = "idx_state";
    public static final String UX_EXECUTION_SEQUENCE = "ux_execution_sequence";
    public static final String IDX_ACTIVE = "idx_active";

    private final MongoTemplate mongoTemplate;

    public TaskRunnerMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Create the required indexes. Safe to call repeatedly.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(ExecutionDocument.class).ensureIndex(taskStartTimeIndex());
        mongoTemplate.indexOps(ExecutionDocument.class).ensureIndex(stateIndex());
        mongoTemplate.indexOps(LogLineDocument.class).ensureIndex(executionSequenceUniqueIndex());
        mongoTemplate.indexOps(TaskDocument.class).ensureIndex(activeIndex());
    }

    public static Index taskStartTimeIndex() {
        return new Index()
                .on("taskId", Sort.Direction.ASC)
                .on("startTime", Sort.Direction.DESC)
                .named(IDX_TASK_START_TIME);
    }

    public static Index stateIndex() {
        return new Index()
                .on("state", Sort.Direction.ASC)
                .named(IDX_STATE);
    }

    public static Index executionSequenceUniqueIndex() {
        return new Index()
                .on("executionId", Sort.Direction.ASC)
                .on("sequence", Sort.Direction.ASC)
                .unique()
                .named(UX_EXECUTION_SEQUENCE);
    }

    public static Index activeIndex() {
        return new Index()
                .on("active", Sort.Direction.ASC)
                .named(IDX_ACTIVE);
    }
}
