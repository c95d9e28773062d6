package io.taskrunner4j.internal.mongo;

import io.taskrunner4j.core.LogLine;
import io.taskrunner4j.core.LogQuery;
import io.taskrunner4j.spi.LogStore;
import com.mongodb.bulk.BulkWriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * MongoDB persistence for captured output ({@code task_logs} collection).
 *
 * <p>Writes are upserts keyed by {@code (executionId, sequence)}, so a batch retried after a partial failure
 * does not duplicate lines.
 */
public class MongoLogStore implements LogStore {

    private static final Logger log = LoggerFactory.getLogger(MongoLogStore.class);

    private final MongoTemplate mongoTemplate;

    public MongoLogStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public void appendAll(List<LogLine> lines) {
        Objects.requireNonNull(lines, "lines must not be null");
        if (lines.isEmpty()) {
            return;
        }

        BulkOperations ops = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, LogLineDocument.class);
        for (LogLine line : lines) {
            Query q = new Query(Criteria.where("executionId").is(line.executionId())
                    .and("sequence").is(line.sequence()));
            Update u = new Update()
                    .setOnInsert("timestamp", line.timestamp())
                    .setOnInsert("stream", line.stream())
                    .setOnInsert("text", line.text());
            ops.upsert(q, u);
        }
        BulkWriteResult result = ops.execute();
        log.debug("Log batch written lines={} inserted={}", lines.size(), result.getUpserts().size());
    }

    @Override
    public List<LogLine> find(String executionId, LogQuery query) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        Objects.requireNonNull(query, "query must not be null");

        Query q = new Query(buildCriteria(executionId, query)).with(Sort.by(Sort.Order.asc("sequence")));
        if (query.offset() > 0) {
            q.skip(query.offset());
        }
        if (query.limit() != Integer.MAX_VALUE) {
            q.limit(query.limit());
        }

        List<LogLineDocument> docs = mongoTemplate.find(q, LogLineDocument.class);
        List<LogLine> out = new ArrayList<>(docs.size());
        for (LogLineDocument d : docs) {
            out.add(new LogLine(d.getExecutionId(), d.getSequence(), d.getTimestamp(), d.getStream(), d.getText()));
        }
        return out;
    }

    @Override
    public long deleteByExecution(String executionId) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        Query q = new Query(Criteria.where("executionId").is(executionId));
        return mongoTemplate.remove(q, LogLineDocument.class).getDeletedCount();
    }

    private static Criteria buildCriteria(String executionId, LogQuery query) {
        Criteria c = Criteria.where("executionId").is(executionId);
        if (query.afterSequence() > 0) {
            c = c.and("sequence").gt(query.afterSequence());
        }
        if (query.stream() != null) {
            c = c.and("stream").is(query.stream());
        }
        if (query.contains() != null) {
            c = c.and("text").regex(Pattern.quote(query.contains()));
        }
        if (query.from() != null && query.to() != null) {
            c = c.and("timestamp").gte(query.from()).lt(query.to());
        } else if (query.from() != null) {
            c = c.and("timestamp").gte(query.from());
        } else if (query.to() != null) {
            c = c.and("timestamp").lt(query.to());
        }
        return c;
    }
}
