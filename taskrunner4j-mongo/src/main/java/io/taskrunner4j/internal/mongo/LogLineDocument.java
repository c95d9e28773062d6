package io.taskrunner4j.internal.mongo;

import io.taskrunner4j.core.LogStream;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One captured output line. {@code (executionId, sequence)} is unique.
 */
@Document(collection = "task_logs")
public class LogLineDocument {

    @Id
    private String id;

    private String executionId;
    private long sequence;
    private Instant timestamp;
    private LogStream stream;
    private String text;

    public LogLineDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getExecutionId() {
        return executionId;
    }

    public void setExecutionId(String executionId) {
        this.executionId = executionId;
    }

    public long getSequence() {
        return sequence;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public LogStream getStream() {
        return stream;
    }

    public void setStream(LogStream stream) {
        this.stream = stream;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }
}
