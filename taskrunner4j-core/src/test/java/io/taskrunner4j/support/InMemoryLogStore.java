package io.taskrunner4j.support;

import io.taskrunner4j.core.LogLine;
import io.taskrunner4j.core.LogQuery;
import io.taskrunner4j.spi.LogStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryLogStore implements LogStore {

    private final Map<String, TreeMap<Long, LogLine>> lines = new ConcurrentHashMap<>();
    private volatile int failuresBeforeSuccess;

    @Override
    public void appendAll(List<LogLine> batch) {
        synchronized (this) {
            if (failuresBeforeSuccess > 0) {
                failuresBeforeSuccess--;
                throw new IllegalStateException("simulated store outage");
            }
        }
        for (LogLine line : batch) {
            TreeMap<Long, LogLine> byExecution = lines.computeIfAbsent(line.executionId(), id -> new TreeMap<>());
            synchronized (byExecution) {
                byExecution.putIfAbsent(line.sequence(), line);
            }
        }
    }

    @Override
    public List<LogLine> find(String executionId, LogQuery query) {
        TreeMap<Long, LogLine> byExecution = lines.get(executionId);
        if (byExecution == null) {
            return List.of();
        }
        List<LogLine> copy;
        synchronized (byExecution) {
            copy = new ArrayList<>(byExecution.values());
        }
        return copy.stream()
                .filter(query::matches)
                .skip(query.offset())
                .limit(query.limit())
                .toList();
    }

    @Override
    public long deleteByExecution(String executionId) {
        TreeMap<Long, LogLine> removed = lines.remove(executionId);
        return removed == null ? 0 : removed.size();
    }

    /**
     * Make the next {@code n} writes fail.
     */
    public void failNextWrites(int n) {
        synchronized (this) {
            this.failuresBeforeSuccess = n;
        }
    }
}
