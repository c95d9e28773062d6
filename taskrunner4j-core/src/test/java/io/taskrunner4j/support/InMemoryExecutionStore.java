package io.taskrunner4j.support;

import io.taskrunner4j.core.Execution;
import io.taskrunner4j.core.ExecutionQuery;
import io.taskrunner4j.spi.ExecutionStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every saved version, so tests can inspect the transitions an execution went through.
 */
public class InMemoryExecutionStore implements ExecutionStore {

    private final Map<String, Execution> executions = new ConcurrentHashMap<>();
    private final List<Execution> saves = new CopyOnWriteArrayList<>();

    @Override
    public void save(Execution execution) {
        executions.put(execution.id(), execution);
        saves.add(execution);
    }

    @Override
    public Optional<Execution> findById(String executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public List<Execution> findByTask(String taskId, ExecutionQuery query) {
        return executions.values().stream()
                .filter(e -> e.taskId().equals(taskId))
                .filter(query::matches)
                .sorted(Comparator.comparing(Execution::startTime).reversed())
                .skip(query.offset())
                .limit(query.limit())
                .toList();
    }

    @Override
    public List<Execution> findUnfinished() {
        return executions.values().stream().filter(e -> !e.isTerminal()).toList();
    }

    @Override
    public List<String> deleteByTask(String taskId) {
        List<String> ids = new ArrayList<>();
        executions.values().removeIf(e -> {
            if (e.taskId().equals(taskId)) {
                ids.add(e.id());
                return true;
            }
            return false;
        });
        return ids;
    }

    public List<Execution> savedVersions(String executionId) {
        return saves.stream().filter(e -> e.id().equals(executionId)).toList();
    }
}
