package io.taskrunner4j.core;

/**
 * Filter for execution history. Results are ordered newest first.
 *
 * @param state  only executions in this state; null for all
 * @param offset number of matching executions to skip
 * @param limit  max number of executions to return
 */
public record ExecutionQuery(ExecutionState state, int offset, int limit) {

    public static final int DEFAULT_LIMIT = 100;

    public ExecutionQuery {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
    }

    public static ExecutionQuery all() {
        return new ExecutionQuery(null, 0, Integer.MAX_VALUE);
    }

    public static ExecutionQuery latest(int limit) {
        return new ExecutionQuery(null, 0, limit);
    }

    public static ExecutionQuery inState(ExecutionState state) {
        return new ExecutionQuery(state, 0, DEFAULT_LIMIT);
    }

    public ExecutionQuery page(int page, int perPage) {
        if (page < 1) {
            throw new IllegalArgumentException("page starts at 1");
        }
        return new ExecutionQuery(state, (page - 1) * perPage, perPage);
    }

    public boolean matches(Execution execution) {
        return state == null || execution.state() == state;
    }
}
