package io.taskrunner4j.core;

import java.util.Locale;

/**
 * Filter for task listings. Results are ordered by most recently updated first.
 *
 * @param search     case-insensitive text that must appear in the name, description or command; null for any
 * @param runtimeRef only tasks bound to this runtime; null for any
 * @param active     only active ({@code true}) or paused ({@code false}) tasks; null for both
 * @param offset     number of matching tasks to skip
 * @param limit      max number of tasks to return
 */
public record TaskQuery(String search, String runtimeRef, Boolean active, int offset, int limit) {

    public static final int DEFAULT_PAGE_SIZE = 10;

    public TaskQuery {
        if (search != null && search.isBlank()) {
            search = null;
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
    }

    public static TaskQuery all() {
        return new TaskQuery(null, null, null, 0, Integer.MAX_VALUE);
    }

    public TaskQuery search(String text) {
        return new TaskQuery(text, runtimeRef, active, offset, limit);
    }

    public TaskQuery runtime(String ref) {
        return new TaskQuery(search, ref, active, offset, limit);
    }

    public TaskQuery active(Boolean onlyActive) {
        return new TaskQuery(search, runtimeRef, onlyActive, offset, limit);
    }

    public TaskQuery page(int page, int perPage) {
        if (page < 1) {
            throw new IllegalArgumentException("page starts at 1");
        }
        return new TaskQuery(search, runtimeRef, active, (page - 1) * perPage, perPage);
    }

    public boolean matches(Task task) {
        if (active != null && task.active() != active) {
            return false;
        }
        if (runtimeRef != null && !runtimeRef.equals(task.runtimeRef())) {
            return false;
        }
        if (search == null) {
            return true;
        }
        String needle = search.toLowerCase(Locale.ROOT);
        return contains(task.name(), needle) || contains(task.description(), needle)
                || contains(task.command(), needle);
    }

    private static boolean contains(String field, String needle) {
        return field != null && field.toLowerCase(Locale.ROOT).contains(needle);
    }
}
