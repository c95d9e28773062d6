package io.taskrunner4j.core;

import java.time.Instant;

/**
 * LogQuery describes which stored lines of one execution to return. Results are ordered by sequence.
 *
 * <p>This is an API-layer object; each {@code LogStore} translates it into its own query.
 */
public final class LogQuery {

    public static final int DEFAULT_LIMIT = 1000;

    private final LogStream stream;
    private final String contains;
    private final Instant from;
    private final Instant to;
    private final long afterSequence;
    private final int offset;
    private final int limit;

    private LogQuery(Builder b) {
        this.stream = b.stream;
        this.contains = (b.contains == null || b.contains.isEmpty()) ? null : b.contains;
        this.from = b.from;
        this.to = b.to;
        this.afterSequence = b.afterSequence;
        this.offset = b.offset;
        this.limit = b.limit;
    }

    public static LogQuery all() {
        return builder().limit(Integer.MAX_VALUE).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Only lines of this stream; null for both.
     */
    public LogStream stream() {
        return stream;
    }

    /**
     * Substring the line text must contain; null for no text filter.
     */
    public String contains() {
        return contains;
    }

    /**
     * Inclusive lower bound on the capture timestamp.
     */
    public Instant from() {
        return from;
    }

    /**
     * Exclusive upper bound on the capture timestamp.
     */
    public Instant to() {
        return to;
    }

    /**
     * Only lines with a sequence strictly greater than this.
     */
    public long afterSequence() {
        return afterSequence;
    }

    public int offset() {
        return offset;
    }

    public int limit() {
        return limit;
    }

    public boolean matches(LogLine line) {
        if (line.sequence() <= afterSequence) {
            return false;
        }
        if (stream != null && line.stream() != stream) {
            return false;
        }
        if (contains != null && !line.text().contains(contains)) {
            return false;
        }
        if (from != null && line.timestamp().isBefore(from)) {
            return false;
        }
        return to == null || line.timestamp().isBefore(to);
    }

    public static final class Builder {
        private LogStream stream;
        private String contains;
        private Instant from;
        private Instant to;
        private long afterSequence;
        private int offset;
        private int limit = DEFAULT_LIMIT;

        public Builder stream(LogStream stream) {
            this.stream = stream;
            return this;
        }

        public Builder contains(String contains) {
            this.contains = contains;
            return this;
        }

        public Builder from(Instant from) {
            this.from = from;
            return this;
        }

        public Builder to(Instant to) {
            this.to = to;
            return this;
        }

        public Builder afterSequence(long afterSequence) {
            this.afterSequence = afterSequence;
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public LogQuery build() {
            if (offset < 0) {
                throw new IllegalArgumentException("offset must not be negative");
            }
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be a positive number");
            }
            if (from != null && to != null && !from.isBefore(to)) {
                throw new IllegalArgumentException("from must be before to");
            }
            return new LogQuery(this);
        }
    }
}
