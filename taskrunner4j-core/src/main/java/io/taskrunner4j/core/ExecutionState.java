package io.taskrunner4j.core;

/**
 * Lifecycle of one execution: {@code PENDING -> RUNNING -> COMPLETED | FAILED | TERMINATED}.
 * A spawn failure goes straight from PENDING to FAILED.
 */
public enum ExecutionState {
    PENDING {
        @Override
        public boolean canTransitionTo(ExecutionState next) {
            return next != PENDING;
        }
    },
    RUNNING {
        @Override
        public boolean canTransitionTo(ExecutionState next) {
            return next.isTerminal();
        }
    },
    COMPLETED,
    FAILED,
    TERMINATED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TERMINATED;
    }

    public boolean canTransitionTo(ExecutionState next) {
        return false;
    }
}
