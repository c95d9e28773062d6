package io.taskrunner4j.core;

public enum ScheduleType {
    IMMEDIATE {
        @Override
        public boolean isRecurring() {
            return false;
        }
    },
    INTERVAL {
        @Override
        public boolean isRecurring() {
            return true;
        }
    },
    ONE_TIME {
        @Override
        public boolean isRecurring() {
            return false;
        }
    },
    CRON {
        @Override
        public boolean isRecurring() {
            return true;
        }
    };

    public abstract boolean isRecurring();
}
