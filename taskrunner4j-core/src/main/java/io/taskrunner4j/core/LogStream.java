package io.taskrunner4j.core;

public enum LogStream {
    STDOUT,
    STDERR
}
