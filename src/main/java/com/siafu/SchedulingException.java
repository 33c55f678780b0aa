package com.siafu;

import java.util.List;

/**
 * Raised synchronously when a job, schedule or schedule-time value cannot be built or
 * registered. Handler failures are never reported through this type; they are captured
 * per job and surfaced in the {@link ExecutionReport}.
 */
public class SchedulingException extends RuntimeException {

    private final ErrorKind kind;

    public SchedulingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SchedulingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    static SchedulingException invalidFormat(String input) {
        return new SchedulingException(ErrorKind.INVALID_FORMAT,
                "Invalid format '" + input + "': expected 'delay:<duration>' or 'at:<timestamp>'");
    }

    static SchedulingException unknownTag(String tag) {
        return new SchedulingException(ErrorKind.UNKNOWN_TAG, "Unknown schedule time tag: '" + tag + "'");
    }

    static SchedulingException invalidDuration(String value, Throwable cause) {
        return new SchedulingException(ErrorKind.INVALID_DURATION, "Failed to parse duration '" + value + "'", cause);
    }

    static SchedulingException invalidTimestamp(String value, Throwable cause) {
        return new SchedulingException(ErrorKind.INVALID_TIMESTAMP, "Failed to parse timestamp '" + value + "'", cause);
    }

    static SchedulingException invalidInterval(String message) {
        return new SchedulingException(ErrorKind.INVALID_INTERVAL, message);
    }

    static SchedulingException invalidCron(String expression, Throwable cause) {
        return new SchedulingException(ErrorKind.INVALID_CRON_SYNTAX,
                "Invalid cron expression '" + expression + "': " + cause.getMessage(), cause);
    }

    static SchedulingException noFutureMatch(String message) {
        return new SchedulingException(ErrorKind.NO_FUTURE_MATCH, message);
    }

    static SchedulingException invalidRandomRange(Object lower, Object upper) {
        return new SchedulingException(ErrorKind.INVALID_RANDOM_RANGE,
                "Random window lower bound " + lower + " lies after upper bound " + upper);
    }

    static SchedulingException duplicateJob(String name) {
        return new SchedulingException(ErrorKind.DUPLICATE_JOB_ID, "A job named '" + name + "' is already registered");
    }

    static SchedulingException cyclicDependency(String name, List<String> cycle) {
        return new SchedulingException(ErrorKind.CYCLIC_DEPENDENCY,
                "Job '" + name + "' introduces a dependency cycle: " + String.join(" -> ", cycle));
    }
}
