package com.siafu;

/**
 * The kind of a {@link SchedulingException}. Every kind is a construction-time error:
 * it is raised by the call that introduced the problem, never later during a poll.
 */
public enum ErrorKind {
    /** A schedule-time string lacks the {@code tag:value} shape. */
    INVALID_FORMAT,
    /** A schedule-time string carries a tag other than {@code delay} or {@code at}. */
    UNKNOWN_TAG,
    INVALID_DURATION,
    INVALID_TIMESTAMP,
    /** A recurring interval with a non-positive multiplier or an inconsistent calendar rule. */
    INVALID_INTERVAL,
    INVALID_CRON_SYNTAX,
    /** A schedule that can never fire again, for example a cron expression bound to a past year. */
    NO_FUTURE_MATCH,
    /** A random window whose lower bound lies after its upper bound. */
    INVALID_RANDOM_RANGE,
    INVALID_JOB_NAME,
    MISSING_HANDLER,
    MISSING_SCHEDULE,
    DUPLICATE_JOB_ID,
    CYCLIC_DEPENDENCY
}
