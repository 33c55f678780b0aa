package com.siafu;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Fluent assembly of a {@link Job}.
 *
 * <pre>{@code
 * Job job = JobBuilder.newJob("cache-cleaner")
 *         .recurring(RecurringInterval.hourly(6), ScheduleTime.delay(Duration.ofSeconds(10)))
 *         .repeat(10)
 *         .handler(cache::clear)
 *         .build();
 * }</pre>
 *
 * Relative times are resolved against the builder's clock when {@link #build()} is called.
 */
public final class JobBuilder {

    private final String name;
    private String description;
    private Clock clock = Clock.systemUTC();
    private Function<Instant, Schedule> scheduleFactory;
    private JobHandler handler;
    private Long maxRuns;
    private final Set<String> dependencies = new LinkedHashSet<>();
    private RetryPolicy retryPolicy;

    private JobBuilder(String name) {
        this.name = name;
    }

    public static JobBuilder newJob(String name) {
        return new JobBuilder(name);
    }

    public JobBuilder description(String description) {
        this.description = description;
        return this;
    }

    public JobBuilder clock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        return this;
    }

    public JobBuilder once(ScheduleTime time) {
        Objects.requireNonNull(time, "time");
        return schedule(now -> new Schedule.Once(time.resolve(now)));
    }

    /**
     * @param time a schedule-time string such as {@code delay:10s} or {@code at:2025-05-05T12:00:00Z}
     */
    public JobBuilder once(String time) {
        return once(ScheduleTime.parse(time));
    }

    /** Recurs on {@code interval}, first firing one interval from now. */
    public JobBuilder recurring(RecurringInterval interval) {
        Objects.requireNonNull(interval, "interval");
        return schedule(now -> new Schedule.Recurring(interval, interval.nextAfter(now)));
    }

    public JobBuilder recurring(RecurringInterval interval, ScheduleTime start) {
        Objects.requireNonNull(interval, "interval");
        if (start == null) {
            return recurring(interval);
        }
        return schedule(now -> new Schedule.Recurring(interval, start.resolve(now)));
    }

    /** Shorthand for a recurring interval expressed as a duration, see {@link RecurringInterval#ofDuration}. */
    public JobBuilder every(Duration interval) {
        return recurring(RecurringInterval.ofDuration(interval));
    }

    public JobBuilder every(Duration interval, ScheduleTime start) {
        return recurring(RecurringInterval.ofDuration(interval), start);
    }

    public JobBuilder cron(String expression) {
        CronExpression parsed = CronExpression.parse(expression);
        return schedule(now -> new Schedule.Cron(parsed));
    }

    public JobBuilder random(ScheduleTime lower, ScheduleTime upper) {
        Objects.requireNonNull(lower, "lower");
        Objects.requireNonNull(upper, "upper");
        if (lower instanceof ScheduleTime.At from && upper instanceof ScheduleTime.At to
                && from.instant().isAfter(to.instant())) {
            throw SchedulingException.invalidRandomRange(from.instant(), to.instant());
        }
        if (lower instanceof ScheduleTime.Delay from && upper instanceof ScheduleTime.Delay to
                && from.duration().compareTo(to.duration()) > 0) {
            throw SchedulingException.invalidRandomRange(from, to);
        }
        return schedule(now -> new Schedule.Random(lower.resolve(now), upper.resolve(now)));
    }

    /** Caps the number of runs. */
    public JobBuilder repeat(long times) {
        if (times < 1) {
            throw new IllegalArgumentException("repeat must be >= 1");
        }
        this.maxRuns = times;
        return this;
    }

    public JobBuilder dependsOn(String... jobNames) {
        Arrays.stream(jobNames)
                .map(dependency -> normalizeName(dependency, "Dependency name"))
                .forEach(dependencies::add);
        return this;
    }

    public JobBuilder retry(RetryPolicy retryPolicy) {
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        return this;
    }

    public JobBuilder retries(int maxRetries) {
        return retry(RetryPolicy.immediate(maxRetries));
    }

    public JobBuilder handler(JobHandler handler) {
        this.handler = handler;
        return this;
    }

    /**
     * @throws SchedulingException with {@link ErrorKind#INVALID_JOB_NAME}, {@link ErrorKind#MISSING_SCHEDULE}
     *                             or {@link ErrorKind#MISSING_HANDLER} when the job is incomplete
     */
    public Job build() {
        String jobName = normalizeName(name, "Job name");
        if (scheduleFactory == null) {
            throw new SchedulingException(ErrorKind.MISSING_SCHEDULE, "Job '" + jobName + "' has no schedule");
        }
        if (handler == null) {
            throw new SchedulingException(ErrorKind.MISSING_HANDLER, "Job '" + jobName + "' has no handler");
        }
        Schedule schedule = scheduleFactory.apply(clock.instant());
        return new Job(jobName, description, schedule, handler, maxRuns, dependencies, retryPolicy);
    }

    private JobBuilder schedule(Function<Instant, Schedule> factory) {
        if (scheduleFactory != null) {
            throw new IllegalStateException("Job '" + name + "' already has a schedule");
        }
        this.scheduleFactory = factory;
        return this;
    }

    private static String normalizeName(String value, String label) {
        if (value == null) {
            throw new SchedulingException(ErrorKind.INVALID_JOB_NAME, label + " must not be null");
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new SchedulingException(ErrorKind.INVALID_JOB_NAME, label + " must not be blank");
        }
        return trimmed;
    }
}
