package com.siafu;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JobBuilderTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private final JobHandler noop = () -> {
    };

    @Test
    void shouldResolveDelayAgainstClock() {
        Job job = JobBuilder.newJob("report").clock(clock).once("delay:10s").handler(noop).build();

        assertEquals(new Schedule.Once(NOW.plusSeconds(10)), job.getSchedule());
        assertEquals(1L, job.effectiveMaxRuns().orElseThrow());
    }

    @Test
    void shouldTrimNameAndDependencies() {
        Job job = JobBuilder.newJob("  cleanup ")
                .clock(clock)
                .description("Removes stale files")
                .once(ScheduleTime.delay(Duration.ZERO))
                .dependsOn(" fetch ", "index", "fetch")
                .handler(noop)
                .build();

        assertEquals("cleanup", job.getName());
        assertEquals("Removes stale files", job.getDescription());
        assertThat(job.getDependencies()).containsExactly("fetch", "index");
    }

    @Test
    void shouldStartRecurringSeriesOneIntervalFromNow() {
        Job job = JobBuilder.newJob("heartbeat").clock(clock).recurring(RecurringInterval.minutely(5)).handler(noop).build();

        Schedule.Recurring schedule = assertInstanceOf(Schedule.Recurring.class, job.getSchedule());
        assertEquals(NOW.plusSeconds(300), schedule.anchor());
        assertThat(job.effectiveMaxRuns()).isEmpty();
    }

    @Test
    void shouldHonourExplicitStart() {
        Job job = JobBuilder.newJob("cache-cleaner")
                .clock(clock)
                .recurring(RecurringInterval.hourly(6), ScheduleTime.delay(Duration.ofSeconds(10)))
                .repeat(10)
                .handler(noop)
                .build();

        Schedule.Recurring schedule = (Schedule.Recurring) job.getSchedule();
        assertEquals(NOW.plusSeconds(10), schedule.anchor());
        assertEquals(RecurringInterval.hourly(6), schedule.interval());
        assertEquals(10L, job.effectiveMaxRuns().orElseThrow());
    }

    @Test
    void shouldConvertEveryToLargestUnit() {
        Job job = JobBuilder.newJob("sync").clock(clock).every(Duration.ofMinutes(90)).handler(noop).build();

        assertEquals(RecurringInterval.minutely(90), ((Schedule.Recurring) job.getSchedule()).interval());
    }

    @Test
    void shouldCapOneOffKindsAtOneRunEvenWithRepeat() {
        Job job = JobBuilder.newJob("once").clock(clock).once("delay:1s").repeat(5).handler(noop).build();

        assertEquals(1L, job.effectiveMaxRuns().orElseThrow());
        assertEquals(5L, job.getMaxRuns().orElseThrow());
    }

    @Test
    void shouldSampleRandomWindowFromClock() {
        Job job = JobBuilder.newJob("jitter")
                .clock(clock)
                .random(ScheduleTime.parse("delay:10s"), ScheduleTime.parse("delay:20s"))
                .handler(noop)
                .build();

        Schedule.Random random = assertInstanceOf(Schedule.Random.class, job.getSchedule());
        assertEquals(NOW.plusSeconds(10), random.getLower());
        assertEquals(NOW.plusSeconds(20), random.getUpper());
    }

    @Test
    void shouldRejectInvertedRandomWindowImmediately() {
        JobBuilder builder = JobBuilder.newJob("jitter");

        SchedulingException e = assertThrows(SchedulingException.class,
                () -> builder.random(ScheduleTime.parse("delay:20s"), ScheduleTime.parse("delay:10s")));
        assertEquals(ErrorKind.INVALID_RANDOM_RANGE, e.getKind());
    }

    @Test
    void shouldRejectInvalidCronImmediately() {
        SchedulingException e = assertThrows(SchedulingException.class,
                () -> JobBuilder.newJob("broken").cron("every monday"));
        assertEquals(ErrorKind.INVALID_CRON_SYNTAX, e.getKind());
    }

    @Test
    void shouldRequireNameScheduleAndHandler() {
        assertEquals(ErrorKind.INVALID_JOB_NAME, assertThrows(SchedulingException.class,
                () -> JobBuilder.newJob("  ").once("delay:1s").handler(noop).build()).getKind());
        assertEquals(ErrorKind.MISSING_SCHEDULE, assertThrows(SchedulingException.class,
                () -> JobBuilder.newJob("job").handler(noop).build()).getKind());
        assertEquals(ErrorKind.MISSING_HANDLER, assertThrows(SchedulingException.class,
                () -> JobBuilder.newJob("job").once("delay:1s").build()).getKind());
        assertEquals(ErrorKind.INVALID_JOB_NAME, assertThrows(SchedulingException.class,
                () -> JobBuilder.newJob("job").dependsOn("")).getKind());
    }

    @Test
    void shouldAllowOnlyOneSchedule() {
        JobBuilder builder = JobBuilder.newJob("job").once("delay:1s");

        assertThrows(IllegalStateException.class, () -> builder.cron("0 * * * * *"));
    }

    @Test
    void shouldRejectNonPositiveRepeat() {
        assertThrows(IllegalArgumentException.class, () -> JobBuilder.newJob("job").repeat(0));
    }

    @Test
    void shouldKeepRetryPolicyOnJob() {
        Job withRetries = JobBuilder.newJob("job").clock(clock).once("delay:1s").retries(2).handler(noop).build();
        Job withoutRetries = JobBuilder.newJob("job").clock(clock).once("delay:1s").handler(noop).build();

        assertEquals(RetryPolicy.immediate(2), withRetries.getRetryPolicy().orElseThrow());
        assertThat(withoutRetries.getRetryPolicy()).isEmpty();
    }
}
