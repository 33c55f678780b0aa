package com.siafu;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.random.RandomGenerator;

/**
 * When a job fires. The set of kinds is closed: a one-off instant, a recurring interval,
 * a cron expression or a random instant inside a window.
 */
public sealed interface Schedule permits Schedule.Once, Schedule.Recurring, Schedule.Cron, Schedule.Random {

    /**
     * The next instant this schedule wants to run at.
     *
     * @param now      the current instant
     * @param runCount how many occurrences of this schedule have already run
     * @return the next run, or empty when the schedule will never fire again
     */
    Optional<Instant> nextRun(Instant now, long runCount);

    /**
     * The repetition cap implied by the kind itself: 1 for one-off kinds, unbounded otherwise.
     */
    default Optional<Long> impliedMaxRuns() {
        return Optional.empty();
    }

    static Schedule once(Instant instant) {
        return new Once(instant);
    }

    static Schedule recurring(RecurringInterval interval, Instant anchor) {
        return new Recurring(interval, anchor);
    }

    static Schedule cron(String expression) {
        return new Cron(CronExpression.parse(expression));
    }

    static Schedule random(Instant lower, Instant upper) {
        return new Random(lower, upper);
    }

    record Once(Instant instant) implements Schedule {

        public Once {
            Objects.requireNonNull(instant, "instant");
        }

        @Override
        public Optional<Instant> nextRun(Instant now, long runCount) {
            return runCount == 0 ? Optional.of(instant) : Optional.empty();
        }

        @Override
        public Optional<Long> impliedMaxRuns() {
            return Optional.of(1L);
        }
    }

    /**
     * Fires at {@code anchor} (or the first instant after it satisfying the interval's calendar
     * rule) and then once per interval, always aligned to the anchor. When polls fall behind,
     * the missed occurrences are coalesced into one.
     */
    record Recurring(RecurringInterval interval, Instant anchor) implements Schedule {

        public Recurring {
            Objects.requireNonNull(interval, "interval");
            Objects.requireNonNull(anchor, "anchor");
        }

        @Override
        public Optional<Instant> nextRun(Instant now, long runCount) {
            if (runCount == 0) {
                return Optional.of(interval.firstAtOrAfter(anchor));
            }
            return Optional.of(interval.nextAfter(anchor, now));
        }
    }

    record Cron(CronExpression expression) implements Schedule {

        public Cron {
            Objects.requireNonNull(expression, "expression");
        }

        @Override
        public Optional<Instant> nextRun(Instant now, long runCount) {
            return Optional.of(expression.nextAfter(now));
        }
    }

    /**
     * Fires once at an instant sampled uniformly from {@code [lower, upper]}. The sample is
     * drawn the first time it is needed and kept from then on.
     */
    final class Random implements Schedule {

        private final Instant lower;
        private final Instant upper;
        private final RandomGenerator generator;
        private Instant sample;

        public Random(Instant lower, Instant upper) {
            this(lower, upper, RandomGenerator.getDefault());
        }

        public Random(Instant lower, Instant upper, RandomGenerator generator) {
            Objects.requireNonNull(lower, "lower");
            Objects.requireNonNull(upper, "upper");
            if (lower.isAfter(upper)) {
                throw SchedulingException.invalidRandomRange(lower, upper);
            }
            this.lower = lower;
            this.upper = upper;
            this.generator = Objects.requireNonNull(generator, "generator");
        }

        @Override
        public Optional<Instant> nextRun(Instant now, long runCount) {
            if (runCount > 0) {
                return Optional.empty();
            }
            return Optional.of(sample());
        }

        @Override
        public Optional<Long> impliedMaxRuns() {
            return Optional.of(1L);
        }

        public Instant getLower() {
            return lower;
        }

        public Instant getUpper() {
            return upper;
        }

        synchronized Instant sample() {
            if (sample == null) {
                long spanMillis = Duration.between(lower, upper).toMillis();
                sample = spanMillis == 0 ? lower : lower.plusMillis(generator.nextLong(spanMillis + 1));
                if (sample.isAfter(upper)) {
                    sample = upper;
                }
            }
            return sample;
        }

        @Override
        public String toString() {
            return "Random[lower=" + lower + ", upper=" + upper + "]";
        }
    }
}
