package com.siafu;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A periodic interval such as "every 3 hours", "every 2 weeks on Monday and Wednesday"
 * or "every month on the first Friday".
 *
 * <p>All calendar arithmetic happens in UTC so that series do not drift across
 * daylight-saving transitions. Months are stepped with calendar month increments,
 * never as a fixed number of days.
 *
 * @param unit        the period unit
 * @param multiplier  how many units make up one period, at least 1
 * @param daysOfWeek  weekdays to fire on, only for {@link IntervalUnit#WEEKLY}; empty when unconstrained
 * @param nthWeekday  the weekday of the month to fire on, only for {@link IntervalUnit#MONTHLY}; may be null
 */
public record RecurringInterval(IntervalUnit unit, int multiplier, Set<DayOfWeek> daysOfWeek, NthWeekday nthWeekday) {

    static final ZoneOffset ZONE = ZoneOffset.UTC;

    private static final int MAX_CALENDAR_STEPS = 10_000;

    public RecurringInterval {
        Objects.requireNonNull(unit, "unit");
        if (multiplier < 1) {
            throw SchedulingException.invalidInterval("Interval multiplier must be >= 1 but was " + multiplier);
        }
        daysOfWeek = daysOfWeek == null || daysOfWeek.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(daysOfWeek));
        if (!daysOfWeek.isEmpty() && unit != IntervalUnit.WEEKLY) {
            throw SchedulingException.invalidInterval("Days of week can only constrain a weekly interval");
        }
        if (nthWeekday != null && unit != IntervalUnit.MONTHLY) {
            throw SchedulingException.invalidInterval("An nth-weekday rule can only constrain a monthly interval");
        }
    }

    public static RecurringInterval secondly(int multiplier) {
        return new RecurringInterval(IntervalUnit.SECONDLY, multiplier, null, null);
    }

    public static RecurringInterval minutely(int multiplier) {
        return new RecurringInterval(IntervalUnit.MINUTELY, multiplier, null, null);
    }

    public static RecurringInterval hourly(int multiplier) {
        return new RecurringInterval(IntervalUnit.HOURLY, multiplier, null, null);
    }

    public static RecurringInterval daily(int multiplier) {
        return new RecurringInterval(IntervalUnit.DAILY, multiplier, null, null);
    }

    public static RecurringInterval weekly(int multiplier) {
        return new RecurringInterval(IntervalUnit.WEEKLY, multiplier, null, null);
    }

    public static RecurringInterval monthly(int multiplier) {
        return new RecurringInterval(IntervalUnit.MONTHLY, multiplier, null, null);
    }

    public static RecurringInterval weeklyOn(int multiplier, DayOfWeek first, DayOfWeek... rest) {
        return new RecurringInterval(IntervalUnit.WEEKLY, multiplier, EnumSet.of(first, rest), null);
    }

    /**
     * Every {@code multiplier} months on the {@code ordinal}-th {@code dayOfWeek}.
     *
     * @param ordinal 1 to 5, or -1 for the last such weekday of the month
     */
    public static RecurringInterval monthlyOn(int multiplier, int ordinal, DayOfWeek dayOfWeek) {
        return new RecurringInterval(IntervalUnit.MONTHLY, multiplier, null, new NthWeekday(ordinal, dayOfWeek));
    }

    /**
     * Converts a plain duration to the largest whole unit that divides it: whole days become
     * a daily interval, whole hours an hourly one, and so on down to seconds.
     * Durations with a sub-second part are rejected.
     */
    public static RecurringInterval ofDuration(Duration duration) {
        long seconds = duration.getSeconds();
        if (duration.getNano() != 0) {
            throw SchedulingException.invalidInterval("Interval duration must be a whole number of seconds: " + duration);
        }
        if (seconds <= 0) {
            throw SchedulingException.invalidInterval("Interval duration must be at least one second: " + duration);
        }
        if (seconds % 86_400 == 0) {
            return daily(Math.toIntExact(seconds / 86_400));
        }
        if (seconds % 3_600 == 0) {
            return hourly(Math.toIntExact(seconds / 3_600));
        }
        if (seconds % 60 == 0) {
            return minutely(Math.toIntExact(seconds / 60));
        }
        return secondly(Math.toIntExact(seconds));
    }

    /**
     * A named interval: {@code daily}, {@code weekly} and {@code monthly} map to one unit of
     * that kind; any other expression means every {@code frequency} days.
     */
    public static RecurringInterval custom(String expression, int frequency) {
        String normalized = expression == null ? "" : expression.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "daily" -> daily(1);
            case "weekly" -> weekly(1);
            case "monthly" -> monthly(1);
            default -> daily(frequency);
        };
    }

    public boolean hasCalendarRule() {
        return !daysOfWeek.isEmpty() || nthWeekday != null;
    }

    /**
     * The next occurrence after {@code previous}. The result is always strictly later than
     * its input; constrained intervals keep the time of day of {@code previous}.
     */
    public Instant nextAfter(Instant previous) {
        if (!daysOfWeek.isEmpty()) {
            return nextWeekday(previous);
        }
        if (nthWeekday != null) {
            return nextNthWeekday(previous);
        }
        if (unit == IntervalUnit.MONTHLY) {
            return previous.atOffset(ZONE).plusMonths(multiplier).toInstant();
        }
        return previous.plus(unit.fixedLength().multipliedBy(multiplier));
    }

    /**
     * The first occurrence of a series anchored at {@code anchor}: the anchor itself when it
     * satisfies the calendar rule (or there is none), otherwise the next matching date at the
     * anchor's time of day.
     */
    public Instant firstAtOrAfter(Instant anchor) {
        LocalDate date = LocalDate.ofInstant(anchor, ZONE);
        if (!daysOfWeek.isEmpty() && !daysOfWeek.contains(date.getDayOfWeek())) {
            return nextAfter(anchor);
        }
        if (nthWeekday != null && !nthWeekday.in(YearMonth.from(date)).map(date::equals).orElse(false)) {
            return nextAfter(anchor);
        }
        return anchor;
    }

    /**
     * The first occurrence of the series anchored at {@code anchor} that lies strictly after
     * {@code now}. Occurrences missed in between are skipped, so a scheduler that slept through
     * several periods fires once and then resumes the original cadence.
     */
    public Instant nextAfter(Instant anchor, Instant now) {
        Instant first = firstAtOrAfter(anchor);
        if (first.isAfter(now)) {
            return first;
        }
        if (!hasCalendarRule() && unit.isFixedLength()) {
            Duration step = unit.fixedLength().multipliedBy(multiplier);
            long elapsedSteps = Duration.between(first, now).dividedBy(step);
            return first.plus(step.multipliedBy(elapsedSteps + 1));
        }
        if (!hasCalendarRule()) {
            LocalDateTime start = LocalDateTime.ofInstant(first, ZONE);
            long period = Math.max(0, ChronoUnit.MONTHS.between(start, LocalDateTime.ofInstant(now, ZONE)) / multiplier - 1);
            Instant candidate = start.plusMonths(period * multiplier).toInstant(ZONE);
            while (!candidate.isAfter(now)) {
                period++;
                candidate = start.plusMonths(period * multiplier).toInstant(ZONE);
            }
            return candidate;
        }
        Instant candidate = first;
        while (!candidate.isAfter(now)) {
            candidate = nextAfter(candidate);
        }
        return candidate;
    }

    private Instant nextWeekday(Instant previous) {
        LocalDateTime current = LocalDateTime.ofInstant(previous, ZONE);
        LocalDate date = current.toLocalDate();
        LocalTime time = current.toLocalTime();
        LocalDate weekStart = date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));

        for (DayOfWeek day : daysOfWeek) {
            LocalDate candidate = weekStart.with(TemporalAdjusters.nextOrSame(day));
            if (candidate.isAfter(date)) {
                return candidate.atTime(time).toInstant(ZONE);
            }
        }
        DayOfWeek firstDay = daysOfWeek.iterator().next();
        LocalDate nextWeek = weekStart.plusWeeks(multiplier);
        return nextWeek.with(TemporalAdjusters.nextOrSame(firstDay)).atTime(time).toInstant(ZONE);
    }

    private Instant nextNthWeekday(Instant previous) {
        LocalDateTime current = LocalDateTime.ofInstant(previous, ZONE);
        LocalDate date = current.toLocalDate();
        LocalTime time = current.toLocalTime();
        YearMonth month = YearMonth.from(date);

        Optional<LocalDate> sameMonth = nthWeekday.in(month).filter(candidate -> candidate.isAfter(date));
        if (sameMonth.isPresent()) {
            return sameMonth.get().atTime(time).toInstant(ZONE);
        }
        for (int i = 1; i <= MAX_CALENDAR_STEPS; i++) {
            Optional<LocalDate> candidate = nthWeekday.in(month.plusMonths((long) i * multiplier));
            if (candidate.isPresent()) {
                return candidate.get().atTime(time).toInstant(ZONE);
            }
        }
        throw SchedulingException.noFutureMatch("No month matches " + this + " after " + previous);
    }

    @Override
    public String toString() {
        String period = multiplier == 1
                ? "every " + unit.displayName()
                : "every " + multiplier + " " + unit.displayName() + "s";
        if (!daysOfWeek.isEmpty()) {
            return period + " on " + daysOfWeek.stream().map(DayOfWeek::toString).collect(Collectors.joining(", "));
        }
        if (nthWeekday != null) {
            return period + " on the " + nthWeekday;
        }
        return period;
    }

    /**
     * The {@code ordinal}-th occurrence of a weekday within a month; ordinal -1 selects the last one.
     */
    public record NthWeekday(int ordinal, DayOfWeek dayOfWeek) {

        public NthWeekday {
            Objects.requireNonNull(dayOfWeek, "dayOfWeek");
            if (ordinal != -1 && (ordinal < 1 || ordinal > 5)) {
                throw SchedulingException.invalidInterval("Weekday ordinal must be 1-5 or -1 (last) but was " + ordinal);
            }
        }

        /** The matching date in {@code month}, empty when the month has no such weekday (a missing fifth one). */
        public Optional<LocalDate> in(YearMonth month) {
            if (ordinal == -1) {
                return Optional.of(month.atEndOfMonth().with(TemporalAdjusters.previousOrSame(dayOfWeek)));
            }
            LocalDate candidate = month.atDay(1).with(TemporalAdjusters.dayOfWeekInMonth(ordinal, dayOfWeek));
            return YearMonth.from(candidate).equals(month) ? Optional.of(candidate) : Optional.empty();
        }

        @Override
        public String toString() {
            String position = switch (ordinal) {
                case 1 -> "first";
                case 2 -> "second";
                case 3 -> "third";
                case 4 -> "fourth";
                case 5 -> "fifth";
                default -> "last";
            };
            return position + " " + dayOfWeek;
        }
    }
}
