package com.siafu;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;

/**
 * When something should happen: either a delay relative to the moment it is resolved,
 * or an absolute instant.
 *
 * <p>The textual form is {@code delay:<duration>} (for example {@code delay:1h 30m})
 * or {@code at:<RFC3339 timestamp>} (for example {@code at:2025-05-05T12:00:00Z}).
 */
public sealed interface ScheduleTime permits ScheduleTime.Delay, ScheduleTime.At {

    /**
     * Resolves this value to a concrete instant.
     *
     * @param now the instant a delay is measured from
     * @return the absolute instant
     */
    Instant resolve(Instant now);

    static ScheduleTime delay(Duration duration) {
        return new Delay(duration);
    }

    static ScheduleTime at(Instant instant) {
        return new At(instant);
    }

    /**
     * Parses the textual form.
     *
     * @throws SchedulingException with {@link ErrorKind#INVALID_FORMAT}, {@link ErrorKind#UNKNOWN_TAG},
     *                             {@link ErrorKind#INVALID_DURATION} or {@link ErrorKind#INVALID_TIMESTAMP}
     */
    static ScheduleTime parse(String text) {
        if (text == null) {
            throw SchedulingException.invalidFormat(null);
        }
        int separator = text.indexOf(':');
        if (separator < 0) {
            throw SchedulingException.invalidFormat(text);
        }
        String tag = text.substring(0, separator).trim().toLowerCase(Locale.ROOT);
        String value = text.substring(separator + 1).trim();
        if (tag.isEmpty()) {
            throw SchedulingException.invalidFormat(text);
        }
        return switch (tag) {
            case "delay" -> parseDelay(value);
            case "at" -> parseAt(value);
            default -> throw SchedulingException.unknownTag(tag);
        };
    }

    private static ScheduleTime parseDelay(String value) {
        try {
            return new Delay(Durations.parse(value));
        } catch (RuntimeException e) {
            throw SchedulingException.invalidDuration(value, e);
        }
    }

    private static ScheduleTime parseAt(String value) {
        try {
            return new At(OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant());
        } catch (DateTimeParseException e) {
            throw SchedulingException.invalidTimestamp(value, e);
        }
    }

    record Delay(Duration duration) implements ScheduleTime {

        public Delay {
            Objects.requireNonNull(duration, "duration");
            if (duration.isNegative()) {
                throw new IllegalArgumentException("Delay must not be negative: " + duration);
            }
        }

        @Override
        public Instant resolve(Instant now) {
            return now.plus(duration);
        }

        @Override
        public String toString() {
            return "delay:" + Durations.format(duration);
        }
    }

    record At(Instant instant) implements ScheduleTime {

        public At {
            Objects.requireNonNull(instant, "instant");
        }

        @Override
        public Instant resolve(Instant now) {
            return instant;
        }

        @Override
        public String toString() {
            return "at:" + DateTimeFormatter.ISO_INSTANT.format(instant);
        }
    }
}
