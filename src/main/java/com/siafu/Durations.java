package com.siafu;

import org.springframework.boot.convert.DurationStyle;

import java.time.Duration;
import java.util.Locale;

/**
 * Human-readable durations such as {@code 10s}, {@code 5m} or {@code 1h 30m}.
 * Terms are summed; each term is a number with one of the units ns, us, ms, s, m, h, d or w.
 * ISO-8601 values ({@code PT90S}) are accepted as well.
 */
final class Durations {

    private Durations() {
    }

    static Duration parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Duration must not be blank");
        }
        Duration total = Duration.ZERO;
        for (String term : text.trim().split("\\s+")) {
            total = total.plus(parseTerm(term));
        }
        if (total.isNegative()) {
            throw new IllegalArgumentException("Duration must not be negative: " + text);
        }
        return total;
    }

    private static Duration parseTerm(String term) {
        String lower = term.toLowerCase(Locale.ROOT);
        if (lower.endsWith("w") && lower.length() > 1) {
            return Duration.ofDays(7 * Long.parseLong(lower.substring(0, lower.length() - 1)));
        }
        return DurationStyle.detectAndParse(term);
    }

    static String format(Duration duration) {
        if (duration.isZero()) {
            return "0s";
        }
        StringBuilder sb = new StringBuilder();
        append(sb, duration.toDays(), "d");
        append(sb, duration.toHoursPart(), "h");
        append(sb, duration.toMinutesPart(), "m");
        append(sb, duration.toSecondsPart(), "s");
        append(sb, duration.toMillisPart(), "ms");
        int remainingNanos = duration.toNanosPart() % 1_000_000;
        append(sb, remainingNanos, "ns");
        return sb.toString();
    }

    private static void append(StringBuilder sb, long amount, String unit) {
        if (amount == 0) {
            return;
        }
        if (sb.length() > 0) {
            sb.append(' ');
        }
        sb.append(amount).append(unit);
    }
}
