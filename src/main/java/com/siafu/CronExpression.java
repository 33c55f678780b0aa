package com.siafu;

import com.cronutils.model.Cron;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * A parsed cron expression with seconds granularity:
 * {@code second minute hour day-of-month month day-of-week [year]}.
 *
 * <p>Day-of-week runs from 0 to 7 where 1 is Monday and both 0 and 7 are Sunday, so
 * {@code 1-5} selects Monday to Friday. Besides ranges, lists and steps, the Quartz
 * specials {@code ?}, {@code L}, {@code W} and {@code #} are understood. Expressions are
 * evaluated in UTC.
 */
public final class CronExpression {

    private static final CronDefinition DEFINITION = CronDefinitionBuilder.defineCron()
            .withSeconds().and()
            .withMinutes().and()
            .withHours().and()
            .withDayOfMonth().supportsL().supportsW().supportsLW().supportsQuestionMark().and()
            .withMonth().and()
            .withDayOfWeek().withValidRange(0, 7).withMondayDoWValue(1)
            .supportsHash().supportsL().supportsQuestionMark().withIntMapping(7, 0).and()
            .withYear().withValidRange(1970, 2099).optional().and()
            .instance();

    private static final CronParser PARSER = new CronParser(DEFINITION);

    private final String expression;
    private final ExecutionTime executionTime;

    private CronExpression(String expression, ExecutionTime executionTime) {
        this.expression = expression;
        this.executionTime = executionTime;
    }

    /**
     * @throws SchedulingException with {@link ErrorKind#INVALID_CRON_SYNTAX} when the expression cannot be parsed
     */
    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw SchedulingException.invalidCron(String.valueOf(expression),
                    new IllegalArgumentException("expression must not be blank"));
        }
        String trimmed = expression.trim().replaceAll("\\s+", " ");
        try {
            Cron cron = PARSER.parse(trimmed);
            cron.validate();
            return new CronExpression(trimmed, ExecutionTime.forCron(cron));
        } catch (IllegalArgumentException e) {
            throw SchedulingException.invalidCron(trimmed, e);
        }
    }

    /**
     * The first trigger strictly after {@code instant}.
     *
     * @throws SchedulingException with {@link ErrorKind#NO_FUTURE_MATCH} when the expression never matches again
     */
    public Instant nextAfter(Instant instant) {
        Objects.requireNonNull(instant, "instant");
        ZonedDateTime from = instant.atZone(RecurringInterval.ZONE);
        return executionTime.nextExecution(from)
                .map(ZonedDateTime::toInstant)
                .orElseThrow(() -> SchedulingException.noFutureMatch(
                        "Cron expression '" + expression + "' has no trigger after " + instant));
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CronExpression other)) {
            return false;
        }
        return expression.equals(other.expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }
}
