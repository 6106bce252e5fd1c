package net.kairo.core.cron;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import net.kairo.core.error.InvalidScheduleExpressionException;
import net.kairo.core.error.UnsatisfiableScheduleException;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed five-field UNIX cron expression backed by cron-utils.
 *
 * <p>The {@code @yearly}, {@code @monthly}, {@code @weekly}, {@code @daily} and
 * {@code @hourly} nicknames are expanded before parsing. When both day-of-month and
 * day-of-week are restricted, a day matches if it satisfies either of them.
 */
public final class CronExpression {

    /** Upper bound of the forward search. Covers the 8-year leap day gap around 2100. */
    static final int SEARCH_YEARS = 9;

    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private static final Map<String, String> NICKNAMES = Map.of(
            "@yearly", "0 0 1 1 *",
            "@annually", "0 0 1 1 *",
            "@monthly", "0 0 1 * *",
            "@weekly", "0 0 * * 0",
            "@daily", "0 0 * * *",
            "@midnight", "0 0 * * *",
            "@hourly", "0 * * * *"
    );

    private final String expression;
    private final ExecutionTime executionTime;

    private CronExpression(String expression, Cron cron) {
        this.expression = expression;
        this.executionTime = ExecutionTime.forCron(cron);
    }

    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleExpressionException(expression, "expression is empty");
        }
        String trimmed = expression.trim();
        String expanded = trimmed.startsWith("@")
                ? NICKNAMES.get(trimmed.toLowerCase(Locale.ROOT))
                : trimmed.replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
        if (expanded == null) {
            throw new InvalidScheduleExpressionException(expression, "unknown nickname " + trimmed);
        }
        try {
            return new CronExpression(expression, PARSER.parse(expanded).validate());
        } catch (RuntimeException e) {
            throw new InvalidScheduleExpressionException(expression, e.getMessage());
        }
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (InvalidScheduleExpressionException e) {
            return false;
        }
    }

    public String expression() {
        return expression;
    }

    /** Seconds and below are ignored. */
    public boolean matches(Instant at, ZoneId zone) {
        ZonedDateTime minute = at.atZone(zone).truncatedTo(ChronoUnit.MINUTES);
        return executionTime.nextExecution(minute.minusMinutes(1))
                .map(t -> t.toInstant().equals(minute.toInstant()))
                .orElse(false);
    }

    /**
     * @throws UnsatisfiableScheduleException if nothing matches within {@value #SEARCH_YEARS} years
     */
    public Instant next(Instant after, ZoneId zone) {
        return nextAfter(after.atZone(zone)).toInstant();
    }

    public ZonedDateTime nextAfter(ZonedDateTime after) {
        Objects.requireNonNull(after, "after");
        ZonedDateTime limit = after.plusYears(SEARCH_YEARS);
        Optional<ZonedDateTime> next = executionTime.nextExecution(after);
        if (next.isEmpty() || next.get().isAfter(limit)) {
            throw new UnsatisfiableScheduleException(expression,
                    "No match for [" + expression + "] within " + SEARCH_YEARS + " years after " + after);
        }
        return next.get();
    }

    @Override
    public String toString() {
        return "CronExpression[" + expression + "]";
    }
}
