package net.kairo.core.cron;

import net.kairo.core.error.InvalidScheduleExpressionException;
import net.kairo.core.error.UnsatisfiableScheduleException;
import net.kairo.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * cron-utils evaluation in a fixed zone, with a bounded LRU of parsed expressions.
 */
public final class CronEvaluator implements CronCalculator {
    private static final int CACHE_SIZE = 256;

    private final ZoneId zone;
    private final Map<String, CronExpression> cache = new LruMap<>(CACHE_SIZE);

    public CronEvaluator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public static CronEvaluator utc() {
        return new CronEvaluator(ZoneId.of("UTC"));
    }

    public ZoneId zone() {
        return zone;
    }

    /** Never throws. */
    public boolean validate(String expression) {
        if (expression == null) return false;
        try {
            parse(expression);
            return true;
        } catch (InvalidScheduleExpressionException e) {
            return false;
        }
    }

    /** False for malformed expressions. */
    public boolean matches(String expression, Instant at) {
        return matches(expression, at, zone);
    }

    /**
     * @throws InvalidScheduleExpressionException for malformed expressions
     * @throws UnsatisfiableScheduleException     for expressions that never fire
     */
    public Instant nextOccurrence(String expression, Instant after) {
        return next(after, expression, zone);
    }

    public CronExpression parse(String expression) {
        if (expression == null) {
            throw new InvalidScheduleExpressionException(null, "expression is empty");
        }
        synchronized (cache) {
            CronExpression cached = cache.get(expression);
            if (cached != null) return cached;
        }
        CronExpression parsed = CronExpression.parse(expression);
        synchronized (cache) {
            cache.put(expression, parsed);
        }
        return parsed;
    }

    public void invalidateAll() {
        synchronized (cache) {
            cache.clear();
        }
    }

    @Override
    public boolean isValid(String cronExpr) {
        return validate(cronExpr);
    }

    @Override
    public boolean matches(String cronExpr, Instant at, ZoneId zone) {
        if (!validate(cronExpr)) return false;
        return parse(cronExpr).matches(at, zone);
    }

    @Override
    public Instant next(Instant from, String cronExpr, ZoneId zone) {
        Objects.requireNonNull(from, "from");
        return parse(cronExpr).next(from, zone);
    }

    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K, V> eldest) { return size() > max; }
    }
}
