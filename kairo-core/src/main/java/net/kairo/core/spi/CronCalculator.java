package net.kairo.core.spi;

import java.time.Instant;
import java.time.ZoneId;

public interface CronCalculator {
    boolean isValid(String cronExpr);

    boolean matches(String cronExpr, Instant at, ZoneId zone);

    /** Earliest minute-aligned match strictly after {@code from}. */
    Instant next(Instant from, String cronExpr, ZoneId zone);
}
