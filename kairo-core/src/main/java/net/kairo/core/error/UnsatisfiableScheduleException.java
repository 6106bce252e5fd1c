package net.kairo.core.error;

import net.kairo.core.model.ErrorKind;

/** A well-formed cron expression that never fires, e.g. {@code 0 0 30 2 *}. */
public class UnsatisfiableScheduleException extends KairoException {
    private final String expression;

    public UnsatisfiableScheduleException(String expression, String message) {
        super(ErrorKind.UNSATISFIABLE_SCHEDULE, message);
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }
}
