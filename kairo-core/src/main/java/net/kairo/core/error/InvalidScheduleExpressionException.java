package net.kairo.core.error;

import net.kairo.core.model.ErrorKind;

public class InvalidScheduleExpressionException extends KairoException {
    private final String expression;

    public InvalidScheduleExpressionException(String expression, String reason) {
        super(ErrorKind.INVALID_SCHEDULE_EXPRESSION, "Invalid cron expression [" + expression + "]: " + reason);
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }
}
