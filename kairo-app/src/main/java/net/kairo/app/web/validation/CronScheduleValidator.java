package net.kairo.app.web.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import net.kairo.core.cron.CronExpression;

public class CronScheduleValidator implements ConstraintValidator<CronSchedule, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || CronExpression.isValid(value);
    }
}
