package net.kairo.app.web.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/** A well-formed five-field cron expression or nickname. {@code null} is valid. */
@Documented
@Constraint(validatedBy = CronScheduleValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER, ElementType.RECORD_COMPONENT})
@Retention(RetentionPolicy.RUNTIME)
public @interface CronSchedule {
    String message() default "must be a valid cron expression";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
