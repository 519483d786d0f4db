package com.cronflow.cronflow_backend.scheduler;

import com.cronflow.cronflow_backend.ScheduleUnit;
import com.cronflow.cronflow_backend.model.domain.Workflow;
import org.springframework.scheduling.support.CronExpression;

import java.time.Duration;
import java.util.Optional;

/**
 * Turns a workflow's schedule fields into a {@link ScheduleRule}.
 *
 * <ul>
 *   <li>{@code customSchedule} wins when present and is used verbatim. Classic 5-field cron
 *       ("0 2 * * *") gets a leading seconds field for Spring; 6-field expressions and macros
 *       such as "@daily" pass through.</li>
 *   <li>{@code scheduleNumber} + {@code scheduleUnit}: when N divides the unit's cycle (60 seconds,
 *       60 minutes, 24 hours, 7 days) the rule is a cron step firing at offsets 0, N, 2N, ...;
 *       otherwise it is a fixed-rate period of N units.</li>
 *   <li>Neither: no rule.</li>
 * </ul>
 */
public final class ScheduleTranslator {

    private ScheduleTranslator() {}

    /**
     * @throws IllegalArgumentException when the cron expression does not parse or N is not positive
     */
    public static Optional<ScheduleRule> translate(Workflow workflow) {
        String custom = workflow.getCustomSchedule();
        if (custom != null && !custom.isBlank()) {
            return Optional.of(fromCron(custom));
        }
        if (workflow.getScheduleNumber() != null && workflow.getScheduleUnit() != null) {
            return Optional.of(fromInterval(workflow.getScheduleNumber(), workflow.getScheduleUnit()));
        }
        return Optional.empty();
    }

    public static ScheduleRule fromCron(String expression) {
        String trimmed = expression.trim();
        String springCron = trimmed.split("\\s+").length == 5 ? "0 " + trimmed : trimmed;
        try {
            CronExpression.parse(springCron);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Invalid cron expression '" + expression + "': " + ex.getMessage(), ex);
        }
        return ScheduleRule.cron(expression, springCron);
    }

    public static ScheduleRule fromInterval(int number, ScheduleUnit unit) {
        if (number <= 0) {
            throw new IllegalArgumentException("Schedule number must be positive, got " + number);
        }
        String expression = "every " + number + " " + unit;
        if (unit.modulus() % number != 0) {
            return ScheduleRule.every(expression, Duration.of(number, unit.chronoUnit()));
        }
        String cron = switch (unit) {
            case SECONDS -> "*/" + number + " * * * * *";
            case MINUTES -> "0 */" + number + " * * * *";
            case HOURS   -> "0 0 */" + number + " * * *";
            // Only 1 and 7 divide a week: daily at midnight, or Sundays at midnight
            case DAYS    -> number == 1 ? "0 0 0 * * *" : "0 0 0 * * SUN";
        };
        return ScheduleRule.cron(expression, cron);
    }
}
