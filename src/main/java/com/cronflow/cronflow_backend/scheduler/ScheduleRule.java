package com.cronflow.cronflow_backend.scheduler;

import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.scheduling.support.PeriodicTrigger;

import java.time.Duration;
import java.time.ZoneId;

/**
 * A recurrence understood by Spring's scheduler: either a cron expression or a fixed-rate period.
 *
 * @param expression     the schedule as configured (verbatim custom cron, or "every N UNIT")
 * @param cronExpression 6-field Spring cron handed to {@link CronTrigger}; null for period rules
 * @param period         fixed-rate interval; null for cron rules
 */
public record ScheduleRule(String expression, String cronExpression, Duration period) {

    static ScheduleRule cron(String expression, String cronExpression) {
        return new ScheduleRule(expression, cronExpression, null);
    }

    static ScheduleRule every(String expression, Duration period) {
        return new ScheduleRule(expression, null, period);
    }

    public boolean isCron() {
        return cronExpression != null;
    }

    public Trigger toTrigger(ZoneId zone) {
        if (isCron()) {
            return new CronTrigger(cronExpression, zone);
        }
        PeriodicTrigger trigger = new PeriodicTrigger(period);
        trigger.setFixedRate(true);
        trigger.setInitialDelay(period);
        return trigger;
    }
}
