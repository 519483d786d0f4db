package com.cronflow.cronflow_backend.scheduler;

import com.cronflow.cronflow_backend.ScheduleUnit;
import com.cronflow.cronflow_backend.model.domain.Workflow;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.scheduling.support.PeriodicTrigger;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

class ScheduleTranslatorTest {

    private static Workflow workflow(Integer number, ScheduleUnit unit, String custom) {
        Workflow workflow = new Workflow();
        workflow.setScheduleNumber(number);
        workflow.setScheduleUnit(unit);
        workflow.setCustomSchedule(custom);
        return workflow;
    }

    private static List<LocalDateTime> nextFirings(ScheduleRule rule, LocalDateTime from, int count) {
        CronExpression cron = CronExpression.parse(rule.cronExpression());
        List<LocalDateTime> firings = new ArrayList<>();
        LocalDateTime cursor = from;
        for (int i = 0; i < count; i++) {
            cursor = cron.next(cursor);
            firings.add(cursor);
        }
        return firings;
    }

    @Test
    void translate_shouldFireFifteenMinuteScheduleOnQuarterHours() {
        ScheduleRule rule = ScheduleTranslator.translate(workflow(15, ScheduleUnit.MINUTES, null)).orElseThrow();

        Assertions.assertTrue(rule.isCron());
        List<Integer> minutes = nextFirings(rule, LocalDateTime.of(2024, 3, 1, 9, 7, 30), 5).stream()
                .map(LocalDateTime::getMinute)
                .toList();
        Assertions.assertEquals(List.of(15, 30, 45, 0, 15), minutes);
        nextFirings(rule, LocalDateTime.of(2024, 3, 1, 9, 7, 30), 5)
                .forEach(t -> Assertions.assertEquals(0, t.getSecond()));
    }

    @Test
    void translate_shouldMapDivisorsToCronSteps() {
        Assertions.assertEquals("*/10 * * * * *",
                ScheduleTranslator.fromInterval(10, ScheduleUnit.SECONDS).cronExpression());
        Assertions.assertEquals("0 0 */6 * * *",
                ScheduleTranslator.fromInterval(6, ScheduleUnit.HOURS).cronExpression());
        Assertions.assertEquals("0 0 0 * * *",
                ScheduleTranslator.fromInterval(1, ScheduleUnit.DAYS).cronExpression());
        Assertions.assertEquals("0 0 0 * * SUN",
                ScheduleTranslator.fromInterval(7, ScheduleUnit.DAYS).cronExpression());
    }

    @Test
    void translate_shouldFireSixHourScheduleAtFixedHours() {
        ScheduleRule rule = ScheduleTranslator.fromInterval(6, ScheduleUnit.HOURS);

        List<Integer> hours = nextFirings(rule, LocalDateTime.of(2024, 3, 1, 1, 0), 4).stream()
                .map(LocalDateTime::getHour)
                .toList();
        Assertions.assertEquals(List.of(6, 12, 18, 0), hours);
    }

    @Test
    void translate_shouldUseFixedRateWhenNumberDoesNotDivideCycle() {
        ScheduleRule rule = ScheduleTranslator.translate(workflow(7, ScheduleUnit.MINUTES, null)).orElseThrow();

        Assertions.assertFalse(rule.isCron());
        Assertions.assertEquals(Duration.ofMinutes(7), rule.period());

        Trigger trigger = rule.toTrigger(ZoneOffset.UTC);
        PeriodicTrigger periodic = Assertions.assertInstanceOf(PeriodicTrigger.class, trigger);
        Assertions.assertTrue(periodic.isFixedRate());
        Assertions.assertEquals(Duration.ofMinutes(7), periodic.getPeriodDuration());
        Assertions.assertEquals(Duration.ofMinutes(7), periodic.getInitialDelayDuration());
    }

    @Test
    void translate_shouldPreferCustomScheduleVerbatim() {
        ScheduleRule rule = ScheduleTranslator.translate(workflow(15, ScheduleUnit.MINUTES, "0 2 * * *")).orElseThrow();

        Assertions.assertEquals("0 2 * * *", rule.expression());
        Assertions.assertEquals("0 0 2 * * *", rule.cronExpression());
        Assertions.assertInstanceOf(CronTrigger.class, rule.toTrigger(ZoneOffset.UTC));
        LocalDateTime next = CronExpression.parse(rule.cronExpression()).next(LocalDateTime.of(2024, 3, 1, 9, 0));
        Assertions.assertEquals(LocalDateTime.of(2024, 3, 2, 2, 0), next);
    }

    @Test
    void translate_shouldPassSixFieldCustomScheduleThrough() {
        ScheduleRule rule = ScheduleTranslator.translate(workflow(null, null, "30 0 12 * * MON-FRI")).orElseThrow();

        Assertions.assertEquals("30 0 12 * * MON-FRI", rule.cronExpression());
    }

    @Test
    void translate_shouldReturnEmptyWithoutScheduleFields() {
        Assertions.assertEquals(Optional.empty(), ScheduleTranslator.translate(workflow(null, null, null)));
        Assertions.assertEquals(Optional.empty(), ScheduleTranslator.translate(workflow(5, null, "  ")));
    }

    @Test
    void translate_shouldRejectInvalidCron() {
        IllegalArgumentException ex = Assertions.assertThrows(IllegalArgumentException.class,
                () -> ScheduleTranslator.translate(workflow(null, null, "every tuesday")));

        Assertions.assertTrue(ex.getMessage().startsWith("Invalid cron expression 'every tuesday'"));
    }

    @Test
    void translate_shouldRejectNonPositiveNumber() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> ScheduleTranslator.translate(workflow(0, ScheduleUnit.HOURS, null)));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> ScheduleTranslator.fromInterval(-5, ScheduleUnit.SECONDS));
    }
}
