package com.sandy.aiot.automation.engine.service;

import com.sandy.aiot.automation.engine.exception.ConfigurationException;
import com.sandy.aiot.automation.engine.model.ScheduleType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TimeTriggerCalculatorTest {

    private final TimeTriggerCalculator calculator = new TimeTriggerCalculator(ZoneOffset.UTC);

    // 2024-03-04 is a Monday
    private static final Instant MONDAY_0905 = Instant.parse("2024-03-04T09:05:00Z");

    @Test
    void weeklyOnSameDayAfterTimeMovesOneWeekAhead() {
        Optional<Instant> next = calculator.computeNextRun(ScheduleType.WEEKLY, Map.of("day", "monday", "time", "09:00"), MONDAY_0905);
        assertEquals(Optional.of(Instant.parse("2024-03-11T09:00:00Z")), next);
    }

    @Test
    void weeklyOnSameDayBeforeTimeFiresToday() {
        Optional<Instant> next = calculator.computeNextRun(ScheduleType.WEEKLY, Map.of("day", "Monday", "time", "10:30"), MONDAY_0905);
        assertEquals(Optional.of(Instant.parse("2024-03-04T10:30:00Z")), next);
    }

    @Test
    void weeklyOtherDayPicksNextOccurrence() {
        Optional<Instant> next = calculator.computeNextRun(ScheduleType.WEEKLY, Map.of("day", "sunday", "time", "07:00"), MONDAY_0905);
        assertEquals(Optional.of(Instant.parse("2024-03-10T07:00:00Z")), next);
    }

    @Test
    void dailyPastTimeRollsToTomorrow() {
        assertEquals(Optional.of(Instant.parse("2024-03-05T09:05:00Z")),
                calculator.computeNextRun(ScheduleType.DAILY, Map.of("time", "09:05"), MONDAY_0905));
        assertEquals(Optional.of(Instant.parse("2024-03-04T18:00:00Z")),
                calculator.computeNextRun(ScheduleType.DAILY, Map.of("time", "18:00"), MONDAY_0905));
    }

    @Test
    void dailyDefaultsToMidnight() {
        assertEquals(Optional.of(Instant.parse("2024-03-05T00:00:00Z")),
                calculator.computeNextRun(ScheduleType.DAILY, Map.of(), MONDAY_0905));
    }

    @Test
    void intervalAddsMinutesAndDefaultsToOneHour() {
        assertEquals(Optional.of(MONDAY_0905.plusSeconds(15 * 60)),
                calculator.computeNextRun(ScheduleType.INTERVAL, Map.of("minutes", 15), MONDAY_0905));
        assertEquals(Optional.of(MONDAY_0905.plusSeconds(20 * 60)),
                calculator.computeNextRun(ScheduleType.INTERVAL, Map.of("minutes", "20"), MONDAY_0905));
        assertEquals(Optional.of(MONDAY_0905.plusSeconds(3600)),
                calculator.computeNextRun(ScheduleType.INTERVAL, Map.of(), MONDAY_0905));
    }

    @Test
    void onceIsEmptyWhenNotStrictlyInFuture() {
        assertEquals(Optional.of(Instant.parse("2024-03-04T12:00:00Z")),
                calculator.computeNextRun(ScheduleType.ONCE, Map.of("datetime", "2024-03-04T12:00:00"), MONDAY_0905));
        assertTrue(calculator.computeNextRun(ScheduleType.ONCE, Map.of("datetime", "2024-03-04T09:05:00Z"), MONDAY_0905).isEmpty());
        assertTrue(calculator.computeNextRun(ScheduleType.ONCE, Map.of("datetime", "2024-03-01 08:00:00"), MONDAY_0905).isEmpty());
    }

    @Test
    void cronUsesFiveFieldsWithSecondsPinnedToZero() {
        assertEquals(Optional.of(Instant.parse("2024-03-04T09:15:00Z")),
                calculator.computeNextRun(ScheduleType.CRON, Map.of("cronExpression", "*/15 * * * *"), MONDAY_0905));
        assertEquals(Optional.of(Instant.parse("2024-03-05T00:00:00Z")),
                calculator.computeNextRun(ScheduleType.CRON, Map.of("cronExpression", "@daily"), MONDAY_0905));
    }

    @Test
    void invalidCronYieldsEmptyAndFailsValidation() {
        Map<String, Object> sixFields = Map.of("cronExpression", "0 */15 * * * *");
        assertTrue(calculator.computeNextRun(ScheduleType.CRON, sixFields, MONDAY_0905).isEmpty());
        assertThrows(ConfigurationException.class, () -> calculator.validate(ScheduleType.CRON, sixFields));
        assertThrows(ConfigurationException.class, () -> calculator.validate(ScheduleType.CRON, Map.of("cronExpression", "61 * * * *")));
    }

    @Test
    void validateRejectsMalformedConfig() {
        assertThrows(ConfigurationException.class, () -> calculator.validate(ScheduleType.DAILY, Map.of("time", "25:99")));
        assertThrows(ConfigurationException.class, () -> calculator.validate(ScheduleType.WEEKLY, Map.of("day", "someday")));
        assertThrows(ConfigurationException.class, () -> calculator.validate(ScheduleType.INTERVAL, Map.of("minutes", 0)));
        assertThrows(ConfigurationException.class, () -> calculator.validate(ScheduleType.ONCE, Map.of()));
        assertDoesNotThrow(() -> calculator.validate(ScheduleType.WEEKLY, Map.of("day", "friday", "time", "7:30")));
    }

    @Test
    void intervalBeyondTheCalendarIsRejected() {
        Map<String, Object> huge = Map.of("minutes", 1_000_000_000_000_000_000L);
        assertThrows(ConfigurationException.class, () -> calculator.validate(ScheduleType.INTERVAL, huge));
        assertEquals(Optional.empty(), calculator.computeNextRun(ScheduleType.INTERVAL, huge, MONDAY_0905));

        long limit = TimeTriggerCalculator.MAX_INTERVAL_MINUTES;
        calculator.validate(ScheduleType.INTERVAL, Map.of("minutes", limit));
        assertEquals(Optional.of(MONDAY_0905.plus(Duration.ofMinutes(limit))),
                calculator.computeNextRun(ScheduleType.INTERVAL, Map.of("minutes", limit), MONDAY_0905));
    }
}
