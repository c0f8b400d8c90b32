package com.sitemonitor.core.schedule;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleParserTest {
    @Test
    void intervalSpecYieldsExactPeriod() {
        ScheduleSpec spec = ScheduleParser.parse("interval:10");

        IntervalSchedule interval = assertInstanceOf(IntervalSchedule.class, spec);
        assertEquals(Duration.ofSeconds(10), interval.period());
        assertEquals("interval:10", interval.expression());
    }

    @Test
    void cronSpecKeepsFieldsInMinuteHourDomMonthDowOrder() {
        CronSchedule cron = assertInstanceOf(CronSchedule.class, ScheduleParser.parse("  */30 8-18 1,15 * mon-fri "));

        assertEquals("*/30", cron.minuteField());
        assertEquals("8-18", cron.hourField());
        assertEquals("1,15", cron.dayOfMonthField());
        assertEquals("*", cron.monthField());
        assertEquals("mon-fri", cron.dayOfWeekField());
        assertEquals("*/30 8-18 1,15 * mon-fri", cron.expression());
    }

    @Test
    void wrongCronFieldCountIsRejected() {
        ScheduleParseException four = assertThrows(ScheduleParseException.class, () -> ScheduleParser.parse("* * * *"));
        ScheduleParseException six = assertThrows(ScheduleParseException.class, () -> ScheduleParser.parse("0 * * * * *"));

        assertTrue(four.getMessage().contains("expected 5 cron fields but found 4"));
        assertTrue(six.getMessage().contains("found 6"));
        assertEquals("* * * *", four.expression());
    }

    @ParameterizedTest
    @ValueSource(strings = {"interval:", "interval:0", "interval:-5", "interval:abc", "interval:1.5", "interval:99999999999999999999",
            "interval:9999999999999999"})
    void malformedIntervalsAreRejected(String expression) {
        assertThrows(ScheduleParseException.class, () -> ScheduleParser.parse(expression));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "60 * * * *",
            "* 24 * * *",
            "* * 0 * *",
            "* * * 13 *",
            "* * * * 8",
            "5-1 * * * *",
            "*/0 * * * *",
            "1,,2 * * * *",
            "a * * * *",
            "* * * foo *",
            "5/2147483647 * * * *",
            "*/61 * * * *",
            "* */25 * * *"
    })
    void malformedCronFieldsAreRejected(String expression) {
        assertThrows(ScheduleParseException.class, () -> ScheduleParser.parse(expression));
    }

    @Test
    void stepSpanningTheWholeFieldKeepsOnlyTheStart() {
        CronSchedule cron = assertInstanceOf(CronSchedule.class, ScheduleParser.parse("5/60 * * * *"));

        ZonedDateTime next = cron.nextFireAfter(ZonedDateTime.parse("2026-02-12T20:06:00Z")).orElseThrow();

        assertEquals(ZonedDateTime.parse("2026-02-12T21:05:00Z"), next);
    }

    @Test
    void longestConvertibleIntervalIsAccepted() {
        IntervalSchedule interval = assertInstanceOf(IntervalSchedule.class, ScheduleParser.parse("interval:9223372036854775"));
        assertEquals(9223372036854775L, interval.period().getSeconds());
    }

    @Test
    void blankScheduleIsRejected() {
        assertThrows(ScheduleParseException.class, () -> ScheduleParser.parse(" "));
        assertThrows(ScheduleParseException.class, () -> ScheduleParser.parse(null));
    }
}
