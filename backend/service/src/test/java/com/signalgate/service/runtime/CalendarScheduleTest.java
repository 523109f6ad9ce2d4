package com.signalgate.service.runtime;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CalendarScheduleTest {
    private final CalendarSchedule mondayMorning = CalendarSchedule.weekly(DayOfWeek.MONDAY, LocalTime.of(9, 0), ZoneOffset.UTC);

    @Test
    void weeklyJobIsDueOncePerIsoWeekAfterItsSlot() {
        Instant wednesday = Instant.parse("2026-10-14T09:00:00Z");
        Instant nextMondayEarly = Instant.parse("2026-10-19T08:59:00Z");
        Instant nextMondaySlot = Instant.parse("2026-10-19T09:00:00Z");

        assertEquals("2026-W42", mondayMorning.periodKey(wednesday));
        assertTrue(mondayMorning.isDue(wednesday, Optional.empty()));
        assertTrue(mondayMorning.isDue(wednesday, Optional.of("2026-W41")));
        assertFalse(mondayMorning.isDue(wednesday, Optional.of("2026-W42")));
        assertFalse(mondayMorning.isDue(nextMondayEarly, Optional.of("2026-W42")));
        assertTrue(mondayMorning.isDue(nextMondaySlot, Optional.of("2026-W42")));
    }

    @Test
    void monthlyDayPastMonthEndFallsOnLastDay() {
        CalendarSchedule endOfMonth = CalendarSchedule.monthly(31, LocalTime.of(10, 0), ZoneOffset.UTC);

        assertEquals("2026-02", endOfMonth.periodKey(Instant.parse("2026-02-10T00:00:00Z")));
        assertEquals(Instant.parse("2026-02-28T10:00:00Z"),
                endOfMonth.slotInPeriod(Instant.parse("2026-02-10T00:00:00Z")).toInstant());
        assertFalse(endOfMonth.isDue(Instant.parse("2026-02-27T23:00:00Z"), Optional.of("2026-01")));
        assertTrue(endOfMonth.isDue(Instant.parse("2026-02-28T10:00:00Z"), Optional.of("2026-01")));
    }

    @Test
    void periodsAndSlotsFollowTheConfiguredZone() {
        ZoneId berlin = ZoneId.of("Europe/Berlin");
        CalendarSchedule schedule = CalendarSchedule.weekly(DayOfWeek.MONDAY, LocalTime.of(9, 0), berlin);
        Instant sundayNightUtc = Instant.parse("2026-10-18T23:30:00Z");

        assertEquals("2026-W43", schedule.periodKey(sundayNightUtc));
        assertEquals(Instant.parse("2026-10-19T07:00:00Z"), schedule.slotInPeriod(sundayNightUtc).toInstant());
        assertFalse(schedule.isDue(sundayNightUtc, Optional.of("2026-W42")));
    }

    @Test
    void requiresExactlyOneDaySelector() {
        assertThrows(IllegalArgumentException.class,
                () -> new CalendarSchedule(DayOfWeek.MONDAY, 1, LocalTime.NOON, ZoneOffset.UTC));
        assertThrows(IllegalArgumentException.class,
                () -> new CalendarSchedule(null, null, LocalTime.NOON, ZoneOffset.UTC));
        assertThrows(IllegalArgumentException.class,
                () -> CalendarSchedule.monthly(0, LocalTime.NOON, ZoneOffset.UTC));
    }
}
