package com.signalgate.service;

import com.signalgate.core.model.Tier;
import com.signalgate.service.config.CalendarConfig;
import com.signalgate.service.config.CalendarJobConfig;
import com.signalgate.service.runtime.CalendarJob;
import com.signalgate.service.runtime.DigestKind;
import com.signalgate.service.runtime.RotatingContentProvider;
import com.signalgate.service.support.ServiceHarness;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {
    @Test
    void appEnvSelectsModeAndWarnsOnUnknownValues() {
        List<String> warnings = new ArrayList<>();

        assertTrue(Main.resolveRuntimeFlags(Map.of(), warnings::add).devMode());
        assertFalse(Main.resolveRuntimeFlags(Map.of("APP_ENV", "PROD"), warnings::add).devMode());
        assertTrue(Main.resolveRuntimeFlags(Map.of("APP_ENV", "staging"), warnings::add).devMode());

        assertEquals(List.of("Unknown APP_ENV=staging, defaulting to dev"), warnings);
    }

    @Test
    void buildsOneJobPerEnabledCalendarEntry() throws Exception {
        ServiceHarness harness = new ServiceHarness();
        CalendarConfig calendar = new CalendarConfig("Europe/London", 3, List.of(
                new CalendarJobConfig(null, DigestKind.WEEKLY_DIGEST, DayOfWeek.MONDAY, null, null, null, null),
                new CalendarJobConfig("month-end", DigestKind.MONTHLY_DIGEST, null, 28, LocalTime.of(18, 0), Tier.PREMIUM, null),
                new CalendarJobConfig(null, DigestKind.WEEKLY_QA, DayOfWeek.FRIDAY, null, null, null, false)
        ));

        List<CalendarJob> jobs = Main.buildCalendarJobs(calendar, harness.repository, harness.renderer, new RotatingContentProvider());

        assertEquals(List.of("weekly-digest", "month-end"), jobs.stream().map(CalendarJob::name).toList());
        assertEquals(Tier.FREE, jobs.get(0).tier());
        assertTrue(jobs.get(1).schedule().isMonthly());
        assertEquals("Europe/London", jobs.get(1).schedule().zone().getId());
    }

    @Test
    void misconfiguredCalendarJobFailsFastWithItsName() throws Exception {
        ServiceHarness harness = new ServiceHarness();
        CalendarConfig weeklyWithoutDay = new CalendarConfig(null, null, List.of(
                new CalendarJobConfig("broken", DigestKind.MIDWEEK_DIGEST, null, null, null, null, null)));
        CalendarConfig monthlyWithoutDay = new CalendarConfig(null, null, List.of(
                new CalendarJobConfig("also-broken", DigestKind.MONTHLY_DIGEST, DayOfWeek.MONDAY, null, null, null, null)));

        IllegalStateException weekly = assertThrows(IllegalStateException.class, () -> Main.buildCalendarJobs(
                weeklyWithoutDay, harness.repository, harness.renderer, new RotatingContentProvider()));
        IllegalStateException monthly = assertThrows(IllegalStateException.class, () -> Main.buildCalendarJobs(
                monthlyWithoutDay, harness.repository, harness.renderer, new RotatingContentProvider()));

        assertTrue(weekly.getMessage().contains("broken"));
        assertTrue(weekly.getMessage().contains("MIDWEEK_DIGEST needs dayOfWeek"), weekly.getMessage());
        assertInstanceOf(IllegalArgumentException.class, weekly.getCause());
        assertTrue(monthly.getMessage().contains("also-broken"));
        assertTrue(monthly.getMessage().contains("MONTHLY_DIGEST needs dayOfMonth"), monthly.getMessage());
    }
}
