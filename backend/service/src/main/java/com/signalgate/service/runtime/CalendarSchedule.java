package com.signalgate.service.runtime;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoField;
import java.time.temporal.IsoFields;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A weekly or monthly slot in a fixed zone. Periods are ISO weeks ({@code 2026-W42}) or calendar months
 * ({@code 2026-10}); a job is due once its slot in the current period has passed and the period has not been
 * recorded yet. Monthly days past the end of a short month fall on its last day.
 */
public record CalendarSchedule(DayOfWeek dayOfWeek, Integer dayOfMonth, LocalTime time, ZoneId zone) {
    public CalendarSchedule {
        Objects.requireNonNull(time, "time is required");
        Objects.requireNonNull(zone, "zone is required");
        if ((dayOfWeek == null) == (dayOfMonth == null)) {
            throw new IllegalArgumentException("exactly one of dayOfWeek or dayOfMonth must be set");
        }
        if (dayOfMonth != null && (dayOfMonth < 1 || dayOfMonth > 31)) {
            throw new IllegalArgumentException("dayOfMonth must be within 1..31: " + dayOfMonth);
        }
    }

    public static CalendarSchedule weekly(DayOfWeek dayOfWeek, LocalTime time, ZoneId zone) {
        return new CalendarSchedule(dayOfWeek, null, time, zone);
    }

    public static CalendarSchedule monthly(int dayOfMonth, LocalTime time, ZoneId zone) {
        return new CalendarSchedule(null, dayOfMonth, time, zone);
    }

    public boolean isMonthly() {
        return dayOfMonth != null;
    }

    public String periodKey(Instant now) {
        ZonedDateTime local = now.atZone(zone);
        if (isMonthly()) {
            return YearMonth.from(local).toString();
        }
        return String.format(Locale.ROOT, "%d-W%02d",
                local.get(IsoFields.WEEK_BASED_YEAR), local.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
    }

    public ZonedDateTime slotInPeriod(Instant now) {
        ZonedDateTime local = now.atZone(zone);
        LocalDate day;
        if (isMonthly()) {
            YearMonth month = YearMonth.from(local);
            day = month.atDay(Math.min(dayOfMonth, month.lengthOfMonth()));
        } else {
            day = local.toLocalDate().with(ChronoField.DAY_OF_WEEK, dayOfWeek.getValue());
        }
        return day.atTime(time).atZone(zone);
    }

    public ZonedDateTime periodStart(Instant now) {
        ZonedDateTime local = now.atZone(zone);
        if (isMonthly()) {
            return YearMonth.from(local).atDay(1).atStartOfDay(zone);
        }
        return local.toLocalDate().with(ChronoField.DAY_OF_WEEK, DayOfWeek.MONDAY.getValue()).atStartOfDay(zone);
    }

    public boolean isDue(Instant now, Optional<String> lastPeriod) {
        if (lastPeriod.filter(periodKey(now)::equals).isPresent()) {
            return false;
        }
        return !now.isBefore(slotInPeriod(now).toInstant());
    }
}
