package com.onboardpilot.orchestrator.sla;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Counts working minutes between two instants for a {@link BusinessHours} window.
 */
public class BusinessCalendar {

    private final ZoneId    zone;
    private final LocalTime start;
    private final LocalTime end;
    private final boolean   excludeWeekends;

    public BusinessCalendar(BusinessHours hours) {
        this.zone            = hours.zoneId();
        this.start           = hours.startTime();
        this.end             = hours.endTime();
        this.excludeWeekends = hours.excludeWeekends();
    }

    /**
     * Minutes of {@code [from, to)} that fall inside the working window.
     * Zero when {@code to} is not after {@code from}.
     */
    public double businessMinutesBetween(Instant from, Instant to) {
        if (!to.isAfter(from)) return 0.0;

        LocalDate day  = from.atZone(zone).toLocalDate();
        LocalDate last = to.atZone(zone).toLocalDate();
        long millis = 0;

        while (!day.isAfter(last)) {
            if (isWorkingDay(day)) {
                Instant windowStart = day.atTime(start).atZone(zone).toInstant();
                Instant windowEnd   = day.atTime(end).atZone(zone).toInstant();
                Instant s = from.isAfter(windowStart) ? from : windowStart;
                Instant e = to.isBefore(windowEnd) ? to : windowEnd;
                if (e.isAfter(s)) {
                    millis += Duration.between(s, e).toMillis();
                }
            }
            day = day.plusDays(1);
        }
        return millis / 60_000.0;
    }

    public boolean isWithinBusinessHours(Instant instant) {
        ZonedDateTime local = instant.atZone(zone);
        if (!isWorkingDay(local.toLocalDate())) return false;
        LocalTime time = local.toLocalTime();
        return !time.isBefore(start) && time.isBefore(end);
    }

    private boolean isWorkingDay(LocalDate day) {
        if (!excludeWeekends) return true;
        DayOfWeek dow = day.getDayOfWeek();
        return dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY;
    }
}
