package com.onboardpilot.orchestrator.sla;

import java.time.LocalTime;
import java.time.ZoneId;

/**
 * The working window used when a stage's SLA only counts business time.
 * Bound from {@code onboardpilot.business-hours}; times are {@code HH:mm}.
 */
public record BusinessHours(String zone, String start, String end, boolean excludeWeekends) {

    public BusinessHours {
        if (zone == null || zone.isBlank())   zone  = "UTC";
        if (start == null || start.isBlank()) start = "09:00";
        if (end == null || end.isBlank())     end   = "17:00";
    }

    public ZoneId    zoneId()    { return ZoneId.of(zone); }
    public LocalTime startTime() { return LocalTime.parse(start); }
    public LocalTime endTime()   { return LocalTime.parse(end); }
}
