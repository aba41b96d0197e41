package com.onboardpilot.orchestrator.sla;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class BusinessCalendarTest {

    private final BusinessCalendar weekdays = new BusinessCalendar(new BusinessHours("UTC", "09:00", "17:00", true));
    private final BusinessCalendar everyDay = new BusinessCalendar(new BusinessHours("UTC", "09:00", "17:00", false));

    @Test
    void businessMinutesBetween_overnight_countsOnlyOfficeHours() {
        // Monday 16:30 → Tuesday 09:30
        double minutes = weekdays.businessMinutesBetween(
                Instant.parse("2026-03-02T16:30:00Z"), Instant.parse("2026-03-03T09:30:00Z"));

        assertThat(minutes).isEqualTo(60.0);
    }

    @Test
    void businessMinutesBetween_overWeekend_skipsSaturdayAndSunday() {
        Instant friday = Instant.parse("2026-03-06T16:00:00Z");
        Instant monday = Instant.parse("2026-03-09T10:00:00Z");

        assertThat(weekdays.businessMinutesBetween(friday, monday)).isEqualTo(120.0);
        assertThat(everyDay.businessMinutesBetween(friday, monday)).isEqualTo(60.0 + 480 + 480 + 60);
    }

    @Test
    void businessMinutesBetween_outsideWindowOrReversed_isZero() {
        Instant evening = Instant.parse("2026-03-02T18:00:00Z");
        Instant night   = Instant.parse("2026-03-02T20:00:00Z");

        assertThat(weekdays.businessMinutesBetween(evening, night)).isZero();
        assertThat(weekdays.businessMinutesBetween(night, evening)).isZero();
    }

    @Test
    void isWithinBusinessHours_startInclusiveEndExclusive() {
        assertThat(weekdays.isWithinBusinessHours(Instant.parse("2026-03-02T09:00:00Z"))).isTrue();
        assertThat(weekdays.isWithinBusinessHours(Instant.parse("2026-03-02T17:00:00Z"))).isFalse();
        assertThat(weekdays.isWithinBusinessHours(Instant.parse("2026-03-07T10:00:00Z"))).isFalse();
        assertThat(everyDay.isWithinBusinessHours(Instant.parse("2026-03-07T10:00:00Z"))).isTrue();
    }

    @Test
    void isWithinBusinessHours_usesConfiguredZone() {
        BusinessCalendar madrid = new BusinessCalendar(new BusinessHours("Europe/Madrid", "09:00", "17:00", true));

        // 08:30 UTC is 09:30 in Madrid in March (CET, UTC+1)
        assertThat(madrid.isWithinBusinessHours(Instant.parse("2026-03-02T08:30:00Z"))).isTrue();
        assertThat(weekdays.isWithinBusinessHours(Instant.parse("2026-03-02T08:30:00Z"))).isFalse();
    }
}
