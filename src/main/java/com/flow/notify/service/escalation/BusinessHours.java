package com.flow.notify.service.escalation;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Weekly business-hours window, {@code [startHour, endHour)} on the given days.
 */
public record BusinessHours(int startHour, int endHour, Set<DayOfWeek> days, String zone) {

    public static final BusinessHours DEFAULT = new BusinessHours(9, 17,
            EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY), "UTC");

    public BusinessHours {
        days = days == null || days.isEmpty()
                ? EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY)
                : EnumSet.copyOf(days);
        zone = zone != null ? zone : "UTC";
    }

    public boolean isWithin(Instant instant) {
        ZonedDateTime time = instant.atZone(ZoneId.of(zone));
        int hour = time.getHour();
        return days.contains(time.getDayOfWeek()) && hour >= startHour && hour < endHour;
    }

    /**
     * Returns {@code instant} if it is inside business hours, else the next business-hours start.
     */
    public Instant nextOpening(Instant instant) {
        if (isWithin(instant)) {
            return instant;
        }
        ZoneId zoneId = ZoneId.of(zone);
        LocalDate date = instant.atZone(zoneId).toLocalDate();
        for (int i = 0; i <= 7; i++) {
            LocalDate candidateDate = date.plusDays(i);
            if (!days.contains(candidateDate.getDayOfWeek())) {
                continue;
            }
            Instant opening = candidateDate.atTime(startHour, 0).atZone(zoneId).toInstant();
            if (opening.isAfter(instant)) {
                return opening;
            }
        }
        throw new IllegalStateException("No business hours found within a week of " + instant);
    }
}
