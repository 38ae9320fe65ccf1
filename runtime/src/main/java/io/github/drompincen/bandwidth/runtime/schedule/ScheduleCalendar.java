package io.github.drompincen.bandwidth.runtime.schedule;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * Maps 1-based horizon week numbers to calendar dates. Week 1 starts on the Monday
 * of the week containing the reference date and every week runs Monday to Sunday.
 */
public final class ScheduleCalendar {

    private ScheduleCalendar() {}

    public static LocalDate weekStart(LocalDate referenceDate, int weekNumber) {
        int dayOfWeek = referenceDate.getDayOfWeek().getValue();
        int mondayOffset = referenceDate.getDayOfWeek() == DayOfWeek.SUNDAY ? -6 : 1 - dayOfWeek;
        return referenceDate.plusDays(mondayOffset).plusDays(7L * (weekNumber - 1));
    }

    public static LocalDate weekEnd(LocalDate referenceDate, int weekNumber) {
        return weekStart(referenceDate, weekNumber).plusDays(6);
    }
}
