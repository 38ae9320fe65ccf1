package io.github.drompincen.bandwidth.runtime.schedule;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

public final class ScheduleFormats {

    public static final String NOT_SCHEDULED = "Not scheduled";

    private static final DateTimeFormatter DISPLAY_FMT = DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.US);

    private ScheduleFormats() {}

    public static String formatDate(LocalDate date) {
        if (date == null) return NOT_SCHEDULED;
        return date.format(DISPLAY_FMT);
    }

    public static String formatDateRange(LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) return NOT_SCHEDULED;
        if (startDate.equals(endDate)) return formatDate(startDate);
        return formatDate(startDate) + " - " + formatDate(endDate);
    }

    /** Whole hours print without a fraction: {@code 10h}, {@code 7.5h}. */
    public static String formatHours(double hours) {
        if (hours == Math.rint(hours) && !Double.isInfinite(hours)) {
            return (long) hours + "h";
        }
        return String.format(Locale.US, "%.1fh", hours);
    }
}
