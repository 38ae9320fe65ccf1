package io.github.drompincen.bandwidth.runtime.schedule;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleFormatsTest {

    @Test
    void formatsDateInUsStyle() {
        assertThat(ScheduleFormats.formatDate(LocalDate.of(2024, 5, 13))).isEqualTo("May 13, 2024");
    }

    @Test
    void nullDateIsNotScheduled() {
        assertThat(ScheduleFormats.formatDate(null)).isEqualTo("Not scheduled");
    }

    @Test
    void rangeWithMissingEndIsNotScheduled() {
        assertThat(ScheduleFormats.formatDateRange(LocalDate.of(2024, 5, 13), null)).isEqualTo("Not scheduled");
        assertThat(ScheduleFormats.formatDateRange(null, LocalDate.of(2024, 5, 13))).isEqualTo("Not scheduled");
    }

    @Test
    void sameDayRangeCollapsesToSingleDate() {
        LocalDate day = LocalDate.of(2024, 12, 1);
        assertThat(ScheduleFormats.formatDateRange(day, day)).isEqualTo("Dec 1, 2024");
    }

    @Test
    void rangeJoinsBothDates() {
        assertThat(ScheduleFormats.formatDateRange(LocalDate.of(2024, 5, 13), LocalDate.of(2024, 5, 26)))
                .isEqualTo("May 13, 2024 - May 26, 2024");
    }

    @Test
    void hoursDropTrailingZeroFraction() {
        assertThat(ScheduleFormats.formatHours(10.0)).isEqualTo("10h");
        assertThat(ScheduleFormats.formatHours(7.5)).isEqualTo("7.5h");
    }
}
