package io.github.drompincen.bandwidth.runtime.schedule;

import io.github.drompincen.bandwidth.protocol.api.ResourceDto;
import io.github.drompincen.bandwidth.protocol.api.ResourceScheduleDto;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Rolling week-by-week capacity for a single resource. A ledger lives for one
 * projection or planning call and is then frozen into a {@link ResourceScheduleDto}.
 */
public class WeeklyLedger {

    private final ResourceDto resource;
    private final List<WeekBucket> weeks;

    private WeeklyLedger(ResourceDto resource, List<WeekBucket> weeks) {
        this.resource = resource;
        this.weeks = weeks;
    }

    /**
     * Builds buckets 1..horizonWeeks at full capacity, except that week 1 starts out
     * holding the resource's committed hours.
     */
    public static WeeklyLedger initialize(ResourceDto resource, int horizonWeeks, LocalDate referenceDate) {
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(referenceDate, "referenceDate");
        if (horizonWeeks <= 0) {
            throw new IllegalArgumentException("horizonWeeks must be positive: " + horizonWeeks);
        }
        double capacity = resource.weeklyCapacity();
        List<WeekBucket> weeks = new ArrayList<>(horizonWeeks);
        for (int weekNumber = 1; weekNumber <= horizonWeeks; weekNumber++) {
            double committed = weekNumber == 1 ? resource.committedHoursOrZero() : 0;
            weeks.add(new WeekBucket(weekNumber,
                    ScheduleCalendar.weekStart(referenceDate, weekNumber),
                    ScheduleCalendar.weekEnd(referenceDate, weekNumber),
                    committed, capacity - committed));
        }
        return new WeeklyLedger(resource, weeks);
    }

    public ResourceDto resource() { return resource; }

    public double capacity() { return resource.weeklyCapacity(); }

    public int horizonWeeks() { return weeks.size(); }

    public List<WeekBucket> weeks() { return Collections.unmodifiableList(weeks); }

    public WeekBucket week(int weekNumber) {
        return weeks.get(weekNumber - 1);
    }

    /** First week that can take {@code hours} whole, scanning from week 1. */
    public OptionalInt firstWeekFitting(double hours) {
        for (WeekBucket week : weeks) {
            if (week.fits(hours)) return OptionalInt.of(week.getWeekNumber());
        }
        return OptionalInt.empty();
    }

    /**
     * Share of the week already taken, before any new placement. A resource with no
     * capacity counts as fully utilized.
     */
    public double utilization(int weekNumber) {
        if (capacity() <= 0) return 1.0;
        return week(weekNumber).getAssignedHours() / capacity();
    }

    public ResourceScheduleDto snapshot(boolean clampAvailable) {
        return new ResourceScheduleDto(resource.resourceId(), resource.name(), resource.role(),
                resource.weeklyCapacity(),
                weeks.stream().map(w -> w.toDto(clampAvailable)).toList());
    }
}
