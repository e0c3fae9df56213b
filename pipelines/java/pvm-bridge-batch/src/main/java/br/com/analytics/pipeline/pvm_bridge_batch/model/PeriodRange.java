package br.com.analytics.pipeline.pvm_bridge_batch.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Date range inclusive on both ends.
 */
public record PeriodRange(
        LocalDate start,
        LocalDate end
) {

    public PeriodRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    public boolean isInverted() {
        return start.isAfter(end);
    }

    public boolean overlaps(PeriodRange other) {
        return !start.isAfter(other.end) && !other.start.isAfter(end);
    }

    /**
     * Days from the end of this range to the start of {@code later}; negative when they overlap.
     */
    public long gapDaysUntil(PeriodRange later) {
        return ChronoUnit.DAYS.between(end, later.start);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
