package br.com.analytics.pipeline.pvm_bridge_batch.reader;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

/**
 * Observed date span of an input; both ends are null when no date parsed.
 */
public record DateRangeScan(
        @Nullable LocalDate minDate,
        @Nullable LocalDate maxDate,
        long rows,
        long unparsedDates
) {
}
