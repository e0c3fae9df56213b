package br.com.analytics.pipeline.pvm_bridge_batch.model;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Frozen output of an aggregation run. Buckets are in first-seen order and {@code periods} lists
 * the analysis periods in their configured order.
 */
public record AggregationResult(
        PeriodMode mode,
        List<PeriodTag> periods,
        List<FiscalYearWindow> fiscalYears,
        List<String> dimensionColumns,
        List<AggregatedBucket> buckets,
        Map<PeriodTag, PeriodTotals> negatives,
        RunStatistics statistics,
        @Nullable LocalDate minDate,
        @Nullable LocalDate maxDate
) {

    public AggregationResult {
        periods = List.copyOf(periods);
        fiscalYears = List.copyOf(fiscalYears);
        dimensionColumns = List.copyOf(dimensionColumns);
        buckets = List.copyOf(buckets);
        negatives = Collections.unmodifiableMap(new LinkedHashMap<>(negatives));
    }

    public PeriodTotals negatives(PeriodTag tag) {
        return negatives.getOrDefault(tag, PeriodTotals.ZERO);
    }
}
