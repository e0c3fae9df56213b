package br.com.analytics.pipeline.pvm_bridge_batch.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Finalized accumulators of one dimension combination. Periods without rows are absent from
 * {@link #periods()} and read back as {@link PeriodTotals#ZERO}.
 */
public record AggregatedBucket(
        String key,
        Map<String, String> dimensions,
        Map<PeriodTag, PeriodTotals> periods
) {

    public AggregatedBucket {
        dimensions = Collections.unmodifiableMap(new LinkedHashMap<>(dimensions));
        periods = Collections.unmodifiableMap(new LinkedHashMap<>(periods));
    }

    public PeriodTotals period(PeriodTag tag) {
        return periods.getOrDefault(tag, PeriodTotals.ZERO);
    }
}
