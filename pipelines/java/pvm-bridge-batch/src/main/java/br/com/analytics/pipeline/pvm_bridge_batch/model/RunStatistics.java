package br.com.analytics.pipeline.pvm_bridge_batch.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Row accounting of one aggregation run. {@code totalRows == includedRows + excludedRows} and
 * {@code excludedRows == parseErrors + outsidePeriodRows + negativeRows} always hold.
 */
public record RunStatistics(
        long totalRows,
        long includedRows,
        long excludedRows,
        long parseErrors,
        long outsidePeriodRows,
        long negativeRows,
        int uniqueKeys,
        Map<PeriodTag, Long> includedRowsByPeriod
) {

    public RunStatistics {
        includedRowsByPeriod = Collections.unmodifiableMap(new LinkedHashMap<>(includedRowsByPeriod));
    }

    public long includedRows(PeriodTag tag) {
        return includedRowsByPeriod.getOrDefault(tag, 0L);
    }
}
