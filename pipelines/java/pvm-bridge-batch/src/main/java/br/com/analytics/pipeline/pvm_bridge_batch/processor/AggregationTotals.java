package br.com.analytics.pipeline.pvm_bridge_batch.processor;

import br.com.analytics.pipeline.pvm_bridge_batch.model.AggregatedBucket;
import br.com.analytics.pipeline.pvm_bridge_batch.model.AggregationResult;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PeriodTag;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PeriodTotals;

import java.util.LinkedHashMap;
import java.util.Map;

public final class AggregationTotals {

    private AggregationTotals() {
    }

    /**
     * Sums every bucket per period, in analysis period order. Periods with no rows total zero.
     */
    public static Map<PeriodTag, PeriodTotals> calculate(AggregationResult result) {
        Map<PeriodTag, PeriodTotals> totals = new LinkedHashMap<>();
        for (PeriodTag tag : result.periods()) {
            totals.put(tag, PeriodTotals.ZERO);
        }
        for (AggregatedBucket bucket : result.buckets()) {
            for (Map.Entry<PeriodTag, PeriodTotals> entry : bucket.periods().entrySet()) {
                totals.merge(entry.getKey(), entry.getValue(), PeriodTotals::plus);
            }
        }
        return totals;
    }
}
