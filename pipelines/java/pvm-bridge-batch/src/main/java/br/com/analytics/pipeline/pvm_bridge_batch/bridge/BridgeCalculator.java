package br.com.analytics.pipeline.pvm_bridge_batch.bridge;

import br.com.analytics.pipeline.pvm_bridge_batch.model.AggregatedBucket;
import br.com.analytics.pipeline.pvm_bridge_batch.model.AggregationResult;
import br.com.analytics.pipeline.pvm_bridge_batch.model.BridgeBucketResult;
import br.com.analytics.pipeline.pvm_bridge_batch.model.BridgeOptions;
import br.com.analytics.pipeline.pvm_bridge_batch.model.BridgeResult;
import br.com.analytics.pipeline.pvm_bridge_batch.model.BridgeSummary;
import br.com.analytics.pipeline.pvm_bridge_batch.model.ClassificationCounts;
import br.com.analytics.pipeline.pvm_bridge_batch.model.ItemClassification;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PeriodBridge;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PeriodSnapshot;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PeriodTag;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PeriodTotals;
import br.com.analytics.pipeline.pvm_bridge_batch.model.SummaryPeriod;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Price / Volume / Mix decomposition of finalized aggregates.
 * <pre>
 * price  = value / quantity                      (0 when quantity is 0)
 * Price  = (toPrice - fromPrice) x fromVolume
 * Volume = (toVolume - fromVolume) x fromPrice
 * Mix    = totalChange - Price - Volume
 * Cost   = -(toCost - fromCost)                  (gm mode, sales-per-unit only)
 * </pre>
 * A bucket with no positive sales and quantity on the "from" side is new, on the "to" side
 * discontinued; its whole change is volume. Two-period results are bridged PY to CY, multi-year
 * results year over year between each adjacent pair.
 */
public class BridgeCalculator {

    private final BridgeOptions options;

    public BridgeCalculator(BridgeOptions options) {
        this.options = options;
    }

    public BridgeOptions options() {
        return options;
    }

    public BridgeResult calculate(AggregationResult aggregation) {
        List<PeriodTag> periods = aggregation.periods();
        List<PeriodBridge> bridges = new ArrayList<>(Math.max(0, periods.size() - 1));
        for (int i = 0; i + 1 < periods.size(); i++) {
            bridges.add(bridge(aggregation.buckets(), periods.get(i), periods.get(i + 1)));
        }
        return new BridgeResult(options, bridges);
    }

    public PeriodBridge bridge(List<AggregatedBucket> buckets, PeriodTag from, PeriodTag to) {
        List<BridgeBucketResult> detail = new ArrayList<>(buckets.size());
        for (AggregatedBucket bucket : buckets) {
            detail.add(calculateBucket(bucket.key(), bucket.dimensions(), bucket.period(from), bucket.period(to)));
        }
        return new PeriodBridge(from.id() + "-" + to.id(), from, to, detail, summarize(detail));
    }

    public BridgeBucketResult calculateBucket(String key, Map<String, String> dimensions,
                                              PeriodTotals from, PeriodTotals to) {
        boolean isNew = from.sales() <= 0d || from.quantity() <= 0d;
        boolean isDiscontinued = to.sales() <= 0d || to.quantity() <= 0d;

        double fromValue = value(from);
        double toValue = value(to);
        double fromPrice = from.quantity() > 0d ? fromValue / from.quantity() : 0d;
        double toPrice = to.quantity() > 0d ? toValue / to.quantity() : 0d;
        double totalChange = toValue - fromValue;

        ItemClassification classification;
        double priceImpact;
        double volumeImpact;
        double mixImpact;
        if (isNew || isDiscontinued) {
            classification = isNew ? ItemClassification.NEW : ItemClassification.DISCONTINUED;
            priceImpact = 0d;
            volumeImpact = totalChange;
            mixImpact = 0d;
        } else {
            classification = ItemClassification.CONTINUING;
            priceImpact = (toPrice - fromPrice) * from.quantity();
            volumeImpact = (to.quantity() - from.quantity()) * fromPrice;
            mixImpact = totalChange - priceImpact - volumeImpact;
        }
        double costImpact = options.separateCostImpact() ? -(to.cost() - from.cost()) : 0d;

        return new BridgeBucketResult(
                key,
                dimensions,
                new PeriodSnapshot(fromValue, fromPrice, from.quantity(), from.sales(), from.cost(), from.count()),
                new PeriodSnapshot(toValue, toPrice, to.quantity(), to.sales(), to.cost(), to.count()),
                totalChange,
                priceImpact,
                volumeImpact,
                mixImpact,
                costImpact,
                classification
        );
    }

    /**
     * Sums already decomposed buckets. Price and volume are not linear in the summed inputs, so the
     * summary never re-derives them from period totals.
     */
    public static BridgeSummary summarize(List<BridgeBucketResult> detail) {
        SummaryPeriod from = SummaryPeriod.ZERO;
        SummaryPeriod to = SummaryPeriod.ZERO;
        double totalChange = 0d;
        double priceImpact = 0d;
        double volumeImpact = 0d;
        double mixImpact = 0d;
        double costImpact = 0d;
        int newItems = 0;
        int discontinued = 0;
        int continuing = 0;

        for (BridgeBucketResult result : detail) {
            from = from.plus(result.from());
            to = to.plus(result.to());
            totalChange += result.totalChange();
            priceImpact += result.priceImpact();
            volumeImpact += result.volumeImpact();
            mixImpact += result.mixImpact();
            costImpact += result.costImpact();
            switch (result.classification()) {
                case NEW -> newItems++;
                case DISCONTINUED -> discontinued++;
                case CONTINUING -> continuing++;
            }
        }

        double base = Math.abs(totalChange);
        return new BridgeSummary(
                from,
                to,
                totalChange,
                priceImpact,
                volumeImpact,
                mixImpact,
                costImpact,
                percentOf(priceImpact, base),
                percentOf(volumeImpact, base),
                percentOf(mixImpact, base),
                percentOf(costImpact, base),
                percentOf(to.value() - from.value(), Math.abs(from.value())),
                new ClassificationCounts(detail.size(), newItems, discontinued, continuing)
        );
    }

    private double value(PeriodTotals totals) {
        return switch (options.mode()) {
            case PVM -> totals.sales();
            case GM -> switch (options.priceDefinition()) {
                case MARGIN_PER_UNIT -> totals.sales() - totals.cost();
                case SALES_PER_UNIT -> totals.sales();
            };
        };
    }

    private static double percentOf(double amount, double base) {
        return base != 0d ? amount / base * 100d : 0d;
    }
}
