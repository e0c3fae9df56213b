package br.com.analytics.pipeline.pvm_bridge_batch.bridge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import br.com.analytics.pipeline.pvm_bridge_batch.config.AggregationSettings;
import br.com.analytics.pipeline.pvm_bridge_batch.config.ColumnMapping;
import br.com.analytics.pipeline.pvm_bridge_batch.config.PeriodPlan;
import br.com.analytics.pipeline.pvm_bridge_batch.model.BridgeBucketResult;
import br.com.analytics.pipeline.pvm_bridge_batch.model.BridgeMode;
import br.com.analytics.pipeline.pvm_bridge_batch.model.BridgeOptions;
import br.com.analytics.pipeline.pvm_bridge_batch.model.BridgeResult;
import br.com.analytics.pipeline.pvm_bridge_batch.model.BridgeSummary;
import br.com.analytics.pipeline.pvm_bridge_batch.model.FiscalYearWindow;
import br.com.analytics.pipeline.pvm_bridge_batch.model.ItemClassification;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PeriodBridge;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PeriodTotals;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PriceDefinition;
import br.com.analytics.pipeline.pvm_bridge_batch.model.RawRecord;
import br.com.analytics.pipeline.pvm_bridge_batch.period.PeriodClassifier;
import br.com.analytics.pipeline.pvm_bridge_batch.processor.AggregationContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

final class BridgeCalculatorTest {

    private static final double EPS = 1e-6;

    private final BridgeCalculator pvm = new BridgeCalculator(BridgeOptions.PVM);

    private static RawRecord row(String date, String region, String sales, String quantity) {
        return new RawRecord(Map.of("Date", date, "Region", region, "Sales", sales, "Quantity", quantity));
    }

    private static AggregationContext regionContext(PeriodPlan plan) {
        return AggregationContext.create(new AggregationSettings(
                new ColumnMapping("Date", "Sales", "Quantity", null, List.of("Region")), "YYYY-MM-DD", plan));
    }

    @Test
    void priceIncreaseAtFlatVolumeIsAllPrice() {
        AggregationContext context = regionContext(PeriodPlan.twoPeriod(
                PeriodClassifier.fiscalYearRange(2023, 12), PeriodClassifier.fiscalYearRange(2024, 12)));
        context.processRow(row("2023-03-01", "East", "100", "10"));
        context.processRow(row("2024-03-01", "East", "150", "10"));

        BridgeResult result = pvm.calculate(context.finalizeResult());
        PeriodBridge bridge = result.bridge("PY-CY").orElseThrow();
        BridgeBucketResult east = bridge.detail().get(0);

        assertEquals("East", east.key());
        assertEquals(10d, east.from().price(), EPS);
        assertEquals(15d, east.to().price(), EPS);
        assertEquals(50d, east.priceImpact(), EPS);
        assertEquals(0d, east.volumeImpact(), EPS);
        assertEquals(0d, east.mixImpact(), EPS);
        assertEquals(50d, east.totalChange(), EPS);
        assertEquals(ItemClassification.CONTINUING, east.classification());
        assertEquals(50d, bridge.summary().changePct(), EPS);
    }

    @Test
    void componentsReconcileToTotalChange() {
        Random random = new Random(42);
        List<BridgeBucketResult> detail = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            PeriodTotals from = random.nextInt(10) == 0 ? PeriodTotals.ZERO
                    : new PeriodTotals(random.nextDouble() * 10_000, 1 + random.nextInt(500), 0, 1);
            PeriodTotals to = random.nextInt(10) == 0 ? PeriodTotals.ZERO
                    : new PeriodTotals(random.nextDouble() * 10_000, 1 + random.nextInt(500), 0, 1);
            BridgeBucketResult result = pvm.calculateBucket("k" + i, Map.of(), from, to);
            assertEquals(result.totalChange(), result.priceImpact() + result.volumeImpact() + result.mixImpact(),
                    1e-6 * Math.max(1d, Math.abs(result.totalChange())), "bucket " + i);
            detail.add(result);
        }

        BridgeSummary summary = BridgeCalculator.summarize(detail);

        assertEquals(summary.totalChange(), summary.priceImpact() + summary.volumeImpact() + summary.mixImpact(), 1e-4);
        assertEquals(summary.to().value() - summary.from().value(), summary.totalChange(), 1e-4);
        assertEquals(500, summary.counts().total());
        assertEquals(500, summary.counts().newItems() + summary.counts().discontinued() + summary.counts().continuing());
    }

    @Test
    void newAndDiscontinuedItemsAreAllVolume() {
        BridgeBucketResult added = pvm.calculateBucket("new", Map.of(), PeriodTotals.ZERO, new PeriodTotals(200, 20, 0, 2));
        BridgeBucketResult dropped = pvm.calculateBucket("gone", Map.of(), new PeriodTotals(100, 10, 0, 1), PeriodTotals.ZERO);

        assertTrue(added.isNew());
        assertEquals(200d, added.volumeImpact(), EPS);
        assertEquals(0d, added.priceImpact(), EPS);
        assertEquals(0d, added.mixImpact(), EPS);
        assertEquals(0d, added.from().price(), EPS);

        assertTrue(dropped.isDiscontinued());
        assertEquals(-100d, dropped.volumeImpact(), EPS);
        assertEquals(-100d, dropped.totalChange(), EPS);
    }

    @Test
    void emptyOnBothSidesCountsAsNew() {
        BridgeBucketResult result = pvm.calculateBucket("empty", Map.of(), PeriodTotals.ZERO, PeriodTotals.ZERO);

        assertEquals(ItemClassification.NEW, result.classification());
        assertEquals(0d, result.totalChange(), EPS);
    }

    @Test
    void summaryPercentagesUseAbsoluteTotalChange() {
        List<BridgeBucketResult> detail = List.of(
                pvm.calculateBucket("East", Map.of(), new PeriodTotals(100, 10, 0, 1), new PeriodTotals(150, 10, 0, 1)),
                pvm.calculateBucket("West", Map.of(), PeriodTotals.ZERO, new PeriodTotals(200, 20, 0, 1)));

        BridgeSummary summary = BridgeCalculator.summarize(detail);

        assertEquals(250d, summary.totalChange(), EPS);
        assertEquals(20d, summary.priceImpactPct(), EPS);
        assertEquals(80d, summary.volumeImpactPct(), EPS);
        assertEquals(250d, summary.changePct(), EPS);
        assertEquals(1, summary.counts().newItems());
        assertEquals(1, summary.counts().continuing());
    }

    @Test
    void zeroTotalChangeGivesZeroPercentages() {
        BridgeSummary summary = BridgeCalculator.summarize(List.of(
                pvm.calculateBucket("flat", Map.of(), new PeriodTotals(100, 10, 0, 1), new PeriodTotals(100, 10, 0, 1))));

        assertEquals(0d, summary.priceImpactPct());
        assertEquals(0d, summary.volumeImpactPct());
        assertEquals(0d, summary.changePct());
    }

    @Test
    void grossMarginBridgesMarginPerUnit() {
        BridgeCalculator gm = new BridgeCalculator(new BridgeOptions(BridgeMode.GM, PriceDefinition.MARGIN_PER_UNIT));

        BridgeBucketResult result = gm.calculateBucket("East", Map.of(),
                new PeriodTotals(100, 10, 60, 1), new PeriodTotals(150, 10, 80, 1));

        assertEquals(40d, result.from().value(), EPS);
        assertEquals(7d, result.to().price(), EPS);
        assertEquals(30d, result.totalChange(), EPS);
        assertEquals(30d, result.priceImpact(), EPS);
        assertEquals(0d, result.costImpact(), EPS);
    }

    @Test
    void salesPerUnitSeparatesCostImpact() {
        BridgeCalculator gm = new BridgeCalculator(new BridgeOptions(BridgeMode.GM, PriceDefinition.SALES_PER_UNIT));

        BridgeBucketResult result = gm.calculateBucket("East", Map.of(),
                new PeriodTotals(100, 10, 60, 1), new PeriodTotals(150, 10, 80, 1));

        assertEquals(50d, result.totalChange(), EPS);
        assertEquals(50d, result.priceImpact(), EPS);
        assertEquals(-20d, result.costImpact(), EPS);
        assertEquals(30d, result.marginChange(), EPS);
    }

    @Test
    void multiYearBridgesEachAdjacentPair() {
        PeriodPlan plan = PeriodPlan.multiYear(List.of(
                new FiscalYearWindow(2022, PeriodClassifier.fiscalYearRange(2022, 12), false),
                new FiscalYearWindow(2023, PeriodClassifier.fiscalYearRange(2023, 12), false),
                new FiscalYearWindow(2024, PeriodClassifier.fiscalYearRange(2024, 12), false)));
        AggregationContext context = regionContext(plan);
        context.processRow(row("2022-06-01", "East", "100", "10"));
        context.processRow(row("2023-06-01", "East", "120", "10"));
        context.processRow(row("2024-06-01", "East", "120", "12"));

        BridgeResult result = pvm.calculate(context.finalizeResult());

        assertEquals(List.of("2022-2023", "2023-2024"), result.bridges().stream().map(PeriodBridge::key).toList());
        assertEquals(20d, result.bridge("2022-2023").orElseThrow().summary().priceImpact(), EPS);
        BridgeSummary later = result.bridge("2023-2024").orElseThrow().summary();
        assertEquals(0d, later.totalChange(), EPS);
        assertEquals(-20d, later.priceImpact(), EPS);
        assertEquals(24d, later.volumeImpact(), EPS);
        assertEquals(-4d, later.mixImpact(), EPS);
    }
}
