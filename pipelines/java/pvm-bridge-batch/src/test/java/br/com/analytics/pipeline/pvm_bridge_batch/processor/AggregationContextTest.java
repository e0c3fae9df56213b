package br.com.analytics.pipeline.pvm_bridge_batch.processor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import br.com.analytics.pipeline.pvm_bridge_batch.config.AggregationSettings;
import br.com.analytics.pipeline.pvm_bridge_batch.config.ColumnMapping;
import br.com.analytics.pipeline.pvm_bridge_batch.config.PeriodPlan;
import br.com.analytics.pipeline.pvm_bridge_batch.model.AggregatedBucket;
import br.com.analytics.pipeline.pvm_bridge_batch.model.AggregationResult;
import br.com.analytics.pipeline.pvm_bridge_batch.model.FiscalYearWindow;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PeriodMode;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PeriodTag;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PeriodTotals;
import br.com.analytics.pipeline.pvm_bridge_batch.model.RawRecord;
import br.com.analytics.pipeline.pvm_bridge_batch.model.RunStatistics;
import br.com.analytics.pipeline.pvm_bridge_batch.period.PeriodClassifier;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class AggregationContextTest {

    private static final PeriodPlan CALENDAR_2023_2024 = PeriodPlan.twoPeriod(
            PeriodClassifier.fiscalYearRange(2023, 12), PeriodClassifier.fiscalYearRange(2024, 12));

    private static AggregationSettings settings(List<String> dimensions, PeriodPlan plan) {
        return new AggregationSettings(
                new ColumnMapping("Date", "Sales", "Quantity", "Cost", dimensions), "YYYY-MM-DD", plan);
    }

    private static RawRecord row(String date, String region, String product, String sales, String quantity, String cost) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("Date", date);
        fields.put("Region", region);
        fields.put("Product", product);
        fields.put("Sales", sales);
        fields.put("Quantity", quantity);
        fields.put("Cost", cost);
        return new RawRecord(fields);
    }

    @Test
    void accountsForEveryRow() {
        AggregationContext context = AggregationContext.create(settings(List.of("Region", "Product"), CALENDAR_2023_2024));

        assertTrue(context.processRow(row("2023-03-01", "East", "Widget", "100", "10", "60")));
        assertTrue(context.processRow(row("2024-03-01", "East", "Widget", "150", "10", "80")));
        assertTrue(context.processRow(row("2024-04-01", " East ", "Widget", "50", "5", "30")));
        assertTrue(context.processRow(row("2024-05-01", "", "Gadget", "20", "2", "10")));
        assertFalse(context.processRow(row("2024-06-01", "East", "Widget", "100", "0", "40")));
        assertFalse(context.processRow(row("not a date", "East", "Widget", "1", "1", "1")));
        assertFalse(context.processRow(row("2022-01-01", "East", "Widget", "1", "1", "1")));
        assertFalse(context.processRow(row("2024-07-01", "East", "Widget", "abc", "1", "1")));
        assertFalse(context.processRow(row("2024-08-01", "East", "Widget", "10", "1", "")));

        AggregationResult result = context.finalizeResult();
        RunStatistics stats = result.statistics();

        assertEquals(9, stats.totalRows());
        assertEquals(4, stats.includedRows());
        assertEquals(5, stats.excludedRows());
        assertEquals(3, stats.parseErrors());
        assertEquals(1, stats.outsidePeriodRows());
        assertEquals(1, stats.negativeRows());
        assertEquals(2, stats.uniqueKeys());
        assertEquals(1L, stats.includedRows(PeriodTag.PRIOR_YEAR));
        assertEquals(3L, stats.includedRows(PeriodTag.CURRENT_YEAR));
        assertEquals(LocalDate.of(2022, 1, 1), result.minDate());
        assertEquals(LocalDate.of(2024, 8, 1), result.maxDate());
    }

    @Test
    void bucketsAreKeyedByTrimmedDimensionValues() {
        AggregationContext context = AggregationContext.create(settings(List.of("Region", "Product"), CALENDAR_2023_2024));
        context.processRow(row("2023-03-01", "East", "Widget", "100", "10", "60"));
        context.processRow(row("2024-03-01", " East ", "Widget", "150", "10", "80"));
        context.processRow(row("2024-05-01", "", "Gadget", "20", "2", "10"));

        List<AggregatedBucket> buckets = context.finalizeResult().buckets();

        assertEquals(2, buckets.size());
        AggregatedBucket east = buckets.get(0);
        assertEquals("East|||Widget", east.key());
        assertEquals(Map.of("Region", "East", "Product", "Widget"), east.dimensions());
        assertEquals(new PeriodTotals(100, 10, 60, 1), east.period(PeriodTag.PRIOR_YEAR));
        assertEquals(new PeriodTotals(150, 10, 80, 1), east.period(PeriodTag.CURRENT_YEAR));
        assertEquals("Unknown|||Gadget", buckets.get(1).key());
        assertEquals(PeriodTotals.ZERO, buckets.get(1).period(PeriodTag.PRIOR_YEAR));
    }

    @Test
    void separatorInsideValuesKeepsBucketsAndKeysDistinct() {
        AggregationContext context = AggregationContext.create(settings(List.of("Region", "Product"), CALENDAR_2023_2024));
        context.processRow(row("2024-01-01", "a|||b", "c", "1", "1", "0"));
        context.processRow(row("2024-01-01", "a", "b|||c", "1", "1", "0"));

        List<AggregatedBucket> buckets = context.finalizeResult().buckets();
        assertEquals(2, buckets.size());
        assertNotEquals(buckets.get(0).key(), buckets.get(1).key());
        assertEquals("a\\|\\|\\|b|||c", buckets.get(0).key());
    }

    @Test
    void nonPositiveRowsGoToNegativesLedger() {
        AggregationContext context = AggregationContext.create(settings(List.of("Region"), CALENDAR_2023_2024));
        context.processRow(row("2024-02-01", "East", "Widget", "100", "0", "0"));
        context.processRow(row("2024-03-01", "East", "Widget", "(40)", "-4", "-20"));

        AggregationResult result = context.finalizeResult();

        assertEquals(new PeriodTotals(60, -4, -20, 2), result.negatives(PeriodTag.CURRENT_YEAR));
        assertEquals(PeriodTotals.ZERO, result.negatives().get(PeriodTag.PRIOR_YEAR));
        assertTrue(result.buckets().isEmpty());
    }

    @Test
    void noDimensionsAggregatesIntoSingleTotalBucket() {
        AggregationContext context = AggregationContext.create(settings(List.of(), CALENDAR_2023_2024));
        context.processRow(row("2023-05-01", "East", "Widget", "10", "1", "5"));
        context.processRow(row("2023-06-01", "West", "Gadget", "30", "3", "15"));

        List<AggregatedBucket> buckets = context.finalizeResult().buckets();

        assertEquals(1, buckets.size());
        assertEquals(AggregationContext.TOTAL_KEY, buckets.get(0).key());
        assertEquals(new PeriodTotals(40, 4, 20, 2), buckets.get(0).period(PeriodTag.PRIOR_YEAR));
    }

    @Test
    void costDefaultsToZeroWithoutCostColumn() {
        AggregationSettings settings = new AggregationSettings(
                new ColumnMapping("Date", "Sales", "Quantity", null, List.of("Region")), "YYYY-MM-DD", CALENDAR_2023_2024);
        AggregationContext context = AggregationContext.create(settings);

        assertTrue(context.processRow(row("2024-05-01", "East", "Widget", "10", "1", "not used")));
        assertEquals(0d, context.finalizeResult().buckets().get(0).period(PeriodTag.CURRENT_YEAR).cost());
    }

    @Test
    void multiYearModeClassifiesByFiscalYearAndRecomputesCoverage() {
        PeriodPlan plan = PeriodPlan.multiYear(List.of(
                new FiscalYearWindow(2023, PeriodClassifier.fiscalYearRange(2023, 6), false),
                new FiscalYearWindow(2024, PeriodClassifier.fiscalYearRange(2024, 6), false),
                new FiscalYearWindow(2025, PeriodClassifier.fiscalYearRange(2025, 6), false)));
        AggregationContext context = AggregationContext.create(settings(List.of("Region"), plan));
        context.processRow(row("2022-07-01", "East", "Widget", "10", "1", "5"));
        context.processRow(row("2024-06-30", "East", "Widget", "20", "2", "10"));
        context.processRow(row("2024-07-01", "East", "Widget", "30", "3", "15"));
        context.processRow(row("2025-03-31", "East", "Widget", "0", "3", "15"));

        AggregationResult result = context.finalizeResult();
        AggregatedBucket east = result.buckets().get(0);

        assertEquals(PeriodMode.MULTI_YEAR, result.mode());
        assertEquals(List.of(new PeriodTag("2023"), new PeriodTag("2024"), new PeriodTag("2025")), result.periods());
        assertEquals(10d, east.period(new PeriodTag("2023")).sales());
        assertEquals(20d, east.period(new PeriodTag("2024")).sales());
        assertEquals(30d, east.period(new PeriodTag("2025")).sales());
        assertTrue(result.fiscalYears().get(0).fullyCovered());
        assertTrue(result.fiscalYears().get(1).fullyCovered());
        assertFalse(result.fiscalYears().get(2).fullyCovered());
        assertEquals(1, result.negatives().size());
        assertEquals(1L, result.negatives(new PeriodTag("2025")).count());
    }

    @Test
    void totalsSumBucketsPerPeriod() {
        AggregationContext context = AggregationContext.create(settings(List.of("Region"), CALENDAR_2023_2024));
        context.processRow(row("2023-05-01", "East", "Widget", "10", "1", "5"));
        context.processRow(row("2024-05-01", "West", "Widget", "30", "3", "15"));
        context.processRow(row("2024-06-01", "East", "Widget", "20", "2", "8"));

        Map<PeriodTag, PeriodTotals> totals = AggregationTotals.calculate(context.finalizeResult());

        assertEquals(List.of(PeriodTag.PRIOR_YEAR, PeriodTag.CURRENT_YEAR), List.copyOf(totals.keySet()));
        assertEquals(new PeriodTotals(10, 1, 5, 1), totals.get(PeriodTag.PRIOR_YEAR));
        assertEquals(new PeriodTotals(50, 5, 23, 2), totals.get(PeriodTag.CURRENT_YEAR));
    }
}
