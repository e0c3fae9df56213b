package br.com.analytics.pipeline.pvm_bridge_batch.processor;

import br.com.analytics.pipeline.pvm_bridge_batch.config.AggregationSettings;
import br.com.analytics.pipeline.pvm_bridge_batch.config.ColumnMapping;
import br.com.analytics.pipeline.pvm_bridge_batch.config.PeriodPlan;
import br.com.analytics.pipeline.pvm_bridge_batch.model.AggregatedBucket;
import br.com.analytics.pipeline.pvm_bridge_batch.model.AggregationResult;
import br.com.analytics.pipeline.pvm_bridge_batch.model.FiscalYearWindow;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PeriodAccumulator;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PeriodMode;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PeriodTag;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PeriodTotals;
import br.com.analytics.pipeline.pvm_bridge_batch.model.RawRecord;
import br.com.analytics.pipeline.pvm_bridge_batch.model.RunStatistics;
import br.com.analytics.pipeline.pvm_bridge_batch.period.DateFormatDescriptor;
import br.com.analytics.pipeline.pvm_bridge_batch.period.DateFormats;
import br.com.analytics.pipeline.pvm_bridge_batch.period.PeriodClassifier;
import br.com.analytics.pipeline.pvm_bridge_batch.reader.NumberParser;
import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.StringJoiner;

/**
 * Incremental aggregation of one run: {@code create -> processRow* -> finalizeResult}.
 * <p>
 * Buckets live in an arena indexed by a small id; the id is looked up from the tuple of trimmed
 * dimension values, so a row that hits an existing bucket allocates no key. Accumulators exist only
 * for (bucket, period) pairs that received a row. Calling {@link #processRow} after
 * {@link #finalizeResult} is a caller error and is not checked here.
 * </p>
 */
public final class AggregationContext {

    public static final String UNKNOWN_DIMENSION_VALUE = "Unknown";
    public static final String TOTAL_KEY = "Total";
    public static final String KEY_SEPARATOR = "|||";

    private final AggregationSettings settings;
    private final ColumnMapping columns;
    private final PeriodPlan plan;
    private final List<PeriodTag> tags;
    private final @Nullable DateFormatDescriptor dateFormat;

    private final Map<List<String>, Integer> bucketIds = new HashMap<>();
    private final List<Bucket> buckets = new ArrayList<>();
    private final List<String> scratchKey = new ArrayList<>();
    private final PeriodAccumulator[] negatives;
    private final long[] includedByPeriod;

    private long totalRows;
    private long includedRows;
    private long parseErrors;
    private long outsidePeriodRows;
    private long negativeRows;
    private @Nullable LocalDate minDate;
    private @Nullable LocalDate maxDate;

    private AggregationContext(AggregationSettings settings) {
        this.settings = settings;
        this.columns = settings.columns();
        this.plan = settings.periods();
        this.tags = plan.tags();
        this.dateFormat = DateFormatDescriptor.byId(settings.dateFormatId());
        this.negatives = new PeriodAccumulator[tags.size()];
        this.includedByPeriod = new long[tags.size()];
    }

    public static AggregationContext create(AggregationSettings settings) {
        return new AggregationContext(settings);
    }

    public AggregationSettings settings() {
        return settings;
    }

    /**
     * Folds one record into the aggregation.
     *
     * @return true when the row was added to a bucket; false when it was counted as a parse error,
     * outside the analysis periods, or routed to the negatives ledger
     */
    public boolean processRow(RawRecord record) {
        totalRows++;

        Optional<LocalDate> parsedDate = parseDate(record.get(columns.dateColumn()));
        if (parsedDate.isEmpty()) {
            parseErrors++;
            return false;
        }
        LocalDate date = parsedDate.get();
        if (minDate == null || date.isBefore(minDate)) minDate = date;
        if (maxDate == null || date.isAfter(maxDate)) maxDate = date;

        int period = plan.classify(date);
        if (period < 0) {
            outsidePeriodRows++;
            return false;
        }

        OptionalDouble sales = NumberParser.parse(record.get(columns.salesColumn()));
        OptionalDouble quantity = NumberParser.parse(record.get(columns.quantityColumn()));
        OptionalDouble cost = columns.hasCost() ? NumberParser.parse(record.get(columns.costColumn())) : OptionalDouble.of(0d);
        if (sales.isEmpty() || quantity.isEmpty() || cost.isEmpty()) {
            parseErrors++;
            return false;
        }

        double rowSales = sales.getAsDouble();
        double rowQuantity = quantity.getAsDouble();
        double rowCost = cost.getAsDouble();
        if (rowSales <= 0d || rowQuantity <= 0d) {
            if (negatives[period] == null) {
                negatives[period] = new PeriodAccumulator();
            }
            negatives[period].add(rowSales, rowQuantity, rowCost);
            negativeRows++;
            return false;
        }

        Bucket bucket = bucketFor(record);
        if (bucket.periods[period] == null) {
            bucket.periods[period] = new PeriodAccumulator();
        }
        bucket.periods[period].add(rowSales, rowQuantity, rowCost);
        includedRows++;
        includedByPeriod[period]++;
        return true;
    }

    /**
     * Row accounting so far; usable on a partial (cancelled or aborted) run.
     */
    public RunStatistics statistics() {
        Map<PeriodTag, Long> byPeriod = new LinkedHashMap<>();
        for (int i = 0; i < tags.size(); i++) {
            byPeriod.put(tags.get(i), includedByPeriod[i]);
        }
        return new RunStatistics(
                totalRows,
                includedRows,
                parseErrors + outsidePeriodRows + negativeRows,
                parseErrors,
                outsidePeriodRows,
                negativeRows,
                buckets.size(),
                byPeriod
        );
    }

    /**
     * Freezes the buckets in first-seen order together with the negatives ledger, the statistics and
     * the observed date range.
     */
    public AggregationResult finalizeResult() {
        List<AggregatedBucket> frozen = new ArrayList<>(buckets.size());
        for (Bucket bucket : buckets) {
            Map<PeriodTag, PeriodTotals> periods = new LinkedHashMap<>();
            for (int i = 0; i < tags.size(); i++) {
                if (bucket.periods[i] != null) {
                    periods.put(tags.get(i), bucket.periods[i].snapshot());
                }
            }
            frozen.add(new AggregatedBucket(bucket.key, bucket.dimensions, periods));
        }

        Map<PeriodTag, PeriodTotals> negativeTotals = new LinkedHashMap<>();
        for (int i = 0; i < tags.size(); i++) {
            if (negatives[i] != null) {
                negativeTotals.put(tags.get(i), negatives[i].snapshot());
            } else if (plan.mode() == PeriodMode.TWO_PERIOD) {
                negativeTotals.put(tags.get(i), PeriodTotals.ZERO);
            }
        }

        List<FiscalYearWindow> fiscalYears = new ArrayList<>(plan.fiscalYears().size());
        for (FiscalYearWindow window : plan.fiscalYears()) {
            fiscalYears.add(window.withCoverage(PeriodClassifier.isCovered(window.range(), minDate, maxDate)));
        }

        return new AggregationResult(
                plan.mode(),
                tags,
                fiscalYears,
                columns.dimensionColumns(),
                frozen,
                negativeTotals,
                statistics(),
                minDate,
                maxDate
        );
    }

    private Optional<LocalDate> parseDate(@Nullable String value) {
        if (dateFormat != null) {
            return value == null ? Optional.empty() : dateFormat.parse(value);
        }
        return DateFormats.parse(value, settings.dateFormatId());
    }

    private Bucket bucketFor(RawRecord record) {
        List<String> dimensionColumns = columns.dimensionColumns();
        scratchKey.clear();
        for (String column : dimensionColumns) {
            scratchKey.add(dimensionValue(record.get(column)));
        }
        Integer id = bucketIds.get(scratchKey);
        if (id != null) {
            return buckets.get(id);
        }

        List<String> values = List.copyOf(scratchKey);
        Map<String, String> dimensions = new LinkedHashMap<>();
        for (int i = 0; i < dimensionColumns.size(); i++) {
            dimensions.put(dimensionColumns.get(i), values.get(i));
        }
        String key = values.isEmpty() ? TOTAL_KEY : displayKey(values);
        Bucket bucket = new Bucket(key, dimensions, tags.size());
        bucketIds.put(values, buckets.size());
        buckets.add(bucket);
        return bucket;
    }

    // Backslash and pipe are escaped: distinct tuples yield distinct keys.
    private static String displayKey(List<String> values) {
        StringJoiner joiner = new StringJoiner(KEY_SEPARATOR);
        for (String value : values) {
            joiner.add(value.replace("\\", "\\\\").replace("|", "\\|"));
        }
        return joiner.toString();
    }

    private static String dimensionValue(@Nullable String raw) {
        if (raw == null) {
            return UNKNOWN_DIMENSION_VALUE;
        }
        String trimmed = raw.trim();
        return trimmed.isEmpty() ? UNKNOWN_DIMENSION_VALUE : trimmed;
    }

    private static final class Bucket {

        final String key;
        final Map<String, String> dimensions;
        final PeriodAccumulator[] periods;

        Bucket(String key, Map<String, String> dimensions, int periodCount) {
            this.key = key;
            this.dimensions = dimensions;
            this.periods = new PeriodAccumulator[periodCount];
        }
    }
}
