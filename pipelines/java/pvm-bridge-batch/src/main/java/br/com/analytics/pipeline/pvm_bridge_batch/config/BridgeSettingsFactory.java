package br.com.analytics.pipeline.pvm_bridge_batch.config;

import br.com.analytics.pipeline.pvm_bridge_batch.model.BridgeMode;
import br.com.analytics.pipeline.pvm_bridge_batch.model.BridgeOptions;
import br.com.analytics.pipeline.pvm_bridge_batch.model.FiscalYearWindow;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PeriodRange;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PriceDefinition;
import br.com.analytics.pipeline.pvm_bridge_batch.period.DateFormatDescriptor;
import br.com.analytics.pipeline.pvm_bridge_batch.period.DateFormatDetection;
import br.com.analytics.pipeline.pvm_bridge_batch.period.DateFormats;
import br.com.analytics.pipeline.pvm_bridge_batch.period.PeriodClassifier;
import org.jspecify.annotations.Nullable;

import java.nio.charset.Charset;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Turns {@link BridgeProperties} into the immutable slices each component consumes, rejecting
 * incomplete or contradictory configuration up front.
 */
public final class BridgeSettingsFactory {

    public static final String AUTO_DATE_FORMAT = "auto";

    private BridgeSettingsFactory() {
    }

    public static ReaderSettings readerSettings(BridgeProperties.Input input) {
        String delimiter = input.delimiter();
        if (delimiter == null || delimiter.length() != 1) {
            throw new ConfigurationException("Field delimiter must be a single character, was '" + delimiter + "'");
        }
        Charset charset;
        try {
            charset = Charset.forName(input.charset());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unsupported charset: " + input.charset(), e);
        }
        return new ReaderSettings(charset, delimiter.charAt(0), input.chunkSize(), input.progressInterval());
    }

    public static BridgeOptions bridgeOptions(BridgeProperties properties) {
        try {
            return new BridgeOptions(
                    BridgeMode.fromId(properties.mode()),
                    PriceDefinition.fromId(properties.priceDefinition()));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    public static ColumnMapping columnMapping(BridgeProperties properties) {
        BridgeProperties.Columns columns = properties.columns();
        ColumnMapping mapping = new ColumnMapping(
                columns.date(), columns.sales(), columns.quantity(), columns.cost(), columns.dimensions());
        if (bridgeOptions(properties).mode() == BridgeMode.GM && !mapping.hasCost()) {
            throw new ConfigurationException("Missing required column mapping: cost (required in gm mode)");
        }
        return mapping;
    }

    /**
     * Explicit fiscal years select multi-year mode; otherwise explicit PY/CY dates, then an LTM end
     * date (CY = LTM, PY = prior fiscal year), then a CY fiscal year (PY = the one before).
     */
    public static PeriodPlan periodPlan(BridgeProperties properties) {
        int endMonth = properties.fiscalYearEndMonth();
        if (endMonth < 1 || endMonth > 12) {
            throw new ConfigurationException("Fiscal year end month must be 1-12, was " + endMonth);
        }
        BridgeProperties.Periods periods = properties.periods();

        if (periods.fiscalYears() != null && !periods.fiscalYears().isEmpty()) {
            List<FiscalYearWindow> windows = new ArrayList<>();
            for (Integer fiscalYear : periods.fiscalYears()) {
                windows.add(new FiscalYearWindow(fiscalYear, PeriodClassifier.fiscalYearRange(fiscalYear, endMonth), false));
            }
            return PeriodPlan.multiYear(windows);
        }
        if (periods.pyStart() != null || periods.pyEnd() != null || periods.cyStart() != null || periods.cyEnd() != null) {
            PeriodRange prior = new PeriodRange(date(periods.pyStart(), "py-start"), date(periods.pyEnd(), "py-end"));
            PeriodRange current = new PeriodRange(date(periods.cyStart(), "cy-start"), date(periods.cyEnd(), "cy-end"));
            return PeriodPlan.twoPeriod(prior, current);
        }
        if (periods.ltmEndDate() != null) {
            LocalDate ltmEnd = date(periods.ltmEndDate(), "ltm-end-date");
            PeriodRange prior = PeriodClassifier.fiscalYearRange(PeriodClassifier.priorFiscalYear(ltmEnd, endMonth), endMonth);
            return PeriodPlan.twoPeriod(prior, PeriodClassifier.ltmRange(ltmEnd));
        }
        if (periods.cyFiscalYear() != null) {
            int current = periods.cyFiscalYear();
            return PeriodPlan.twoPeriod(
                    PeriodClassifier.fiscalYearRange(current - 1, endMonth),
                    PeriodClassifier.fiscalYearRange(current, endMonth));
        }
        throw new ConfigurationException("No analysis periods configured: set pvm.bridge.periods.*");
    }

    /**
     * The configured catalog id, or for {@code auto} the format detected from {@code samples}.
     */
    public static String dateFormatId(BridgeProperties properties, Supplier<List<String>> samples) {
        String configured = properties.dateFormat();
        if (configured == null || configured.isBlank() || AUTO_DATE_FORMAT.equalsIgnoreCase(configured.trim())) {
            DateFormatDetection detection = DateFormats.detect(samples.get());
            if (detection.format() == null) {
                throw new ConfigurationException("Could not detect the date format of column " + properties.columns().date());
            }
            return detection.format().id();
        }
        if (DateFormatDescriptor.byId(configured.trim()) == null) {
            throw new ConfigurationException("Unknown date format: " + configured);
        }
        return configured.trim();
    }

    public static AggregationSettings aggregationSettings(BridgeProperties properties, Supplier<List<String>> dateSamples) {
        ColumnMapping columns = columnMapping(properties);
        PeriodPlan plan = periodPlan(properties);
        return new AggregationSettings(columns, dateFormatId(properties, dateSamples), plan);
    }

    private static LocalDate date(@Nullable String value, String property) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Missing period date: pvm.bridge.periods." + property);
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Invalid period date pvm.bridge.periods." + property + ": " + value, e);
        }
    }
}
