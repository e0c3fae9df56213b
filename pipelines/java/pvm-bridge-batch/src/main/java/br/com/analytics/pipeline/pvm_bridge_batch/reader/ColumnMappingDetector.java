package br.com.analytics.pipeline.pvm_bridge_batch.reader;

import br.com.analytics.pipeline.pvm_bridge_batch.model.RawRecord;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Header heuristics that pre-fill a column mapping. Patterns are tried in order; the first pattern
 * matching any unused header claims it.
 */
public final class ColumnMappingDetector {

    private static final List<Pattern> DATE_PATTERNS = patterns(
            "^date$", "^transaction.?date$", "^invoice.?date$", "^order.?date$", "^sale.?date$", "date");
    private static final List<Pattern> SALES_PATTERNS = patterns(
            "^sales$", "^revenue$", "^net.?sales$", "^total.?sales$", "^amount$", "^sales.?amount$", "sales", "revenue");
    private static final List<Pattern> QUANTITY_PATTERNS = patterns(
            "^quantity$", "^qty$", "^volume$", "^units$", "^count$", "quantity", "volume");
    private static final List<Pattern> COST_PATTERNS = patterns(
            "^cost$", "^cogs$", "^cost.?of.?goods$", "^total.?cost$", "^unit.?cost$", "cost");

    private ColumnMappingDetector() {
    }

    /**
     * Claims date, sales, quantity and cost headers, then suggests every remaining header with at
     * least one non-numeric sampled value as a dimension.
     */
    public static DetectedColumns detect(List<String> headers, List<RawRecord> samples) {
        Set<String> used = new HashSet<>();
        String date = claim(headers, DATE_PATTERNS, used);
        String sales = claim(headers, SALES_PATTERNS, used);
        String quantity = claim(headers, QUANTITY_PATTERNS, used);
        String cost = claim(headers, COST_PATTERNS, used);

        List<String> dimensions = new ArrayList<>();
        for (String header : headers) {
            if (!used.contains(header) && !isNumericColumn(header, samples)) {
                dimensions.add(header);
            }
        }
        return new DetectedColumns(date, sales, quantity, cost, dimensions);
    }

    /**
     * Up to {@code max} distinct non-blank values of {@code column}, in first-seen order.
     */
    public static List<String> dateSamples(List<RawRecord> rows, String column, int max) {
        Set<String> samples = new LinkedHashSet<>();
        for (RawRecord row : rows) {
            String value = row.get(column);
            if (value != null && !value.isBlank()) {
                samples.add(value.trim());
                if (samples.size() >= max) {
                    break;
                }
            }
        }
        return new ArrayList<>(samples);
    }

    private static @Nullable String claim(List<String> headers, List<Pattern> patterns, Set<String> used) {
        for (Pattern pattern : patterns) {
            for (String header : headers) {
                if (!used.contains(header) && pattern.matcher(header).find()) {
                    used.add(header);
                    return header;
                }
            }
        }
        return null;
    }

    private static boolean isNumericColumn(String header, List<RawRecord> samples) {
        for (RawRecord row : samples) {
            String value = row.get(header);
            if (value == null || value.isBlank()) {
                continue;
            }
            if (NumberParser.parse(value).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private static List<Pattern> patterns(String... regexes) {
        List<Pattern> compiled = new ArrayList<>(regexes.length);
        for (String regex : regexes) {
            compiled.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
        return List.copyOf(compiled);
    }
}
