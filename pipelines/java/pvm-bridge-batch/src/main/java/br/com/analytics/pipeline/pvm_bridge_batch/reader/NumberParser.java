package br.com.analytics.pipeline.pvm_bridge_batch.reader;

import org.jspecify.annotations.Nullable;

import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Lenient amount parser for spreadsheet-style numbers: currency symbols and thousands separators are
 * stripped, {@code (123)} and {@code -123} are negative. Anything else that is not a plain decimal
 * number is a parse failure, never a silent zero.
 */
public final class NumberParser {

    private static final Pattern PLAIN_DECIMAL = Pattern.compile("\\+?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final String STRIPPED = "$€£¥,";

    private NumberParser() {
    }

    public static OptionalDouble parse(@Nullable String text) {
        if (text == null) {
            return OptionalDouble.empty();
        }
        String value = text.strip();
        if (value.isEmpty()) {
            return OptionalDouble.empty();
        }

        boolean negative = false;
        if (value.length() >= 2 && value.charAt(0) == '(' && value.charAt(value.length() - 1) == ')') {
            negative = true;
            value = value.substring(1, value.length() - 1);
        }

        StringBuilder digits = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (STRIPPED.indexOf(c) < 0) {
                digits.append(c);
            }
        }
        value = digits.toString().strip();

        if (value.startsWith("-")) {
            negative = true;
            value = value.substring(1).strip();
        }
        if (!PLAIN_DECIMAL.matcher(value).matches()) {
            return OptionalDouble.empty();
        }
        double parsed = Double.parseDouble(value);
        return OptionalDouble.of(negative ? -parsed : parsed);
    }
}
