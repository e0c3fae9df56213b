package br.com.analytics.pipeline.pvm_bridge_batch.reader;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Single-pass delimited text tokenizer fed one chunk at a time.
 * <p>
 * The field buffer, the row in progress and the quote state survive between {@link #feed} calls, so
 * a chunk may end anywhere (mid-field, inside quotes, between {@code \r} and {@code \n}) and only
 * complete rows are handed to the sink. {@link #finish} flushes the trailing unterminated row.
 * </p>
 * <ul>
 *   <li>Unquoted fields are trimmed; whitespace around a quoted section is dropped.</li>
 *   <li>{@code ""} inside quotes is a literal quote; delimiters and line breaks inside quotes are
 *   kept verbatim.</li>
 *   <li>{@code \r}, {@code \n} and {@code \r\n} each end one row.</li>
 *   <li>Rows made of a single empty field are dropped.</li>
 *   <li>Malformed quoting never fails; stray quotes degrade to literal text.</li>
 * </ul>
 */
public final class DelimitedRowTokenizer {

    private static final char QUOTE = '"';

    private final char delimiter;
    private final StringBuilder field = new StringBuilder(64);
    private List<String> row = new ArrayList<>();
    private boolean inQuotes;
    private boolean quoteSeen;
    private boolean skipLineFeed;
    private int quoteStart = -1;
    private int quoteEnd = -1;

    public DelimitedRowTokenizer(char delimiter) {
        this.delimiter = delimiter;
    }

    public void feed(CharSequence chunk, Consumer<List<String>> sink) {
        final int n = chunk.length();
        for (int i = 0; i < n; i++) {
            final char c = chunk.charAt(i);

            if (skipLineFeed) {
                skipLineFeed = false;
                if (c == '\n') continue;
            }

            // previous char closed or escaped a quote; only this char can tell which
            if (quoteSeen) {
                quoteSeen = false;
                if (c == QUOTE) {
                    field.append(QUOTE);
                    continue;
                }
                inQuotes = false;
                quoteEnd = field.length();
            }

            if (inQuotes) {
                if (c == QUOTE) {
                    quoteSeen = true;
                } else {
                    field.append(c);
                }
                continue;
            }

            if (c == QUOTE) {
                inQuotes = true;
                if (quoteStart < 0) quoteStart = field.length();
            } else if (c == delimiter) {
                endField();
            } else if (c == '\r') {
                endRow(sink);
                skipLineFeed = true;
            } else if (c == '\n') {
                endRow(sink);
            } else {
                field.append(c);
            }
        }
    }

    /**
     * Flushes the last row as if the input ended with a line break.
     */
    public void finish(Consumer<List<String>> sink) {
        if (quoteSeen) {
            quoteSeen = false;
            inQuotes = false;
            quoteEnd = field.length();
        }
        if (inQuotes) {
            inQuotes = false;
            quoteEnd = field.length();
        }
        if (field.length() > 0 || !row.isEmpty() || quoteStart >= 0) {
            endRow(sink);
        }
        skipLineFeed = false;
    }

    /**
     * True while a quoted section is open at the current position.
     */
    public boolean insideQuotes() {
        return inQuotes && !quoteSeen;
    }

    private void endField() {
        row.add(fieldValue());
        field.setLength(0);
        quoteStart = -1;
        quoteEnd = -1;
    }

    private void endRow(Consumer<List<String>> sink) {
        endField();
        List<String> completed = row;
        row = new ArrayList<>(completed.size());
        if (completed.size() == 1 && completed.get(0).isEmpty()) {
            return;
        }
        sink.accept(completed);
    }

    private String fieldValue() {
        if (quoteStart < 0) {
            return field.toString().strip();
        }
        int from = 0;
        while (from < quoteStart && Character.isWhitespace(field.charAt(from))) from++;
        int to = field.length();
        int protectedEnd = Math.max(quoteEnd, from);
        while (to > protectedEnd && Character.isWhitespace(field.charAt(to - 1))) to--;
        return field.substring(from, to);
    }
}
