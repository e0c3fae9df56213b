package br.com.analytics.pipeline.pvm_bridge_batch.reader;

import br.com.analytics.pipeline.pvm_bridge_batch.config.ReaderSettings;
import br.com.analytics.pipeline.pvm_bridge_batch.model.RawRecord;
import br.com.analytics.pipeline.pvm_bridge_batch.period.DateFormats;
import org.jspecify.annotations.Nullable;
import org.springframework.batch.infrastructure.item.ExecutionContext;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lightweight passes over an input ahead of the analysis run: a header preview and a date span scan.
 */
public final class DatasetScanner {

    public static final int DEFAULT_SAMPLE_ROWS = 100;

    private DatasetScanner() {
    }

    public static DatasetPreview scan(Resource resource, ReaderSettings settings, int maxRows) throws IOException {
        ChunkedDelimitedItemReader reader = new ChunkedDelimitedItemReader(resource, settings);
        reader.open(new ExecutionContext());
        try {
            List<RawRecord> rows = new ArrayList<>();
            RawRecord row;
            while (rows.size() < maxRows && (row = reader.read()) != null) {
                rows.add(row);
            }
            List<String> header = reader.getHeader();
            return new DatasetPreview(header == null ? List.of() : header, rows);
        } finally {
            reader.close();
        }
    }

    /**
     * Full pass over {@code dateColumn} collecting the earliest and latest parsable date. Used to
     * offer fiscal years and default period choices before the analysis run.
     */
    public static DateRangeScan dateRange(Resource resource, ReaderSettings settings, String dateColumn,
                                          @Nullable String dateFormatId) throws IOException {
        ChunkedDelimitedItemReader reader = new ChunkedDelimitedItemReader(resource, settings);
        reader.open(new ExecutionContext());
        try {
            LocalDate min = null;
            LocalDate max = null;
            long rows = 0L;
            long unparsed = 0L;
            RawRecord row;
            while ((row = reader.read()) != null) {
                rows++;
                Optional<LocalDate> date = DateFormats.parse(row.get(dateColumn), dateFormatId);
                if (date.isEmpty()) {
                    unparsed++;
                    continue;
                }
                if (min == null || date.get().isBefore(min)) min = date.get();
                if (max == null || date.get().isAfter(max)) max = date.get();
            }
            return new DateRangeScan(min, max, rows, unparsed);
        } finally {
            reader.close();
        }
    }
}
