package br.com.analytics.pipeline.pvm_bridge_batch.reader;

import br.com.analytics.pipeline.pvm_bridge_batch.model.RawRecord;
import org.jspecify.annotations.Nullable;
import org.springframework.batch.infrastructure.item.ItemReader;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Reads pre-tokenized rows, such as the cell arrays of a spreadsheet sheet, into the same
 * {@link RawRecord} shape as {@link ChunkedDelimitedItemReader}. Cells are rendered with
 * {@link String#valueOf(Object)}, nulls as empty strings. The first non-blank row is the header and
 * rows whose cells are all blank are skipped.
 */
public class TabularRowItemReader implements ItemReader<RawRecord> {

    private final Iterator<? extends List<?>> rows;
    private final CancellationFlag cancellation;
    private final int pollInterval;
    private @Nullable RawRecordMapper mapper;
    private long rowsRead;
    private boolean cancelled;

    public TabularRowItemReader(Iterator<? extends List<?>> rows) {
        this(rows, new CancellationFlag(), 100);
    }

    public TabularRowItemReader(Iterator<? extends List<?>> rows, CancellationFlag cancellation, int pollInterval) {
        if (pollInterval <= 0) {
            throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
        }
        this.rows = rows;
        this.cancellation = cancellation;
        this.pollInterval = pollInterval;
    }

    @Override
    public @Nullable RawRecord read() {
        while (!cancelled && rows.hasNext()) {
            if (rowsRead % pollInterval == 0 && cancellation.isCancelled()) {
                cancelled = true;
                return null;
            }
            List<String> cells = render(rows.next());
            if (isBlank(cells)) {
                continue;
            }
            if (mapper == null) {
                mapper = new RawRecordMapper(cells);
                continue;
            }
            rowsRead++;
            return mapper.mapRow(cells);
        }
        return null;
    }

    public @Nullable List<String> getHeader() {
        return mapper == null ? null : mapper.header();
    }

    public long getRowsRead() {
        return rowsRead;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    private static List<String> render(List<?> row) {
        List<String> cells = new ArrayList<>(row.size());
        for (Object cell : row) {
            cells.add(cell == null ? "" : String.valueOf(cell).strip());
        }
        return cells;
    }

    private static boolean isBlank(List<String> cells) {
        for (String cell : cells) {
            if (!cell.isEmpty()) {
                return false;
            }
        }
        return true;
    }
}
