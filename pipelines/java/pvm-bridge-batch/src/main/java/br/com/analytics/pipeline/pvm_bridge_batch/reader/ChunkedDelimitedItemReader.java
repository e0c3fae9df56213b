package br.com.analytics.pipeline.pvm_bridge_batch.reader;

import br.com.analytics.pipeline.pvm_bridge_batch.config.ReaderSettings;
import br.com.analytics.pipeline.pvm_bridge_batch.model.RawRecord;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.infrastructure.item.ExecutionContext;
import org.springframework.batch.infrastructure.item.ItemStreamException;
import org.springframework.batch.infrastructure.item.ItemStreamReader;
import org.springframework.core.io.Resource;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.CharBuffer;
import java.util.ArrayDeque;
import java.util.List;

/**
 * Streams {@link RawRecord}s out of a delimited text resource, reading it {@code chunkSize}
 * characters at a time. Only the records of the current chunk are buffered; the first non-blank
 * row is the header.
 * <p>
 * The cancellation flag is polled before every chunk and every {@code progressInterval} rows; once
 * it is set the reader reports end of input and {@link #isCancelled()} turns true.
 * </p>
 */
public class ChunkedDelimitedItemReader implements ItemStreamReader<RawRecord> {

    private static final Logger log = LoggerFactory.getLogger(ChunkedDelimitedItemReader.class);
    static final String ROWS_READ_KEY = "delimited.reader.rows.read";

    private final Resource resource;
    private final ReaderSettings settings;
    private final CancellationFlag cancellation;
    private final ProgressListener progress;

    private final ArrayDeque<RawRecord> pending = new ArrayDeque<>();
    private DelimitedRowTokenizer tokenizer;
    private @Nullable RawRecordMapper mapper;
    private @Nullable Reader reader;
    private @Nullable CountingInputStream counter;
    private char[] buffer;
    private long totalBytes = -1L;
    private long rowsRead;
    private boolean endOfInput;
    private boolean cancelled;

    public ChunkedDelimitedItemReader(Resource resource, ReaderSettings settings) {
        this(resource, settings, new CancellationFlag(), ProgressListener.NONE);
    }

    public ChunkedDelimitedItemReader(Resource resource, ReaderSettings settings,
                                      CancellationFlag cancellation, ProgressListener progress) {
        this.resource = resource;
        this.settings = settings;
        this.cancellation = cancellation;
        this.progress = progress;
        this.tokenizer = new DelimitedRowTokenizer(settings.delimiter());
        this.buffer = new char[settings.chunkSize()];
    }

    @Override
    public void open(ExecutionContext executionContext) throws ItemStreamException {
        try {
            totalBytes = contentLength();
            counter = new CountingInputStream(resource.getInputStream());
            reader = new InputStreamReader(counter, settings.charset());
        } catch (IOException e) {
            throw new ItemStreamException("Failed to open input " + resource.getDescription(), e);
        }
        tokenizer = new DelimitedRowTokenizer(settings.delimiter());
        buffer = new char[settings.chunkSize()];
        pending.clear();
        mapper = null;
        rowsRead = 0L;
        endOfInput = false;
        cancelled = false;
        log.info("Reading {} in chunks of {} characters", resource.getDescription(), settings.chunkSize());
    }

    @Override
    public @Nullable RawRecord read() throws IOException {
        while (true) {
            if (cancelled) {
                return null;
            }
            RawRecord next = pending.poll();
            if (next != null) {
                rowsRead++;
                if (rowsRead % settings.progressInterval() == 0) {
                    reportProgress();
                    if (cancellation.isCancelled()) {
                        markCancelled();
                    }
                }
                return next;
            }
            if (endOfInput) {
                return null;
            }
            if (cancellation.isCancelled()) {
                markCancelled();
                return null;
            }
            readChunk();
        }
    }

    @Override
    public void update(ExecutionContext executionContext) throws ItemStreamException {
        executionContext.putLong(ROWS_READ_KEY, rowsRead);
    }

    @Override
    public void close() throws ItemStreamException {
        Reader current = reader;
        reader = null;
        if (current == null) {
            return;
        }
        try {
            current.close();
        } catch (IOException e) {
            throw new ItemStreamException("Failed to close input " + resource.getDescription(), e);
        }
    }

    public @Nullable List<String> getHeader() {
        return mapper == null ? null : mapper.header();
    }

    public long getRowsRead() {
        return rowsRead;
    }

    public long getBytesRead() {
        return counter == null ? 0L : counter.count;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    private void readChunk() throws IOException {
        if (reader == null) {
            throw new IllegalStateException("Reader not opened: call open() first");
        }
        int n = reader.read(buffer, 0, buffer.length);
        if (n < 0) {
            tokenizer.finish(this::acceptRow);
            endOfInput = true;
            reportProgress();
            log.debug("End of input after {} data rows", rowsRead + pending.size());
            return;
        }
        tokenizer.feed(CharBuffer.wrap(buffer, 0, n), this::acceptRow);
        reportProgress();
    }

    private void acceptRow(List<String> row) {
        if (mapper == null) {
            mapper = new RawRecordMapper(row);
            log.debug("Header: {}", row);
            return;
        }
        pending.add(mapper.mapRow(row));
    }

    private void markCancelled() {
        cancelled = true;
        pending.clear();
        log.info("Read cancelled after {} rows", rowsRead);
    }

    private void reportProgress() {
        progress.onProgress(getBytesRead(), totalBytes, rowsRead);
    }

    private long contentLength() {
        try {
            return resource.contentLength();
        } catch (IOException e) {
            log.debug("Size of {} unknown: {}", resource.getDescription(), e.getMessage());
            return -1L;
        }
    }

    private static final class CountingInputStream extends FilterInputStream {

        private long count;

        CountingInputStream(InputStream in) {
            super(in);
        }

        @Override
        public int read() throws IOException {
            int b = super.read();
            if (b >= 0) count++;
            return b;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            int n = super.read(b, off, len);
            if (n > 0) count += n;
            return n;
        }

        @Override
        public long skip(long n) throws IOException {
            long skipped = super.skip(n);
            count += skipped;
            return skipped;
        }
    }
}
