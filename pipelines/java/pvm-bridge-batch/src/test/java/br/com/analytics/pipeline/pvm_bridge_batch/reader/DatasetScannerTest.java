package br.com.analytics.pipeline.pvm_bridge_batch.reader;

import static org.junit.jupiter.api.Assertions.assertEquals;

import br.com.analytics.pipeline.pvm_bridge_batch.config.ReaderSettings;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;

final class DatasetScannerTest {

    @Test
    void readsHeaderAndFirstRowsOnly() throws Exception {
        String csv = "Date,Sales\n2024-01-01,1\n2024-01-02,2\n2024-01-03,3\n";
        ByteArrayResource resource = new ByteArrayResource(csv.getBytes(StandardCharsets.UTF_8));

        DatasetPreview preview = DatasetScanner.scan(resource, ReaderSettings.DEFAULTS, 2);

        assertEquals(List.of("Date", "Sales"), preview.headers());
        assertEquals(2, preview.sampleRows().size());
        assertEquals("2", preview.sampleRows().get(1).get("Sales"));
    }

    @Test
    void scansFullDateSpan() throws Exception {
        String csv = "Date,Sales\n03/15/2023,1\nbad,2\n01/02/2022,3\n12/31/2024,4\n";
        ByteArrayResource resource = new ByteArrayResource(csv.getBytes(StandardCharsets.UTF_8));

        DateRangeScan scan = DatasetScanner.dateRange(resource, ReaderSettings.DEFAULTS.withChunkSize(8), "Date", "MM/DD/YYYY");

        assertEquals(LocalDate.of(2022, 1, 2), scan.minDate());
        assertEquals(LocalDate.of(2024, 12, 31), scan.maxDate());
        assertEquals(4, scan.rows());
        assertEquals(1, scan.unparsedDates());
    }
}
