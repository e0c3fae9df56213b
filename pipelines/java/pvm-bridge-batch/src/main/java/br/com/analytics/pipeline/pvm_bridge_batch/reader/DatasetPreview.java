package br.com.analytics.pipeline.pvm_bridge_batch.reader;

import br.com.analytics.pipeline.pvm_bridge_batch.model.RawRecord;

import java.util.List;

public record DatasetPreview(
        List<String> headers,
        List<RawRecord> sampleRows
) {

    public DatasetPreview {
        headers = List.copyOf(headers);
        sampleRows = List.copyOf(sampleRows);
    }
}
