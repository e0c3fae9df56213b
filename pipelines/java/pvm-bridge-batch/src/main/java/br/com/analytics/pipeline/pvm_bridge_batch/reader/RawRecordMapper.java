package br.com.analytics.pipeline.pvm_bridge_batch.reader;

import br.com.analytics.pipeline.pvm_bridge_batch.model.RawRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a tokenized row onto the header: missing trailing fields become empty strings, fields beyond
 * the header are ignored.
 */
public class RawRecordMapper {

    private final List<String> header;

    public RawRecordMapper(List<String> header) {
        this.header = List.copyOf(header);
    }

    public List<String> header() {
        return header;
    }

    public RawRecord mapRow(List<String> values) {
        Map<String, String> fields = new LinkedHashMap<>(header.size() * 2);
        for (int i = 0; i < header.size(); i++) {
            fields.put(header.get(i), i < values.size() ? values.get(i) : "");
        }
        return new RawRecord(fields);
    }
}
