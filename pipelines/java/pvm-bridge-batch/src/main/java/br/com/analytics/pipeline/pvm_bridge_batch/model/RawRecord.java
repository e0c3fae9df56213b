package br.com.analytics.pipeline.pvm_bridge_batch.model;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record RawRecord(
        Map<String, String> fields
) {

    public RawRecord {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public @Nullable String get(String column) {
        return fields.get(column);
    }
}
