package br.com.analytics.pipeline.pvm_bridge_batch.reader;

import org.jspecify.annotations.Nullable;

import java.util.List;

public record DetectedColumns(
        @Nullable String date,
        @Nullable String sales,
        @Nullable String quantity,
        @Nullable String cost,
        List<String> dimensions
) {

    public DetectedColumns {
        dimensions = List.copyOf(dimensions);
    }
}
