package br.com.analytics.pipeline.pvm_bridge_batch.period;

import org.jspecify.annotations.Nullable;

public record DateFormatDetection(
        @Nullable DateFormatDescriptor format,
        double confidence
) {

    public static final DateFormatDetection NONE = new DateFormatDetection(null, 0d);

    public @Nullable String formatId() {
        return format == null ? null : format.id();
    }
}
