package br.com.analytics.pipeline.pvm_bridge_batch.config;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

public record AggregationSettings(
        ColumnMapping columns,
        @Nullable String dateFormatId,
        PeriodPlan periods
) {

    public AggregationSettings {
        Objects.requireNonNull(columns, "columns");
        Objects.requireNonNull(periods, "periods");
    }
}
