package br.com.analytics.pipeline.pvm_bridge_batch.model;

public record PeriodSnapshot(
        double value,
        double price,
        double volume,
        double sales,
        double cost,
        long count
) {
}
