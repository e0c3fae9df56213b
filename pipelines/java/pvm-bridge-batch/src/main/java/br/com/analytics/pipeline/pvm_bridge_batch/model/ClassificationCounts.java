package br.com.analytics.pipeline.pvm_bridge_batch.model;

public record ClassificationCounts(
        int total,
        int newItems,
        int discontinued,
        int continuing
) {
}
