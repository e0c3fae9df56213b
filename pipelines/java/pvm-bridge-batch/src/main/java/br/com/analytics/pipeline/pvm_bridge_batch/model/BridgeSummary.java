package br.com.analytics.pipeline.pvm_bridge_batch.model;

/**
 * Bucket results summed after decomposition. Percentages are relative to {@code |totalChange|},
 * {@code changePct} to {@code |from.value|}; each is 0 when its denominator is 0.
 */
public record BridgeSummary(
        SummaryPeriod from,
        SummaryPeriod to,
        double totalChange,
        double priceImpact,
        double volumeImpact,
        double mixImpact,
        double costImpact,
        double priceImpactPct,
        double volumeImpactPct,
        double mixImpactPct,
        double costImpactPct,
        double changePct,
        ClassificationCounts counts
) {
}
