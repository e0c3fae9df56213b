package br.com.analytics.pipeline.pvm_bridge_batch.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record BridgeBucketResult(
        String key,
        Map<String, String> dimensions,
        PeriodSnapshot from,
        PeriodSnapshot to,
        double totalChange,
        double priceImpact,
        double volumeImpact,
        double mixImpact,
        double costImpact,
        ItemClassification classification
) {

    public BridgeBucketResult {
        dimensions = Collections.unmodifiableMap(new LinkedHashMap<>(dimensions));
    }

    public boolean isNew() {
        return classification == ItemClassification.NEW;
    }

    public boolean isDiscontinued() {
        return classification == ItemClassification.DISCONTINUED;
    }

    /**
     * Change in gross margin when cost is bridged separately: {@code totalChange + costImpact}.
     */
    public double marginChange() {
        return totalChange + costImpact;
    }
}
