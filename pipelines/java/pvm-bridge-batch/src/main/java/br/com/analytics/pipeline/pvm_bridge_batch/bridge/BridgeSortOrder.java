package br.com.analytics.pipeline.pvm_bridge_batch.bridge;

import br.com.analytics.pipeline.pvm_bridge_batch.model.BridgeBucketResult;

import java.util.function.ToDoubleFunction;

public enum BridgeSortOrder {
    TOTAL(BridgeBucketResult::totalChange),
    PRICE(BridgeBucketResult::priceImpact),
    VOLUME(BridgeBucketResult::volumeImpact),
    MIX(BridgeBucketResult::mixImpact),
    COST(BridgeBucketResult::costImpact);

    private final ToDoubleFunction<BridgeBucketResult> field;

    BridgeSortOrder(ToDoubleFunction<BridgeBucketResult> field) {
        this.field = field;
    }

    public double magnitude(BridgeBucketResult result) {
        return Math.abs(field.applyAsDouble(result));
    }
}
