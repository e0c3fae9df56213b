package br.com.analytics.pipeline.pvm_bridge_batch.model;

import java.util.Objects;

public record BridgeOptions(
        BridgeMode mode,
        PriceDefinition priceDefinition
) {

    public static final BridgeOptions PVM = new BridgeOptions(BridgeMode.PVM, PriceDefinition.MARGIN_PER_UNIT);

    public BridgeOptions {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(priceDefinition, "priceDefinition");
    }

    public boolean separateCostImpact() {
        return mode == BridgeMode.GM && priceDefinition == PriceDefinition.SALES_PER_UNIT;
    }
}
