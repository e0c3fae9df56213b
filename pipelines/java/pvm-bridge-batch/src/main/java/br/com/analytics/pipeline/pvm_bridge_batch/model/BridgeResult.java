package br.com.analytics.pipeline.pvm_bridge_batch.model;

import java.util.List;
import java.util.Optional;

public record BridgeResult(
        BridgeOptions options,
        List<PeriodBridge> bridges
) {

    public BridgeResult {
        bridges = List.copyOf(bridges);
    }

    public Optional<PeriodBridge> bridge(String key) {
        return bridges.stream()
                .filter(bridge -> bridge.key().equals(key))
                .findFirst();
    }
}
