package br.com.analytics.pipeline.pvm_bridge_batch.model;

import java.util.List;

public record PeriodBridge(
        String key,
        PeriodTag from,
        PeriodTag to,
        List<BridgeBucketResult> detail,
        BridgeSummary summary
) {

    public PeriodBridge {
        detail = List.copyOf(detail);
    }
}
