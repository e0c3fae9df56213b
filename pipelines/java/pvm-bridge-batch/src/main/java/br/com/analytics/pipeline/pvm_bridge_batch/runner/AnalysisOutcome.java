package br.com.analytics.pipeline.pvm_bridge_batch.runner;

import br.com.analytics.pipeline.pvm_bridge_batch.model.AggregationResult;
import br.com.analytics.pipeline.pvm_bridge_batch.model.BridgeResult;
import br.com.analytics.pipeline.pvm_bridge_batch.model.RunStatistics;
import org.jspecify.annotations.Nullable;

public record AnalysisOutcome(
        @Nullable AggregationResult aggregation,
        @Nullable BridgeResult bridge,
        RunStatistics statistics,
        boolean cancelled
) {

    static AnalysisOutcome cancelled(RunStatistics statistics) {
        return new AnalysisOutcome(null, null, statistics, true);
    }

    static AnalysisOutcome completed(AggregationResult aggregation, BridgeResult bridge) {
        return new AnalysisOutcome(aggregation, bridge, aggregation.statistics(), false);
    }
}
