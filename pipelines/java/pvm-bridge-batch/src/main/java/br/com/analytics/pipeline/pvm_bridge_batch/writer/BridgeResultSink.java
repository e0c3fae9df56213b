package br.com.analytics.pipeline.pvm_bridge_batch.writer;

import br.com.analytics.pipeline.pvm_bridge_batch.model.AggregationResult;
import br.com.analytics.pipeline.pvm_bridge_batch.model.BridgeResult;

@FunctionalInterface
public interface BridgeResultSink {

    void publish(AggregationResult aggregation, BridgeResult bridge) throws Exception;
}
