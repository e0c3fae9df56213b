package br.com.analytics.pipeline.pvm_bridge_batch.tasklet;

import br.com.analytics.pipeline.pvm_bridge_batch.bridge.BridgeCalculator;
import br.com.analytics.pipeline.pvm_bridge_batch.model.AggregationResult;
import br.com.analytics.pipeline.pvm_bridge_batch.model.BridgeResult;
import br.com.analytics.pipeline.pvm_bridge_batch.processor.AggregationContext;
import br.com.analytics.pipeline.pvm_bridge_batch.processor.AggregationProcessor;
import br.com.analytics.pipeline.pvm_bridge_batch.reader.CancellationFlag;
import br.com.analytics.pipeline.pvm_bridge_batch.writer.BridgeResultSink;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

public class BridgeCalculationTasklet implements Tasklet {

    private static final Logger log = LoggerFactory.getLogger(BridgeCalculationTasklet.class);

    private final AggregationProcessor processor;
    private final BridgeCalculator calculator;
    private final BridgeResultSink sink;
    private final CancellationFlag cancellation;

    private @Nullable BridgeResult lastResult;

    public BridgeCalculationTasklet(AggregationProcessor processor, BridgeCalculator calculator,
                                    BridgeResultSink sink, CancellationFlag cancellation) {
        this.processor = processor;
        this.calculator = calculator;
        this.sink = sink;
        this.cancellation = cancellation;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        AggregationContext context = processor.getContext();

        if (cancellation.isCancelled()) {
            log.info("Run cancelled after {} rows; bridge not calculated.", context.statistics().totalRows());
            return RepeatStatus.FINISHED;
        }

        AggregationResult aggregation = context.finalizeResult();
        log.info("Aggregation complete. {} buckets from {} included rows.",
                aggregation.buckets().size(), aggregation.statistics().includedRows());

        BridgeResult bridge = calculator.calculate(aggregation);
        log.info("Calculated {} bridge(s) in {} mode.", bridge.bridges().size(), bridge.options().mode().id());

        sink.publish(aggregation, bridge);
        lastResult = bridge;
        return RepeatStatus.FINISHED;
    }

    public @Nullable BridgeResult getLastResult() {
        return lastResult;
    }
}
