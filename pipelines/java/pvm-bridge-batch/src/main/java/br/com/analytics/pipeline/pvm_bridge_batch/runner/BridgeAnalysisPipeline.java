package br.com.analytics.pipeline.pvm_bridge_batch.runner;

import br.com.analytics.pipeline.pvm_bridge_batch.bridge.BridgeCalculator;
import br.com.analytics.pipeline.pvm_bridge_batch.config.AggregationSettings;
import br.com.analytics.pipeline.pvm_bridge_batch.model.AggregationResult;
import br.com.analytics.pipeline.pvm_bridge_batch.model.BridgeOptions;
import br.com.analytics.pipeline.pvm_bridge_batch.model.BridgeResult;
import br.com.analytics.pipeline.pvm_bridge_batch.model.RawRecord;
import br.com.analytics.pipeline.pvm_bridge_batch.processor.AggregationContext;
import br.com.analytics.pipeline.pvm_bridge_batch.reader.CancellationFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.infrastructure.item.ExecutionContext;
import org.springframework.batch.infrastructure.item.ItemReader;
import org.springframework.batch.infrastructure.item.ItemStream;

/**
 * Runs reader, aggregation and bridge in the calling thread, outside a batch job.
 */
public class BridgeAnalysisPipeline {

    private static final Logger log = LoggerFactory.getLogger(BridgeAnalysisPipeline.class);

    private final AggregationSettings settings;
    private final BridgeCalculator calculator;

    public BridgeAnalysisPipeline(AggregationSettings settings, BridgeOptions options) {
        this.settings = settings;
        this.calculator = new BridgeCalculator(options);
    }

    public AnalysisOutcome run(ItemReader<RawRecord> reader) {
        return run(reader, new CancellationFlag());
    }

    /**
     * @throws AnalysisAbortedException when the reader fails; the exception carries the statistics of
     *                                  the rows processed before the failure
     */
    public AnalysisOutcome run(ItemReader<RawRecord> reader, CancellationFlag cancellation) {
        AggregationContext context = AggregationContext.create(settings);
        for (String warning : settings.periods().warnings()) {
            log.warn(warning);
        }

        ItemStream stream = reader instanceof ItemStream ? (ItemStream) reader : null;
        try {
            if (stream != null) {
                stream.open(new ExecutionContext());
            }
            // The flag is polled before every read, so readers that do not share it stop too.
            RawRecord record;
            while (!cancellation.isCancelled() && (record = reader.read()) != null) {
                context.processRow(record);
            }
        } catch (Exception e) {
            log.error("Analysis aborted after {} rows: {}", context.statistics().totalRows(), e.getMessage());
            throw new AnalysisAbortedException("Input could not be read: " + e.getMessage(), context.statistics(), e);
        } finally {
            if (stream != null) {
                stream.close();
            }
        }

        if (cancellation.isCancelled()) {
            log.info("Analysis cancelled after {} rows.", context.statistics().totalRows());
            return AnalysisOutcome.cancelled(context.statistics());
        }

        AggregationResult aggregation = context.finalizeResult();
        BridgeResult bridge = calculator.calculate(aggregation);
        log.info("Analysis complete. {} buckets, {} bridge(s).", aggregation.buckets().size(), bridge.bridges().size());
        return AnalysisOutcome.completed(aggregation, bridge);
    }
}
