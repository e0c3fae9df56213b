package br.com.analytics.pipeline.pvm_bridge_batch.processor;

import br.com.analytics.pipeline.pvm_bridge_batch.config.AggregationSettings;
import br.com.analytics.pipeline.pvm_bridge_batch.model.RawRecord;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.infrastructure.item.ItemProcessor;

public class AggregationProcessor implements ItemProcessor<RawRecord, RawRecord> {

    private static final Logger log = LoggerFactory.getLogger(AggregationProcessor.class);

    private final AggregationContext context;

    public AggregationProcessor(AggregationSettings settings) {
        this.context = AggregationContext.create(settings);
        log.info("Aggregating {} mode, dimensions {}", settings.periods().mode(), settings.columns().dimensionColumns());
        for (String warning : settings.periods().warnings()) {
            log.warn(warning);
        }
    }

    public AggregationContext getContext() {
        return context;
    }

    @Override
    public @Nullable RawRecord process(RawRecord item) {
        context.processRow(item);
        return null;
    }
}
