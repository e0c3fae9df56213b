package br.com.analytics.pipeline.pvm_bridge_batch.writer;

import br.com.analytics.pipeline.pvm_bridge_batch.bridge.MethodologyCatalog;
import br.com.analytics.pipeline.pvm_bridge_batch.model.AggregationResult;
import br.com.analytics.pipeline.pvm_bridge_batch.model.BridgeResult;
import br.com.analytics.pipeline.pvm_bridge_batch.model.BridgeSummary;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PeriodBridge;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PeriodTag;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PeriodTotals;
import br.com.analytics.pipeline.pvm_bridge_batch.model.RunStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;

public class LoggingBridgeResultSink implements BridgeResultSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingBridgeResultSink.class);

    @Override
    public void publish(AggregationResult aggregation, BridgeResult bridge) {
        RunStatistics stats = aggregation.statistics();
        log.info("Rows: {} total, {} included, {} excluded ({} parse errors, {} outside periods, {} non-positive)",
                stats.totalRows(), stats.includedRows(), stats.excludedRows(),
                stats.parseErrors(), stats.outsidePeriodRows(), stats.negativeRows());
        log.info("Data range {} .. {}, {} buckets", aggregation.minDate(), aggregation.maxDate(), stats.uniqueKeys());

        for (Map.Entry<PeriodTag, PeriodTotals> entry : aggregation.negatives().entrySet()) {
            PeriodTotals negatives = entry.getValue();
            if (negatives.count() > 0) {
                log.info("Excluded non-positive rows {}: {} rows, sales {}, quantity {}",
                        entry.getKey(), negatives.count(), format(negatives.sales()), format(negatives.quantity()));
            }
        }

        log.info("Methodology: {}", MethodologyCatalog.describe(bridge.options()).title());
        for (PeriodBridge periodBridge : bridge.bridges()) {
            BridgeSummary summary = periodBridge.summary();
            log.info("Bridge {}: {} -> {} | change {} ({}%) | price {} | volume {} | mix {} | cost {} | new {}, discontinued {}, continuing {}",
                    periodBridge.key(),
                    format(summary.from().value()),
                    format(summary.to().value()),
                    format(summary.totalChange()),
                    format(summary.changePct()),
                    format(summary.priceImpact()),
                    format(summary.volumeImpact()),
                    format(summary.mixImpact()),
                    format(summary.costImpact()),
                    summary.counts().newItems(),
                    summary.counts().discontinued(),
                    summary.counts().continuing());
        }
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%,.2f", value);
    }
}
