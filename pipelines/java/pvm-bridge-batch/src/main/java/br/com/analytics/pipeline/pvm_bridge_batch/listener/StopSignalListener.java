package br.com.analytics.pipeline.pvm_bridge_batch.listener;

import br.com.analytics.pipeline.pvm_bridge_batch.model.RawRecord;
import br.com.analytics.pipeline.pvm_bridge_batch.reader.CancellationFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.listener.ItemReadListener;
import org.springframework.batch.core.scope.context.StepContext;
import org.springframework.batch.core.scope.context.StepSynchronizationManager;

import java.util.function.BooleanSupplier;

/**
 * Turns a stop request on the running step ({@code JobOperator.stop}) into a cancellation of the run.
 */
public class StopSignalListener implements ItemReadListener<RawRecord> {

    private static final Logger log = LoggerFactory.getLogger(StopSignalListener.class);

    private final CancellationFlag cancellation;
    private final BooleanSupplier stopRequested;

    public StopSignalListener(CancellationFlag cancellation) {
        this(cancellation, StopSignalListener::currentStepTerminating);
    }

    StopSignalListener(CancellationFlag cancellation, BooleanSupplier stopRequested) {
        this.cancellation = cancellation;
        this.stopRequested = stopRequested;
    }

    @Override
    public void beforeRead() {
        if (!cancellation.isCancelled() && stopRequested.getAsBoolean()) {
            log.info("Stop requested for the running step, cancelling analysis.");
            cancellation.cancel();
        }
    }

    private static boolean currentStepTerminating() {
        StepContext context = StepSynchronizationManager.getContext();
        return context != null && context.getStepExecution().isTerminateOnly();
    }
}
