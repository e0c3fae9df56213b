package br.com.analytics.pipeline.pvm_bridge_batch.runner;

import br.com.analytics.pipeline.pvm_bridge_batch.model.RunStatistics;

/**
 * Fatal input failure. Carries the row accounting gathered before the failure.
 */
public class AnalysisAbortedException extends RuntimeException {

    private final RunStatistics partialStatistics;

    public AnalysisAbortedException(String message, RunStatistics partialStatistics, Throwable cause) {
        super(message, cause);
        this.partialStatistics = partialStatistics;
    }

    public RunStatistics getPartialStatistics() {
        return partialStatistics;
    }
}
