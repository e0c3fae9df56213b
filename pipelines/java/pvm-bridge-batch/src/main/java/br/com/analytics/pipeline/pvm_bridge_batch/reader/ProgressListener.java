package br.com.analytics.pipeline.pvm_bridge_batch.reader;

/**
 * Observational progress callback. {@code totalBytes} is -1 when the input size is unknown.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (bytesRead, totalBytes, rowsRead) -> { };

    void onProgress(long bytesRead, long totalBytes, long rowsRead);
}
