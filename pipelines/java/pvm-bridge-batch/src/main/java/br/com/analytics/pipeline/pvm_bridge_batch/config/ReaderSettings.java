package br.com.analytics.pipeline.pvm_bridge_batch.config;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

public record ReaderSettings(
        Charset charset,
        char delimiter,
        int chunkSize,
        int progressInterval
) {

    public static final int DEFAULT_CHUNK_SIZE = 1024 * 1024;
    public static final int DEFAULT_PROGRESS_INTERVAL = 100;
    public static final ReaderSettings DEFAULTS =
            new ReaderSettings(StandardCharsets.UTF_8, ',', DEFAULT_CHUNK_SIZE, DEFAULT_PROGRESS_INTERVAL);

    public ReaderSettings {
        if (chunkSize <= 0) {
            throw new ConfigurationException("Chunk size must be positive, was " + chunkSize);
        }
        if (progressInterval <= 0) {
            throw new ConfigurationException("Progress interval must be positive, was " + progressInterval);
        }
        if (delimiter == '"' || delimiter == '\r' || delimiter == '\n') {
            throw new ConfigurationException("Unsupported field delimiter: " + (int) delimiter);
        }
    }

    public ReaderSettings withChunkSize(int size) {
        return new ReaderSettings(charset, delimiter, size, progressInterval);
    }
}
