package br.com.analytics.pipeline.pvm_bridge_batch.reader;

import java.util.concurrent.atomic.AtomicBoolean;

public final class CancellationFlag {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
