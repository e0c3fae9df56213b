package br.com.analytics.pipeline.pvm_bridge_batch.listener;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import br.com.analytics.pipeline.pvm_bridge_batch.reader.CancellationFlag;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

final class StopSignalListenerTest {

    @Test
    void cancelsOnceStopIsRequested() {
        CancellationFlag flag = new CancellationFlag();
        AtomicBoolean stop = new AtomicBoolean();
        StopSignalListener listener = new StopSignalListener(flag, stop::get);

        listener.beforeRead();
        assertFalse(flag.isCancelled());

        stop.set(true);
        listener.beforeRead();
        assertTrue(flag.isCancelled());
    }

    @Test
    void outsideARunningStepNothingIsCancelled() {
        CancellationFlag flag = new CancellationFlag();

        new StopSignalListener(flag).beforeRead();

        assertFalse(flag.isCancelled());
    }
}
