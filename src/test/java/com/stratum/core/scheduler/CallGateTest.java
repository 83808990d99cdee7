package com.stratum.core.scheduler;

import com.stratum.core.port.AnnotationTransportException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CallGateTest {

    @Test
    @DisplayName("returns the call's value")
    void returnsValue() throws Exception {
        try (var gate = new CallGate("t", 1, Duration.ofSeconds(5))) {
            assertEquals("ok", gate.call("analyzeBatch", 1, () -> "ok"));
        }
    }

    @Test
    @DisplayName("wraps call failures with the batch id")
    void wrapsFailures() {
        try (var gate = new CallGate("t", 1, Duration.ofSeconds(5))) {
            var e = assertThrows(AnnotationTransportException.class,
                    () -> gate.call("analyzeBatch", 4, () -> {
                        throw new IllegalStateException("502 bad gateway");
                    }));
            assertEquals(4, e.batchId());
            assertInstanceOf(IllegalStateException.class, e.getCause());
        }
    }

    @Test
    @DisplayName("abort interrupts the call in flight and refuses new ones")
    void abortCancels() throws Exception {
        try (var gate = new CallGate("t", 2, Duration.ofSeconds(30))) {
            var started = new CountDownLatch(1);
            var outcome = new AtomicReference<Throwable>();
            Thread caller = new Thread(() -> {
                try {
                    gate.call("analyzeBatch", 1, () -> {
                        started.countDown();
                        try {
                            Thread.sleep(30_000);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return "late";
                    });
                } catch (Throwable t) {
                    outcome.set(t);
                }
            });
            caller.start();
            assertTrue(started.await(5, TimeUnit.SECONDS));

            gate.abort();
            caller.join(5_000);

            assertTrue(gate.isAborted());
            assertInstanceOf(CancellationException.class, outcome.get());
            assertThrows(CancellationException.class, () -> gate.call("analyzeBatch", 2, () -> "x"));
        }
    }

    @Test
    @DisplayName("rejects a concurrency bound below one")
    void rejectsZeroConcurrency() {
        assertThrows(IllegalArgumentException.class, () -> new CallGate("t", 0, Duration.ofSeconds(1)));
    }
}
