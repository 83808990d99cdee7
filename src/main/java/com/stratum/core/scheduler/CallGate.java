package com.stratum.core.scheduler;

import com.stratum.core.port.AnnotationTimeoutException;
import com.stratum.core.port.AnnotationTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Bounds every external call of one file run: a global semaphore caps outstanding calls,
 * each call carries a deadline, and {@link #abort()} cancels whatever is in flight.
 * <p>
 * A deadline miss surfaces as {@link AnnotationTimeoutException}; any other failure of
 * the call is wrapped in {@link AnnotationTransportException}.
 */
public class CallGate implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CallGate.class);

    private final int maxConcurrency;
    private final Duration deadline;
    private final Semaphore permits;
    private final ExecutorService callExecutor;
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean aborted = new AtomicBoolean();

    public CallGate(String runName, int maxConcurrency, Duration deadline) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1: " + maxConcurrency);
        }
        this.maxConcurrency = maxConcurrency;
        this.deadline = deadline;
        this.permits = new Semaphore(maxConcurrency, true);
        var counter = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "call-" + runName + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public int maxConcurrency() {
        return maxConcurrency;
    }

    public boolean isAborted() {
        return aborted.get();
    }

    /**
     * Runs one external call under a permit and the deadline.
     *
     * @param callName name used in errors and logs
     * @param batchId  batch the call serves, 0 for non-batch calls
     * @throws CancellationException if the gate was aborted before or during the call
     */
    public <T> T call(String callName, int batchId, Supplier<T> call) throws InterruptedException {
        if (aborted.get()) {
            throw new CancellationException(callName + " not started: run aborted");
        }
        permits.acquire();
        Future<T> future = null;
        try {
            if (aborted.get()) {
                throw new CancellationException(callName + " not started: run aborted");
            }
            future = callExecutor.submit(call::get);
            inFlight.add(future);
            return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} for batch {} timed out after {}s", callName, batchId, deadline.toSeconds());
            throw new AnnotationTimeoutException(callName, batchId, deadline);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AnnotationTransportException ate && ate.batchId() == batchId) {
                throw ate;
            }
            throw new AnnotationTransportException(callName + " failed for batch " + batchId + ": "
                    + cause.getMessage(), batchId, cause);
        } finally {
            if (future != null) {
                inFlight.remove(future);
            }
            permits.release();
        }
    }

    /**
     * Stops new calls from starting and interrupts the ones in flight. Idempotent.
     */
    public void abort() {
        if (aborted.compareAndSet(false, true)) {
            log.warn("Aborting run, cancelling {} in-flight call(s)", inFlight.size());
            inFlight.forEach(f -> f.cancel(true));
        }
    }

    @Override
    public void close() {
        callExecutor.shutdownNow();
    }
}
