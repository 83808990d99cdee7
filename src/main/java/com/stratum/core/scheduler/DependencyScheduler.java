package com.stratum.core.scheduler;

import com.stratum.core.batch.AnalysisBatch;
import com.stratum.core.events.ProgressEvent;
import com.stratum.core.logging.MdcContext;
import com.stratum.core.metrics.StratumMetrics;
import com.stratum.core.port.AnnotationPort;
import com.stratum.core.port.BatchAnnotation;
import com.stratum.core.tree.StatementNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Runs analysis batches with bounded concurrency while honouring the children-before-parents rule.
 * <p>
 * Every batch becomes a stage that starts only once the completion signals of all direct
 * children of its members have fired. A started stage then takes a permit from the run's
 * {@link CallGate}, calls {@link AnnotationPort#analyzeBatch}, and hands the result to the
 * {@link BatchResultSink} in completion order.
 * <p>
 * The first failure aborts the run: pending stages are cancelled, in-flight calls are
 * interrupted, running stages are awaited, and the failure is rethrown.
 */
public class DependencyScheduler {

    private static final Logger log = LoggerFactory.getLogger(DependencyScheduler.class);

    private final AnnotationPort port;
    private final BatchResultSink sink;
    private final String fileId;
    private final String locale;
    private final StratumMetrics metrics;
    private final Function<AnalysisBatch, String> contexts;

    /**
     * @param contexts supplies the parent context sent with each batch
     */
    public DependencyScheduler(AnnotationPort port, BatchResultSink sink, String fileId, String locale,
                               StratumMetrics metrics, Function<AnalysisBatch, String> contexts) {
        this.port = port;
        this.sink = sink;
        this.fileId = fileId;
        this.locale = locale;
        this.metrics = metrics;
        this.contexts = contexts;
    }

    DependencyScheduler(AnnotationPort port, BatchResultSink sink) {
        this(port, sink, "test", "en", null, batch -> "");
    }

    /**
     * Runs all batches under a gate of its own.
     */
    public void runAll(List<AnalysisBatch> batches, int maxConcurrency, Duration deadline) {
        try (var gate = new CallGate(fileId, maxConcurrency, deadline)) {
            runAll(batches, gate);
        }
    }

    /**
     * Runs all batches under a gate shared with the rest of the file run.
     *
     * @throws RuntimeException the first failure, after all running stages have stopped
     */
    public void runAll(List<AnalysisBatch> batches, CallGate gate) {
        if (batches.isEmpty()) {
            return;
        }
        var counter = new AtomicInteger();
        ExecutorService workers = Executors.newFixedThreadPool(gate.maxConcurrency(), r -> {
            Thread t = new Thread(r, "batch-" + fileId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        var stages = new CopyOnWriteArrayList<CompletableFuture<Void>>();
        var failure = new AtomicReference<Throwable>();

        try {
            for (AnalysisBatch batch : batches) {
                CompletableFuture<Void> stage = dependenciesOf(batch)
                        .thenRunAsync(() -> execute(batch, gate), workers);
                stages.add(stage);
                stage.whenComplete((ignored, error) -> {
                    if (error != null && !(unwrap(error) instanceof CancellationException)) {
                        if (failure.compareAndSet(null, unwrap(error))) {
                            log.error("Batch #{} failed, aborting {} remaining stage(s): {}",
                                    batch.batchId(), stages.size(), unwrap(error).getMessage());
                            abort(gate, stages);
                        }
                    }
                });
            }
            if (failure.get() != null) {
                abort(gate, stages);
            }
            CompletableFuture.allOf(stages.toArray(new CompletableFuture[0]))
                    .handle((ignored, error) -> null)
                    .join();
        } finally {
            awaitWorkers(workers);
        }

        Throwable first = failure.get();
        if (first instanceof RuntimeException re) {
            throw re;
        }
        if (first instanceof Error err) {
            throw err;
        }
        if (first != null) {
            throw new CompletionException(first);
        }
        log.debug("All {} batches of {} completed", batches.size(), fileId);
    }

    private static CompletableFuture<Void> dependenciesOf(AnalysisBatch batch) {
        var signals = new ArrayList<CompletableFuture<Void>>();
        for (StatementNode member : batch.nodes()) {
            for (StatementNode child : member.children()) {
                signals.add(child.completionSignal().asFuture());
            }
        }
        return CompletableFuture.allOf(signals.toArray(new CompletableFuture[0]));
    }

    private void execute(AnalysisBatch batch, CallGate gate) {
        MdcContext.setBatch(fileId, batch.batchId(), ProgressEvent.SEMANTIC);
        try {
            if (gate.isAborted()) {
                log.debug("Skipping batch #{}: run aborted", batch.batchId());
                return;
            }
            log.debug("Dispatching batch #{} ({} node(s), {} tokens)",
                    batch.batchId(), batch.nodes().size(), batch.tokenTotal());
            String context = contexts.apply(batch);
            long startMs = System.currentTimeMillis();
            BatchAnnotation result = gate.call("analyzeBatch", batch.batchId(),
                    () -> port.analyzeBatch(batch.payload(), batch.ranges(), context, locale));
            if (metrics != null) {
                metrics.recordBatchDuration(batch.isSingletonParent(), System.currentTimeMillis() - startMs);
            }
            sink.submit(batch, result == null ? BatchAnnotation.empty() : result);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Batch #" + batch.batchId() + " interrupted");
        } finally {
            MdcContext.clear();
        }
    }

    private static void abort(CallGate gate, List<CompletableFuture<Void>> stages) {
        gate.abort();
        for (CompletableFuture<Void> stage : stages) {
            stage.cancel(false);
        }
    }

    private static void awaitWorkers(ExecutorService workers) {
        workers.shutdown();
        try {
            while (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                log.info("Waiting for running batches to stop...");
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
