package com.stratum.core.pipeline;

import com.stratum.core.batch.TokenCounter;
import com.stratum.core.config.StratumProperties;
import com.stratum.core.events.EventBus;
import com.stratum.core.events.ProgressEvent;
import com.stratum.core.events.StratumEvent;
import com.stratum.core.logging.MdcContext;
import com.stratum.core.metrics.StratumMetrics;
import com.stratum.core.port.TransformationPort;
import com.stratum.core.reassembly.ReassemblyResult;
import com.stratum.core.reassembly.TreeReassembler;
import com.stratum.core.scheduler.CallGate;
import com.stratum.core.tree.CollectionException;
import com.stratum.core.tree.CollectionResult;
import com.stratum.core.tree.NodeClassifier;
import com.stratum.core.tree.SourceFile;
import com.stratum.core.tree.StatementNode;
import com.stratum.core.tree.TreeCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Transforms one file into target-language code.
 * <p>
 * Parents at or above {@code parentExpandTokens} are expanded: their placeholder skeleton is
 * transformed on its own and their children are handled recursively. Everything smaller is
 * transformed as one fragment with the enclosing skeleton as context. All calls run under
 * the same bounded gate and deadline as analysis; the results are spliced back together by
 * {@link TreeReassembler}.
 */
@Service
public class ConversionPipeline {

    private static final Logger log = LoggerFactory.getLogger(ConversionPipeline.class);

    private final TransformationPort transformationPort;
    private final TokenCounter tokenCounter;
    private final EventBus eventBus;
    private final StratumMetrics metrics;
    private final PipelineSettings settings;
    private final TreeReassembler reassembler = new TreeReassembler();

    @Autowired
    public ConversionPipeline(TransformationPort transformationPort, TokenCounter tokenCounter, EventBus eventBus,
                              StratumMetrics metrics, StratumProperties properties) {
        this(transformationPort, tokenCounter, eventBus, metrics, PipelineSettings.from(properties));
    }

    ConversionPipeline(TransformationPort transformationPort, TokenCounter tokenCounter, EventBus eventBus,
                       StratumMetrics metrics, PipelineSettings settings) {
        this.transformationPort = transformationPort;
        this.tokenCounter = tokenCounter;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.settings = settings;
    }

    public ConversionResult convert(SourceFile file, NodeClassifier classifier) {
        String fileId = file.fileId();
        MdcContext.setPhase(fileId, ProgressEvent.SEMANTIC);
        eventBus.publish(StratumEvent.of("file.started", fileId, Map.of("mode", "convert")));
        try {
            CollectionResult collection;
            try {
                collection = new TreeCollector(classifier, tokenCounter).collect(file);
            } catch (CollectionException e) {
                throw new FileAnalysisException(fileId, e.kind() + " " + e.startLine() + "~" + e.endLine(), e);
            }

            var frames = new HashSet<StatementNode>();
            var units = new ArrayList<StatementNode>();
            selectUnits(collection.root(), frames, units);
            log.info("{}: {} unit(s), {} expanded parent(s)", fileId, units.size(), frames.size());

            Map<StatementNode, String> outputs = transformAll(fileId, units, frames);
            ReassemblyResult result = reassembler.reassemble(units, outputs::get, outputs::get, frames::contains);

            if (!result.clean()) {
                if (metrics != null) {
                    metrics.recordUnmatchedPlaceholders(result.unmatchedPlaceholders().size());
                }
                eventBus.publish(StratumEvent.of("reassembly.warning", fileId,
                        Map.of("unmatchedPlaceholders", result.unmatchedPlaceholders())));
            }
            eventBus.publish(StratumEvent.of("file.completed", fileId, Map.of("units", units.size())));
            return new ConversionResult(fileId, result.text(), units.size(), result.unmatchedPlaceholders());
        } catch (FileAnalysisException e) {
            log.error("{}", e.getMessage());
            eventBus.publish(StratumEvent.of("file.failed", fileId, Map.of(
                    "location", e.location(), "error", String.valueOf(e.getCause().getMessage()))));
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Pre-order walk: an expanded parent is a frame and its children are visited; any other
     * node is a unit whose whole subtree is transformed at once.
     */
    void selectUnits(StatementNode node, Set<StatementNode> frames, List<StatementNode> units) {
        if (node == null) {
            return;
        }
        units.add(node);
        if (node.hasChildren() && node.tokenCount() >= settings.parentExpandTokens()) {
            frames.add(node);
            for (StatementNode child : node.children()) {
                selectUnits(child, frames, units);
            }
        }
    }

    private Map<StatementNode, String> transformAll(String fileId, List<StatementNode> units,
                                                    Set<StatementNode> frames) {
        Map<StatementNode, CompletableFuture<String>> futures = new IdentityHashMap<>();
        var failure = new AtomicReference<UnitFailure>();
        var done = new AtomicInteger();
        var counter = new AtomicInteger();
        ExecutorService workers = Executors.newFixedThreadPool(settings.maxConcurrency(), r -> {
            Thread t = new Thread(r, "convert-" + fileId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        try (var gate = new CallGate(fileId, settings.maxConcurrency(), settings.callDeadline())) {
            // units are in pre-order, so a frame's future exists before its children's
            for (StatementNode unit : units) {
                CompletableFuture<String> parentSkeleton = nearestFrame(unit, frames)
                        .map(futures::get)
                        .orElse(CompletableFuture.completedFuture(""));
                CompletableFuture<String> future = frames.contains(unit)
                        ? CompletableFuture.supplyAsync(() -> call(gate, unit, failure, "transformSkeleton",
                                () -> transformationPort.transformSkeleton(unit.placeholderCode(), settings.locale())),
                                workers)
                        : parentSkeleton.thenApplyAsync(skeleton -> call(gate, unit, failure, "transformFragment",
                                () -> transformationPort.transformFragment(unit.rawCode(), skeleton, settings.locale())),
                                workers);
                future.whenComplete((text, error) -> {
                    if (error == null) {
                        eventBus.publishProgress(fileId, null, new ProgressEvent(ProgressEvent.SEMANTIC,
                                done.incrementAndGet(), units.size(), unit.endLine()));
                    }
                });
                futures.put(unit, future);
            }

            try {
                CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();
            } catch (CompletionException | CancellationException e) {
                UnitFailure first = failure.get();
                if (first != null) {
                    throw new FileAnalysisException(fileId, first.unit().kind() + " " + first.unit().span(),
                            first.cause());
                }
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                throw new FileAnalysisException(fileId, "conversion", cause);
            }
        } finally {
            workers.shutdownNow();
            awaitQuietly(workers);
        }

        Map<StatementNode, String> outputs = new IdentityHashMap<>();
        futures.forEach((unit, future) -> outputs.put(unit, future.join()));
        return outputs;
    }

    private static Optional<StatementNode> nearestFrame(StatementNode unit, Set<StatementNode> frames) {
        for (StatementNode p = unit.parent(); p != null; p = p.parent()) {
            if (frames.contains(p)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    /**
     * Runs one transformation call. The first failure that is not a cancellation is recorded
     * with its unit and aborts the gate, so sibling calls stop.
     */
    private static String call(CallGate gate, StatementNode unit, AtomicReference<UnitFailure> failure,
                               String name, Supplier<String> call) {
        try {
            return gate.call(name, 0, call);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException(name + " interrupted");
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            if (failure.compareAndSet(null, new UnitFailure(unit, e))) {
                log.error("{} failed for {} {}: {}", name, unit.kind(), unit.span(), e.getMessage());
                gate.abort();
            }
            throw e;
        }
    }

    private static void awaitQuietly(ExecutorService workers) {
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Conversion workers still running after shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private record UnitFailure(StatementNode unit, Throwable cause) {}
}
