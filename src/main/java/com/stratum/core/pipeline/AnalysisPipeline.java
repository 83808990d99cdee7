package com.stratum.core.pipeline;

import com.stratum.core.apply.ApplyReport;
import com.stratum.core.apply.ContainerFinalizer;
import com.stratum.core.apply.OrderedApplier;
import com.stratum.core.batch.AnalysisBatch;
import com.stratum.core.batch.BatchPlanner;
import com.stratum.core.batch.TokenCounter;
import com.stratum.core.config.StratumProperties;
import com.stratum.core.events.EventBus;
import com.stratum.core.events.ProgressEvent;
import com.stratum.core.events.StratumEvent;
import com.stratum.core.logging.MdcContext;
import com.stratum.core.metrics.StratumMetrics;
import com.stratum.core.port.AnnotationPort;
import com.stratum.core.port.AnnotationTransportException;
import com.stratum.core.port.GraphKeys;
import com.stratum.core.port.GraphSink;
import com.stratum.core.port.LineRange;
import com.stratum.core.scheduler.CallGate;
import com.stratum.core.scheduler.ContextExtractionException;
import com.stratum.core.scheduler.DependencyScheduler;
import com.stratum.core.scheduler.ParentContextPhase;
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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Analyzes one file end to end: collect the tree, write its structure to the graph, plan
 * batches, extract parent contexts top-down, run the batches under dependency gating, apply
 * results in order, then fold container summaries.
 * <p>
 * A fatal failure is rethrown as {@link FileAnalysisException} after every batch that
 * completed has been applied.
 */
@Service
public class AnalysisPipeline {

    private static final Logger log = LoggerFactory.getLogger(AnalysisPipeline.class);

    static final String PARENT_OF = "PARENT_OF";
    static final String NEXT = "NEXT";

    private final AnnotationPort annotationPort;
    private final GraphSink graphSink;
    private final TokenCounter tokenCounter;
    private final EventBus eventBus;
    private final StratumMetrics metrics;
    private final PipelineSettings settings;
    private final BatchPlanner planner = new BatchPlanner();

    @Autowired
    public AnalysisPipeline(AnnotationPort annotationPort, GraphSink graphSink, TokenCounter tokenCounter,
                            EventBus eventBus, StratumMetrics metrics, StratumProperties properties) {
        this(annotationPort, graphSink, tokenCounter, eventBus, metrics, PipelineSettings.from(properties));
    }

    AnalysisPipeline(AnnotationPort annotationPort, GraphSink graphSink, TokenCounter tokenCounter,
                     EventBus eventBus, StratumMetrics metrics, PipelineSettings settings) {
        this.annotationPort = annotationPort;
        this.graphSink = graphSink;
        this.tokenCounter = tokenCounter;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.settings = settings;
    }

    public AnalysisReport analyze(SourceFile file, NodeClassifier classifier) {
        String fileId = file.fileId();
        MdcContext.setFile(fileId);
        eventBus.publish(StratumEvent.of("file.started", fileId, Map.of("mode", "analyze")));
        try {
            CollectionResult collection = collect(file, classifier);
            writeStructure(collection, classifier);

            List<AnalysisBatch> batches = planner.plan(collection.nodes(), settings.tokenLimit());
            if (metrics != null) {
                batches.forEach(b -> metrics.recordBatchSize(b.nodes().size()));
            }
            log.info("{}: {} nodes, {} containers, {} batches",
                    fileId, collection.nodes().size(), collection.containers().size(), batches.size());

            AnalysisReport report = runSemanticPhase(collection, batches);
            eventBus.publish(StratumEvent.of("file.completed", fileId, Map.of(
                    "batches", report.batchCount(),
                    "forfeited", report.forfeitedNodes(),
                    "containers", report.containersSummarized())));
            return report;
        } catch (FileAnalysisException e) {
            log.error("{}", e.getMessage());
            eventBus.publish(StratumEvent.of("file.failed", fileId, Map.of(
                    "location", e.location(), "error", String.valueOf(e.getCause().getMessage()))));
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private CollectionResult collect(SourceFile file, NodeClassifier classifier) {
        try {
            return new TreeCollector(classifier, tokenCounter).collect(file);
        } catch (CollectionException e) {
            throw new FileAnalysisException(file.fileId(), e.kind() + " " + e.startLine() + "~" + e.endLine(), e);
        }
    }

    private AnalysisReport runSemanticPhase(CollectionResult collection, List<AnalysisBatch> batches) {
        String fileId = collection.fileId();
        try (var gate = new CallGate(fileId, settings.maxConcurrency(), settings.callDeadline())) {
            var finalizer = new ContainerFinalizer(fileId, annotationPort, gate, graphSink, tokenCounter,
                    settings.summaryChunkTokens(), settings.locale(), eventBus, metrics);
            var applier = new OrderedApplier(fileId, collection, batches.size(), graphSink, finalizer,
                    eventBus, metrics);
            var contexts = new ParentContextPhase(annotationPort, tokenCounter, fileId, settings.locale(),
                    settings.maxContextTokens());
            if (settings.parentContext()) {
                try {
                    contexts.run(collection, gate);
                } catch (ContextExtractionException e) {
                    finalizer.shutdownNow();
                    throw new FileAnalysisException(fileId, "context " + e.location(), e.getCause());
                }
            }
            var scheduler = new DependencyScheduler(annotationPort, applier, fileId, settings.locale(), metrics,
                    contexts::contextFor);

            try {
                scheduler.runAll(batches, gate);
            } catch (RuntimeException e) {
                ApplyReport partial = applier.finish(true);
                finalizer.shutdownNow();
                log.warn("{}: applied {} of {} batches before failure", fileId,
                        partial.batchesApplied(), partial.batchesTotal());
                throw new FileAnalysisException(fileId, locationOf(e), e);
            }

            ApplyReport applied = applier.finish(true);
            int containers;
            try {
                containers = finalizer.awaitCompletion();
            } catch (RuntimeException e) {
                throw new FileAnalysisException(fileId, "container finalization", e);
            }
            if (applied.hasGaps() && settings.failOnGap()) {
                throw new FileAnalysisException(fileId, "batch #" + applied.gaps().get(0),
                        new BatchGapException(applied.gaps()));
            }
            return new AnalysisReport(fileId, collection.nodes().size(), batches.size(),
                    applied.forfeitedNodes(), applied.gaps(), containers);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FileAnalysisException(fileId, "container finalization", e);
        }
    }

    /**
     * Upserts every node, {@code PARENT_OF} edges, and {@code NEXT} edges between consecutive
     * siblings, emitting structural progress every {@code structuralChunkSize} writes.
     */
    void writeStructure(CollectionResult collection, NodeClassifier classifier) {
        String fileId = collection.fileId();
        MdcContext.setPhase(fileId, ProgressEvent.STRUCTURAL);
        var progress = new StructuralProgress(fileId, countStructuralWrites(collection, classifier));

        for (StatementNode node : collection.nodes()) {
            var props = new LinkedHashMap<String, Object>();
            props.put("fileId", fileId);
            props.put("tokenCount", node.tokenCount());
            props.put("analyzable", node.analyzable());
            props.put(node.hasChildren() ? "placeholderCode" : "code",
                    node.hasChildren() ? node.placeholderCode() : node.rawCode());
            if (node.containerKey() != null) {
                props.put("containerKey", node.containerKey());
                props.put("containerName", node.containerName());
            }
            graphSink.upsertNode(GraphKeys.node(fileId, node), node.kind(),
                    new LineRange(node.startLine(), node.endLine()), props);
            progress.step(node.endLine());
        }

        for (StatementNode node : collection.nodes()) {
            String parentKey = GraphKeys.node(fileId, node);
            StatementNode previous = null;
            for (StatementNode child : node.children()) {
                graphSink.upsertEdge(parentKey, GraphKeys.node(fileId, child), PARENT_OF, Map.of());
                progress.step(child.endLine());
                if (previous != null && !classifier.breaksSiblingChain(previous.kind())) {
                    graphSink.upsertEdge(GraphKeys.node(fileId, previous), GraphKeys.node(fileId, child),
                            NEXT, Map.of());
                    progress.step(child.endLine());
                }
                previous = child;
            }
        }
        progress.flush();
    }

    private static String locationOf(Throwable e) {
        if (e instanceof AnnotationTransportException ate && ate.batchId() > 0) {
            return "batch #" + ate.batchId();
        }
        return "semantic phase";
    }

    private static int countStructuralWrites(CollectionResult collection, NodeClassifier classifier) {
        int writes = collection.nodes().size();
        for (StatementNode node : collection.nodes()) {
            List<StatementNode> children = node.children();
            writes += children.size();
            for (int i = 1; i < children.size(); i++) {
                if (!classifier.breaksSiblingChain(children.get(i - 1).kind())) {
                    writes++;
                }
            }
        }
        return writes;
    }

    private final class StructuralProgress {

        private final String fileId;
        private final int chunkSize;
        private final int totalChunks;
        private int writes;
        private int chunksDone;
        private int lastLine;

        StructuralProgress(String fileId, int totalWrites) {
            this.fileId = fileId;
            this.chunkSize = Math.max(1, settings.structuralChunkSize());
            this.totalChunks = Math.max(1, (totalWrites + chunkSize - 1) / chunkSize);
        }

        void step(int line) {
            writes++;
            lastLine = Math.max(lastLine, line);
            if (writes % chunkSize == 0) {
                chunksDone++;
                publish();
            }
        }

        /** Publishes the trailing partial chunk, if any. */
        void flush() {
            if (writes == 0 || writes % chunkSize != 0) {
                chunksDone++;
                publish();
            }
        }

        private void publish() {
            eventBus.publishProgress(fileId, null, new ProgressEvent(ProgressEvent.STRUCTURAL,
                    chunksDone, totalChunks, lastLine));
        }
    }
}
