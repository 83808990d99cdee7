package com.stratum.core.apply;

import com.stratum.core.batch.AnalysisBatch;
import com.stratum.core.events.EventBus;
import com.stratum.core.events.ProgressEvent;
import com.stratum.core.metrics.StratumMetrics;
import com.stratum.core.port.BatchAnnotation;
import com.stratum.core.port.CrossReference;
import com.stratum.core.port.GraphKeys;
import com.stratum.core.port.GraphSink;
import com.stratum.core.port.LineRange;
import com.stratum.core.port.NodeAnnotation;
import com.stratum.core.scheduler.BatchResultSink;
import com.stratum.core.tree.CollectionResult;
import com.stratum.core.tree.ContainerInfo;
import com.stratum.core.tree.StatementNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Applies batch results strictly in ascending {@code batchId} order, whatever order they arrive in.
 * <p>
 * Applying a batch records each summary once, writes it to the {@link GraphSink}, fires the
 * node's completion signal and counts down its container. Nodes the annotator skipped are
 * forfeited: their signal still fires and no summary is written. A forfeited node, and every
 * ancestor summarized above it, is marked incomplete. When a container's
 * pending count reaches zero a {@link ContainerReadyEvent} goes to the listener.
 * <p>
 * All state is guarded by one lock; every graph call happens while holding it.
 */
public class OrderedApplier implements BatchResultSink {

    private static final Logger log = LoggerFactory.getLogger(OrderedApplier.class);

    private final String fileId;
    private final Map<String, ContainerInfo> containers;
    private final int batchesTotal;
    private final GraphSink graphSink;
    private final ContainerReadyListener containerListener;
    private final EventBus eventBus;
    private final StratumMetrics metrics;

    private final Object lock = new Object();
    private final TreeMap<Integer, Submission> pending = new TreeMap<>();
    private final Set<Integer> seen = new HashSet<>();
    private final Map<String, Map<String, String>> containerFragments = new HashMap<>();
    private final List<Integer> gaps = new ArrayList<>();
    private int nextExpectedId = 1;
    private int applied;
    private int forfeited;
    private boolean finished;

    public OrderedApplier(String fileId, CollectionResult collection, int batchesTotal, GraphSink graphSink,
                          ContainerReadyListener containerListener, EventBus eventBus, StratumMetrics metrics) {
        this.fileId = fileId;
        this.containers = collection.containers();
        this.batchesTotal = batchesTotal;
        this.graphSink = graphSink;
        this.containerListener = containerListener;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    OrderedApplier(CollectionResult collection, int batchesTotal, GraphSink graphSink,
                   ContainerReadyListener containerListener) {
        this(collection.fileId(), collection, batchesTotal, graphSink, containerListener, null, null);
    }

    /**
     * Buffers a result and applies every result that is now contiguous with the last applied id.
     * Duplicate ids and results arriving after a forced finish are ignored.
     */
    @Override
    public void submit(AnalysisBatch batch, BatchAnnotation result) {
        synchronized (lock) {
            int id = batch.batchId();
            if (!seen.add(id)) {
                log.warn("Ignoring duplicate result for batch #{}", id);
                return;
            }
            if (id < nextExpectedId) {
                log.warn("Ignoring late result for batch #{}: already skipped", id);
                return;
            }
            pending.put(id, new Submission(batch, result));
            drainReady();
        }
    }

    /**
     * Drains every contiguous buffered result. With {@code force}, also applies the
     * remaining results in ascending id order across missing ids, records each missing id
     * as a gap, and emits ready events for every container not yet finalized.
     * Calling it again never re-applies a batch.
     */
    public ApplyReport finish(boolean force) {
        synchronized (lock) {
            drainReady();
            if (force && !finished) {
                while (!pending.isEmpty()) {
                    int id = pending.firstKey();
                    skipGapsUpTo(id);
                    applyAndAdvance(pending.pollFirstEntry().getValue());
                }
                skipGapsUpTo(batchesTotal + 1);
                finalizeRemainingContainers();
                finished = true;
            }
            return new ApplyReport(applied, batchesTotal, forfeited, gaps, pending.size());
        }
    }

    public int nextExpectedId() {
        synchronized (lock) {
            return nextExpectedId;
        }
    }

    private void drainReady() {
        while (!pending.isEmpty() && pending.firstKey() == nextExpectedId) {
            applyAndAdvance(pending.pollFirstEntry().getValue());
        }
    }

    private void skipGapsUpTo(int id) {
        while (nextExpectedId < id) {
            log.warn("Batch #{} never arrived; skipping it to continue applying", nextExpectedId);
            gaps.add(nextExpectedId);
            if (metrics != null) {
                metrics.recordGapSkipped();
            }
            nextExpectedId++;
        }
    }

    private void applyAndAdvance(Submission submission) {
        apply(submission.batch(), submission.result());
        nextExpectedId = submission.batch().batchId() + 1;
        applied++;
        if (eventBus != null) {
            eventBus.publishProgress(fileId, submission.batch().batchId(), new ProgressEvent(
                    ProgressEvent.SEMANTIC, applied, batchesTotal, submission.batch().progressLine()));
        }
    }

    private void apply(AnalysisBatch batch, BatchAnnotation result) {
        int batchForfeits = 0;
        List<NodeAnnotation> aligned = result.alignTo(batch.ranges());
        for (int i = 0; i < batch.nodes().size(); i++) {
            StatementNode node = batch.nodes().get(i);
            NodeAnnotation annotation = aligned.get(i);
            if (hasUnsummarizedDescendant(node)) {
                node.markIncomplete();
            }
            if (annotation != null && annotation.hasSummary()) {
                applySummary(node, annotation);
            } else {
                batchForfeits++;
                node.markIncomplete();
                log.warn("No summary returned for {} {} in batch #{}; marking forfeited",
                        node.kind(), node.span(), batch.batchId());
            }
            node.completionSignal().signal();
        }
        forfeited += batchForfeits;
        if (metrics != null) {
            metrics.recordForfeits(batchForfeits);
        }
        log.info("Applied batch #{} ({} node(s), {} forfeited, up to line {})",
                batch.batchId(), batch.nodes().size(), batchForfeits, batch.progressLine());
    }

    private void applySummary(StatementNode node, NodeAnnotation annotation) {
        String summary = annotation.summary().strip();
        if (!node.recordSummary(summary)) {
            log.warn("{} {} already has a summary; keeping the first", node.kind(), node.span());
            return;
        }
        String nodeKey = GraphKeys.node(fileId, node);
        var props = new LinkedHashMap<String, Object>();
        props.put("fileId", fileId);
        if (node.containerKey() != null) {
            props.put("containerKey", node.containerKey());
            props.put("containerName", node.containerName());
        }
        if (node.isIncomplete()) {
            log.debug("{} {} summarized with unsummarized descendants", node.kind(), node.span());
            props.put("incomplete", true);
        }
        graphSink.upsertNodeSummary(nodeKey, node.kind(),
                new LineRange(node.startLine(), node.endLine()), summary, props);
        for (CrossReference ref : annotation.crossRefs()) {
            graphSink.upsertEdge(nodeKey, GraphKeys.entity(ref.target()), ref.edgeType(), ref.properties());
        }

        if (node.containerKey() == null) {
            return;
        }
        containerFragments.computeIfAbsent(node.containerKey(), k -> new LinkedHashMap<>())
                .put(GraphKeys.fragment(node), summary);
        ContainerInfo container = containers.get(node.containerKey());
        if (container != null && container.decrementPending() && container.markFinalized()) {
            log.debug("Container {} complete", container.key());
            containerListener.containerReady(new ContainerReadyEvent(fileId, container,
                    containerFragments.getOrDefault(container.key(), Map.of()), true));
        }
    }

    /**
     * Whether an analyzable descendant reachable through structural nodes has no summary
     * or is itself incomplete. Children are always applied before their parent.
     */
    private static boolean hasUnsummarizedDescendant(StatementNode node) {
        for (StatementNode child : node.children()) {
            if (child.analyzable()) {
                if (child.summary() == null || child.isIncomplete()) {
                    return true;
                }
            } else if (hasUnsummarizedDescendant(child)) {
                return true;
            }
        }
        return false;
    }

    private void finalizeRemainingContainers() {
        for (ContainerInfo container : containers.values()) {
            if (!container.markFinalized()) {
                continue;
            }
            if (container.pendingCount() > 0) {
                log.warn("Finalizing container {} with {} node(s) still unsummarized",
                        container.key(), container.pendingCount());
            }
            containerListener.containerReady(new ContainerReadyEvent(fileId, container,
                    containerFragments.getOrDefault(container.key(), Map.of()), container.pendingCount() == 0));
        }
    }

    private record Submission(AnalysisBatch batch, BatchAnnotation result) {}
}
