package com.stratum.core.scheduler;

import com.stratum.core.batch.AnalysisBatch;
import com.stratum.core.batch.TokenCounter;
import com.stratum.core.events.ProgressEvent;
import com.stratum.core.logging.MdcContext;
import com.stratum.core.port.AnnotationPort;
import com.stratum.core.tree.CollectionResult;
import com.stratum.core.tree.ContainerInfo;
import com.stratum.core.tree.StatementNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Extracts a context for every analyzable parent, top-down, before any batch runs.
 * <p>
 * Parents are processed one depth at a time, shallowest first, so each call can include
 * the contexts already extracted for its ancestors. Parents at the same depth run
 * concurrently under the file's {@link CallGate}. Container roots are skipped: their
 * fragments are folded into the container summary instead.
 * <p>
 * A failed extraction is fatal for the file and surfaces as {@link ContextExtractionException}.
 */
public class ParentContextPhase {

    private static final Logger log = LoggerFactory.getLogger(ParentContextPhase.class);

    static final String OPEN = "[CONTEXT]\n";
    static final String CLOSE = "\n[/CONTEXT]";
    static final String SEPARATOR = "\n---\n";

    private final AnnotationPort port;
    private final TokenCounter tokenCounter;
    private final String fileId;
    private final String locale;
    private final int maxContextTokens;

    public ParentContextPhase(AnnotationPort port, TokenCounter tokenCounter, String fileId, String locale,
                              int maxContextTokens) {
        this.port = port;
        this.tokenCounter = tokenCounter;
        this.fileId = fileId;
        this.locale = locale;
        this.maxContextTokens = maxContextTokens;
    }

    /**
     * @return number of parents that received a context
     * @throws ContextExtractionException for the first parent whose extraction failed
     */
    public int run(CollectionResult collection, CallGate gate) {
        Map<Integer, List<StatementNode>> byDepth = new TreeMap<>();
        for (StatementNode node : collection.nodes()) {
            if (needsContext(node, collection.containers())) {
                byDepth.computeIfAbsent(depth(node), d -> new ArrayList<>()).add(node);
            }
        }
        if (byDepth.isEmpty()) {
            log.debug("No parent needs a context in {}", fileId);
            return 0;
        }

        var counter = new AtomicInteger();
        ExecutorService workers = Executors.newFixedThreadPool(gate.maxConcurrency(), r -> {
            Thread t = new Thread(r, "context-" + fileId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        int extracted = 0;
        try {
            for (List<StatementNode> level : byDepth.values()) {
                runLevel(level, gate, workers);
                extracted += level.size();
            }
        } finally {
            workers.shutdownNow();
            awaitQuietly(workers);
        }
        log.info("{}: extracted context for {} parent(s)", fileId, extracted);
        return extracted;
    }

    /**
     * Contexts of the members' parents, nearest ancestors kept first within the token limit,
     * one block per distinct text.
     */
    public String contextFor(AnalysisBatch batch) {
        Set<String> blocks = new LinkedHashSet<>();
        for (StatementNode member : batch.nodes()) {
            String block = ancestorContext(member);
            if (!block.isEmpty()) {
                blocks.add(block);
            }
        }
        return String.join("\n\n", blocks);
    }

    /**
     * Joins the recorded contexts of {@code node}'s ancestors, root-most first. Walking up from
     * the nearest parent stops at the first context that no longer fits the token limit.
     */
    String ancestorContext(StatementNode node) {
        List<String> parts = new ArrayList<>();
        int remaining = maxContextTokens;
        for (StatementNode p = node.parent(); p != null && remaining > 0; p = p.parent()) {
            String text = p.context();
            if (text == null || text.isBlank()) {
                continue;
            }
            int tokens = tokenCounter.count(text);
            if (tokens > remaining) {
                break;
            }
            parts.add(0, text);
            remaining -= tokens;
        }
        return parts.isEmpty() ? "" : OPEN + String.join(SEPARATOR, parts) + CLOSE;
    }

    private void runLevel(List<StatementNode> level, CallGate gate, ExecutorService workers) {
        var failure = new AtomicReference<ContextExtractionException>();
        var stages = new ArrayList<CompletableFuture<Void>>(level.size());
        for (StatementNode node : level) {
            stages.add(CompletableFuture.runAsync(() -> extract(node, gate, failure), workers));
        }
        CompletableFuture.allOf(stages.toArray(new CompletableFuture[0]))
                .handle((ignored, error) -> null)
                .join();
        if (failure.get() != null) {
            throw failure.get();
        }
    }

    private void extract(StatementNode node, CallGate gate, AtomicReference<ContextExtractionException> failure) {
        MdcContext.setPhase(fileId, ProgressEvent.SEMANTIC);
        try {
            if (gate.isAborted()) {
                return;
            }
            String text = gate.call("extractContext", 0,
                    () -> port.extractContext(node.placeholderCode(), ancestorContext(node), locale));
            node.recordContext(text == null ? "" : text.strip());
            log.debug("Context ready for {} {}", node.kind(), node.span());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (CancellationException e) {
            log.debug("Context extraction for {} {} cancelled", node.kind(), node.span());
        } catch (RuntimeException e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            if (failure.compareAndSet(null, new ContextExtractionException(node, cause))) {
                log.error("Context extraction failed for {} {}: {}", node.kind(), node.span(), cause.getMessage());
                gate.abort();
            }
        } finally {
            MdcContext.clear();
        }
    }

    private static boolean needsContext(StatementNode node, Map<String, ContainerInfo> containers) {
        return node.analyzable() && node.hasChildren() && !isContainerRoot(node, containers);
    }

    private static boolean isContainerRoot(StatementNode node, Map<String, ContainerInfo> containers) {
        if (node.containerKey() == null) {
            return false;
        }
        ContainerInfo container = containers.get(node.containerKey());
        return container != null
                && container.startLine() == node.startLine()
                && container.endLine() == node.endLine()
                && container.kind().equals(node.kind());
    }

    private static int depth(StatementNode node) {
        int depth = 0;
        for (StatementNode p = node.parent(); p != null; p = p.parent()) {
            depth++;
        }
        return depth;
    }

    private static void awaitQuietly(ExecutorService workers) {
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Context workers still running after shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
