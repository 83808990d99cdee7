package com.stratum.core.apply;

import com.stratum.core.batch.TokenCounter;
import com.stratum.core.events.EventBus;
import com.stratum.core.events.StratumEvent;
import com.stratum.core.logging.MdcContext;
import com.stratum.core.metrics.StratumMetrics;
import com.stratum.core.port.AnnotationPort;
import com.stratum.core.port.GraphSink;
import com.stratum.core.port.GroupSummary;
import com.stratum.core.scheduler.CallGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Single dedicated worker that turns ready containers into container summaries.
 * <p>
 * Fragments are grouped into chunks of at most {@code chunkTokens} (a fragment larger than
 * the budget forms its own chunk). One chunk is summarized directly; several are summarized
 * one by one and the partial summaries folded again until a single summary remains.
 */
public class ContainerFinalizer implements ContainerReadyListener {

    private static final Logger log = LoggerFactory.getLogger(ContainerFinalizer.class);

    private final AnnotationPort port;
    private final CallGate gate;
    private final GraphSink graphSink;
    private final TokenCounter tokenCounter;
    private final int chunkTokens;
    private final String locale;
    private final EventBus eventBus;
    private final StratumMetrics metrics;
    private final ExecutorService worker;
    private final List<Future<?>> submitted = new ArrayList<>();
    private int summarized;

    public ContainerFinalizer(String runName, AnnotationPort port, CallGate gate, GraphSink graphSink,
                              TokenCounter tokenCounter, int chunkTokens, String locale,
                              EventBus eventBus, StratumMetrics metrics) {
        this.port = port;
        this.gate = gate;
        this.graphSink = graphSink;
        this.tokenCounter = tokenCounter;
        this.chunkTokens = chunkTokens;
        this.locale = locale;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "containers-" + runName);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void containerReady(ContainerReadyEvent event) {
        synchronized (submitted) {
            submitted.add(worker.submit(() -> finalizeContainer(event)));
        }
    }

    /**
     * Waits for every queued container and stops the worker.
     *
     * @return number of container summaries written
     * @throws RuntimeException the first finalization failure
     */
    public int awaitCompletion() throws InterruptedException {
        List<Future<?>> futures;
        synchronized (submitted) {
            futures = new ArrayList<>(submitted);
        }
        worker.shutdown();
        RuntimeException first = null;
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (CancellationException e) {
                log.debug("Container finalization cancelled");
            } catch (ExecutionException e) {
                if (first == null) {
                    first = e.getCause() instanceof RuntimeException re
                            ? re : new IllegalStateException(e.getCause());
                }
            }
        }
        if (first != null) {
            throw first;
        }
        return summarized;
    }

    /** Stops the worker without waiting. */
    public void shutdownNow() {
        worker.shutdownNow();
    }

    private void finalizeContainer(ContainerReadyEvent event) {
        String key = event.container().key();
        MdcContext.setContainer(event.fileId(), key);
        try {
            if (gate.isAborted()) {
                log.debug("Skipping container {}: run aborted", key);
                return;
            }
            if (event.fragments().isEmpty()) {
                log.info("Container {} has no summarized statements; nothing to fold", key);
                return;
            }
            long startMs = System.currentTimeMillis();
            String summary = fold(event.fragments(), 0);
            if (summary.isBlank()) {
                log.warn("Container {} produced no summary; leaving it unsummarized", key);
                return;
            }
            graphSink.upsertContainerSummary(key, summary);
            summarized++;
            if (metrics != null) {
                metrics.recordContainerDuration(System.currentTimeMillis() - startMs);
            }
            if (eventBus != null) {
                eventBus.publish(StratumEvent.of("container.summarized", event.fileId(), Map.of(
                        "containerKey", key,
                        "name", event.container().name(),
                        "complete", event.complete())));
            }
            log.info("Container {} summarized from {} fragment(s)", event.container().name(),
                    event.fragments().size());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Container " + key + " interrupted");
        } finally {
            MdcContext.clear();
        }
    }

    String fold(Map<String, String> fragments, int depth) throws InterruptedException {
        List<Map<String, String>> chunks = chunk(fragments, depth == 0 ? 1 : 2);
        if (chunks.size() == 1) {
            return summarize(chunks.get(0));
        }
        log.debug("Folding {} fragment(s) in {} chunk(s) at depth {}", fragments.size(), chunks.size(), depth);
        var partials = new LinkedHashMap<String, String>();
        for (int i = 0; i < chunks.size(); i++) {
            partials.put("part_" + (i + 1), summarize(chunks.get(i)));
        }
        return fold(partials, depth + 1);
    }

    /**
     * Splits fragments into chunks within the token budget, keeping their order. Each
     * chunk holds at least {@code minPerChunk} fragments so that a fold always shrinks.
     */
    List<Map<String, String>> chunk(Map<String, String> fragments, int minPerChunk) {
        var chunks = new ArrayList<Map<String, String>>();
        var current = new LinkedHashMap<String, String>();
        int currentTokens = 0;
        for (Map.Entry<String, String> fragment : fragments.entrySet()) {
            int tokens = tokenCounter.count(fragment.getKey() + ": " + fragment.getValue());
            if (current.size() >= minPerChunk && currentTokens + tokens > chunkTokens) {
                chunks.add(current);
                current = new LinkedHashMap<>();
                currentTokens = 0;
            }
            current.put(fragment.getKey(), fragment.getValue());
            currentTokens += tokens;
        }
        if (!current.isEmpty()) {
            chunks.add(current);
        }
        return chunks;
    }

    private String summarize(Map<String, String> chunk) throws InterruptedException {
        GroupSummary result = gate.call("summarizeGroup", 0, () -> port.summarizeGroup(chunk, locale));
        if (result == null || result.summary() == null || result.summary().isBlank()) {
            log.warn("Empty group summary for {} fragment(s)", chunk.size());
            return "";
        }
        return result.summary().strip();
    }
}
