package com.stratum.graph;

import com.stratum.core.port.GraphSink;
import com.stratum.core.port.LineRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Idempotent in-memory {@link GraphSink}. Used when no graph database is configured and
 * by tests, which can inspect the resulting nodes, edges and the call log.
 */
public class InMemoryGraphSink implements GraphSink {

    public record Node(String key, String kind, LineRange span, String summary, Map<String, Object> properties) {}

    public record Edge(String fromKey, String toKey, String edgeType, Map<String, Object> properties) {}

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, Edge> edges = new LinkedHashMap<>();
    private final Map<String, String> containerSummaries = new LinkedHashMap<>();
    private final List<String> calls = new ArrayList<>();

    @Override
    public synchronized void upsertNode(String nodeKey, String kind, LineRange span, Map<String, Object> properties) {
        calls.add("node " + nodeKey);
        Node existing = nodes.get(nodeKey);
        var merged = new LinkedHashMap<String, Object>(existing == null ? Map.of() : existing.properties());
        merged.putAll(properties);
        nodes.put(nodeKey, new Node(nodeKey, kind, span, existing == null ? null : existing.summary(), merged));
    }

    @Override
    public synchronized void upsertNodeSummary(String nodeKey, String kind, LineRange span, String summary,
                                               Map<String, Object> extraProperties) {
        calls.add("summary " + nodeKey);
        Node existing = nodes.get(nodeKey);
        var merged = new LinkedHashMap<String, Object>(existing == null ? Map.of() : existing.properties());
        merged.putAll(extraProperties);
        nodes.put(nodeKey, new Node(nodeKey, kind, span, summary, merged));
    }

    @Override
    public synchronized void upsertEdge(String fromKey, String toKey, String edgeType, Map<String, Object> properties) {
        calls.add("edge " + fromKey + " -" + edgeType + "-> " + toKey);
        edges.put(fromKey + "|" + edgeType + "|" + toKey, new Edge(fromKey, toKey, edgeType, Map.copyOf(properties)));
    }

    @Override
    public synchronized void upsertContainerSummary(String containerKey, String summary) {
        calls.add("container " + containerKey);
        containerSummaries.put(containerKey, summary);
    }

    public synchronized Map<String, Node> nodes() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }

    public synchronized List<Edge> edges() {
        return List.copyOf(edges.values());
    }

    public synchronized List<Edge> edges(String edgeType) {
        return edges.values().stream().filter(e -> e.edgeType().equals(edgeType)).toList();
    }

    public synchronized Map<String, String> containerSummaries() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(containerSummaries));
    }

    /** Every call in arrival order, including replays. */
    public synchronized List<String> calls() {
        return List.copyOf(calls);
    }
}
