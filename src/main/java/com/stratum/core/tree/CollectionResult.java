package com.stratum.core.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one collection run.
 *
 * @param fileId     identity of the collected file
 * @param nodes      every node in strict post-order (children before parents)
 * @param containers container entities keyed by container key, in discovery order
 */
public record CollectionResult(String fileId, List<StatementNode> nodes, Map<String, ContainerInfo> containers) {

    public CollectionResult {
        nodes = List.copyOf(nodes);
        containers = Collections.unmodifiableMap(new LinkedHashMap<>(containers));
    }

    /** The tree root, which post-order places last. */
    public StatementNode root() {
        return nodes.isEmpty() ? null : nodes.get(nodes.size() - 1);
    }

    public long analyzableCount() {
        return nodes.stream().filter(StatementNode::analyzable).count();
    }
}
