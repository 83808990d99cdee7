package com.stratum.core.batch;

import com.stratum.core.port.LineRange;
import com.stratum.core.tree.StatementNode;

import java.util.List;

/**
 * An immutable planning unit. {@code batchId} is the application order.
 *
 * @param batchId sequential id starting at 1
 * @param nodes   members in planning order
 */
public record AnalysisBatch(int batchId, List<StatementNode> nodes) {

    public AnalysisBatch {
        if (nodes == null || nodes.isEmpty()) {
            throw new IllegalArgumentException("Batch " + batchId + " has no nodes");
        }
        nodes = List.copyOf(nodes);
    }

    /** Maximum end line across members, for progress reporting. */
    public int progressLine() {
        return nodes.stream().mapToInt(StatementNode::endLine).max().orElse(0);
    }

    public List<LineRange> ranges() {
        return nodes.stream().map(n -> new LineRange(n.startLine(), n.endLine())).toList();
    }

    /** Parents contribute their compact code, leaves their raw code. */
    public String payload() {
        var sb = new StringBuilder();
        for (StatementNode node : nodes) {
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append(node.hasChildren() ? node.compactCode() : node.rawCode());
        }
        return sb.toString();
    }

    public int tokenTotal() {
        return nodes.stream().mapToInt(StatementNode::tokenCount).sum();
    }

    public boolean isSingletonParent() {
        return nodes.size() == 1 && nodes.get(0).hasChildren();
    }
}
