package com.stratum.core.batch;

import com.stratum.core.tree.StatementNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy packer that groups analyzable nodes into token-bounded batches.
 * <p>
 * A node with children always gets a batch of its own, emitted after any pending leaf
 * accumulator is flushed. A leaf larger than the limit also ends up alone; content is
 * never truncated. Batch ids follow emission order starting at 1.
 */
public class BatchPlanner {

    private static final Logger log = LoggerFactory.getLogger(BatchPlanner.class);

    /**
     * @param nodes      collected nodes in post-order
     * @param tokenLimit packing target per leaf batch
     */
    public List<AnalysisBatch> plan(List<StatementNode> nodes, int tokenLimit) {
        if (tokenLimit <= 0) {
            throw new IllegalArgumentException("tokenLimit must be positive: " + tokenLimit);
        }
        var batches = new ArrayList<AnalysisBatch>();
        var pending = new ArrayList<StatementNode>();
        int pendingTokens = 0;

        for (StatementNode node : nodes) {
            if (!node.analyzable()) {
                continue;
            }

            if (node.hasChildren()) {
                if (!pending.isEmpty()) {
                    emit(batches, pending, "leaf flush before parent " + node.span());
                    pending = new ArrayList<>();
                    pendingTokens = 0;
                }
                emit(batches, List.of(node), "parent " + node.span());
                continue;
            }

            if (!pending.isEmpty() && pendingTokens + node.tokenCount() > tokenLimit) {
                emit(batches, pending, "token limit " + pendingTokens + "/" + tokenLimit);
                pending = new ArrayList<>();
                pendingTokens = 0;
            }
            pending.add(node);
            pendingTokens += node.tokenCount();
        }

        if (!pending.isEmpty()) {
            emit(batches, pending, "final leaves");
        }
        log.debug("Planned {} batches from {} nodes (limit {})", batches.size(), nodes.size(), tokenLimit);
        return batches;
    }

    private static void emit(List<AnalysisBatch> batches, List<StatementNode> members, String reason) {
        var batch = new AnalysisBatch(batches.size() + 1, members);
        log.debug("Batch #{} planned: {} node(s), {} tokens ({})",
                batch.batchId(), members.size(), batch.tokenTotal(), reason);
        batches.add(batch);
    }
}
