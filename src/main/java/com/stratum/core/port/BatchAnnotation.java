package com.stratum.core.port;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * The annotator's response to one batch. May hold fewer entries than the batch had ranges;
 * a missing entry is a forfeited node, not an error.
 */
public record BatchAnnotation(List<NodeAnnotation> results) implements Serializable {

    public BatchAnnotation {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static BatchAnnotation empty() {
        return new BatchAnnotation(List.of());
    }

    /**
     * Pairs results with the batch's member ranges. A result at the member's own position
     * is taken when its range agrees; otherwise the first unused result with that range.
     * Each result answers at most one member, so members sharing a span get their own entries
     * in order.
     *
     * @param ranges member ranges in member order
     * @return one entry per range, {@code null} where no result answers it
     */
    public List<NodeAnnotation> alignTo(List<LineRange> ranges) {
        var aligned = new ArrayList<NodeAnnotation>(ranges.size());
        boolean[] used = new boolean[results.size()];
        for (int i = 0; i < ranges.size(); i++) {
            NodeAnnotation positional = null;
            if (i < results.size() && !used[i] && results.get(i).range().equals(ranges.get(i))) {
                positional = results.get(i);
                used[i] = true;
            }
            aligned.add(positional);
        }
        for (int i = 0; i < ranges.size(); i++) {
            if (aligned.get(i) != null) {
                continue;
            }
            for (int j = 0; j < results.size(); j++) {
                if (!used[j] && results.get(j).range().equals(ranges.get(i))) {
                    aligned.set(i, results.get(j));
                    used[j] = true;
                    break;
                }
            }
        }
        return aligned;
    }
}
