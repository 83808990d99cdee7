package com.stratum.core.apply;

import java.util.List;

/**
 * Outcome of draining an {@link OrderedApplier}.
 *
 * @param batchesApplied      batches applied over the applier's lifetime
 * @param batchesTotal        batches planned
 * @param forfeitedNodes      nodes completed without a summary
 * @param gaps                batch ids skipped because they never arrived
 * @param pendingAfterFinish  results still buffered (non-forced finish only)
 */
public record ApplyReport(int batchesApplied, int batchesTotal, int forfeitedNodes, List<Integer> gaps,
                          int pendingAfterFinish) {

    public ApplyReport {
        gaps = List.copyOf(gaps);
    }

    public boolean hasGaps() {
        return !gaps.isEmpty();
    }
}
