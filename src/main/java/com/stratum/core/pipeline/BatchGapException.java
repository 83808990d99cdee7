package com.stratum.core.pipeline;

import com.stratum.core.StratumException;

import java.util.List;

/**
 * Raised under the strict gap policy when batch ids never arrived before the run finished.
 */
public class BatchGapException extends StratumException {

    private final List<Integer> missingBatchIds;

    public BatchGapException(List<Integer> missingBatchIds) {
        super("Batches never arrived: " + missingBatchIds);
        this.missingBatchIds = List.copyOf(missingBatchIds);
    }

    public List<Integer> missingBatchIds() {
        return missingBatchIds;
    }
}
