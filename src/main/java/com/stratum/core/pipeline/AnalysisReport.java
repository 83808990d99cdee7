package com.stratum.core.pipeline;

import java.util.List;

/**
 * Result of analyzing one file.
 *
 * @param fileId              the file
 * @param nodeCount           collected nodes
 * @param batchCount          planned batches
 * @param forfeitedNodes      nodes completed without a summary
 * @param gaps                batch ids skipped at the forced finish
 * @param containersSummarized container summaries written
 */
public record AnalysisReport(String fileId, int nodeCount, int batchCount, int forfeitedNodes,
                             List<Integer> gaps, int containersSummarized) {

    public AnalysisReport {
        gaps = List.copyOf(gaps);
    }
}
