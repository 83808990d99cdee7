package com.stratum.core.pipeline;

/**
 * Per-file result of a multi-file run.
 *
 * @param fileId the file
 * @param status "COMPLETED" or "FAILED"
 * @param report the analysis report, null when the file failed
 * @param error  failure message including the offending batch or span, null on success
 */
public record FileOutcome(String fileId, String status, AnalysisReport report, String error) {

    public static final String COMPLETED = "COMPLETED";
    public static final String FAILED = "FAILED";

    public static FileOutcome completed(AnalysisReport report) {
        return new FileOutcome(report.fileId(), COMPLETED, report, null);
    }

    public static FileOutcome failed(String fileId, String error) {
        return new FileOutcome(fileId, FAILED, null, error);
    }

    public boolean succeeded() {
        return COMPLETED.equals(status);
    }
}
