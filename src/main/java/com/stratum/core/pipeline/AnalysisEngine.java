package com.stratum.core.pipeline;

import com.stratum.core.metrics.StratumMetrics;
import com.stratum.core.tree.NodeClassifier;
import com.stratum.core.tree.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the analysis pipeline over several files, one after another. A fatal failure is
 * reported for its file and the run moves on to the next one.
 */
@Service
public class AnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(AnalysisEngine.class);

    private final AnalysisPipeline pipeline;
    private final StratumMetrics metrics;

    public AnalysisEngine(AnalysisPipeline pipeline, StratumMetrics metrics) {
        this.pipeline = pipeline;
        this.metrics = metrics;
    }

    public List<FileOutcome> analyzeAll(List<SourceFile> files, NodeClassifier classifier) {
        var outcomes = new ArrayList<FileOutcome>(files.size());
        for (SourceFile file : files) {
            FileOutcome outcome;
            try {
                outcome = FileOutcome.completed(pipeline.analyze(file, classifier));
            } catch (FileAnalysisException e) {
                outcome = FileOutcome.failed(e.fileId(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Unexpected failure analyzing {}", file.fileId(), e);
                outcome = FileOutcome.failed(file.fileId(), "Processing " + file.fileId() + " failed: " + e.getMessage());
            }
            if (metrics != null) {
                metrics.recordFileResult(outcome.status());
            }
            outcomes.add(outcome);
        }
        long failed = outcomes.stream().filter(o -> !o.succeeded()).count();
        log.info("Analyzed {} file(s), {} failed", outcomes.size(), failed);
        return outcomes;
    }
}
