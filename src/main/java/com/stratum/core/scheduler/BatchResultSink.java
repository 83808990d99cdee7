package com.stratum.core.scheduler;

import com.stratum.core.batch.AnalysisBatch;
import com.stratum.core.port.BatchAnnotation;

/**
 * Receives each batch's result as soon as it completes, in any order and from any thread.
 */
@FunctionalInterface
public interface BatchResultSink {

    void submit(AnalysisBatch batch, BatchAnnotation result);
}
