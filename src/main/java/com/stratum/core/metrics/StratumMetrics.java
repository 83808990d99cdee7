package com.stratum.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for Stratum pipeline runs.
 */
@Service
public class StratumMetrics {

    private final MeterRegistry registry;

    public StratumMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordBatchDuration(boolean parent, long ms) {
        Timer.builder("stratum.batch.duration")
                .tag("shape", parent ? "parent" : "leaves")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordBatchSize(int nodeCount) {
        DistributionSummary.builder("stratum.batch.nodes")
                .description("Nodes per planned batch")
                .register(registry)
                .record(nodeCount);
    }

    public void recordContainerDuration(long ms) {
        Timer.builder("stratum.container.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Nodes the annotator returned nothing for.
     */
    public void recordForfeits(int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder("stratum.nodes.forfeited")
                .description("Nodes completed without a summary")
                .register(registry)
                .increment(count);
    }

    public void recordGapSkipped() {
        Counter.builder("stratum.batches.gap_skipped")
                .description("Batch ids that never arrived before a forced finish")
                .register(registry)
                .increment();
    }

    public void recordUnmatchedPlaceholders(int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder("stratum.reassembly.unmatched_placeholders")
                .register(registry)
                .increment(count);
    }

    public void recordFileResult(String status) {
        Counter.builder("stratum.files.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
