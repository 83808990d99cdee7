package com.stratum.core.pipeline;

import com.stratum.core.config.StratumProperties;

import java.time.Duration;

/**
 * Tuning values for one pipeline run.
 */
public record PipelineSettings(
    int tokenLimit,
    int maxConcurrency,
    Duration callDeadline,
    String locale,
    int summaryChunkTokens,
    int structuralChunkSize,
    boolean failOnGap,
    int parentExpandTokens,
    boolean parentContext,
    int maxContextTokens
) {

    public static PipelineSettings from(StratumProperties properties) {
        return new PipelineSettings(
                properties.getTokenLimit(),
                properties.getMaxConcurrency(),
                properties.getAnnotationTimeout(),
                properties.getLocale(),
                properties.getSummaryChunkTokens(),
                properties.getStructuralChunkSize(),
                properties.isFailOnGap(),
                properties.getParentExpandTokens(),
                properties.isParentContextEnabled(),
                properties.getMaxContextTokens());
    }

    public static PipelineSettings defaults() {
        return from(new StratumProperties());
    }

    public PipelineSettings withTokenLimit(int limit) {
        return new PipelineSettings(limit, maxConcurrency, callDeadline, locale, summaryChunkTokens,
                structuralChunkSize, failOnGap, parentExpandTokens, parentContext, maxContextTokens);
    }

    public PipelineSettings withMaxConcurrency(int max) {
        return new PipelineSettings(tokenLimit, max, callDeadline, locale, summaryChunkTokens,
                structuralChunkSize, failOnGap, parentExpandTokens, parentContext, maxContextTokens);
    }

    public PipelineSettings withCallDeadline(Duration deadline) {
        return new PipelineSettings(tokenLimit, maxConcurrency, deadline, locale, summaryChunkTokens,
                structuralChunkSize, failOnGap, parentExpandTokens, parentContext, maxContextTokens);
    }

    public PipelineSettings withFailOnGap(boolean strict) {
        return new PipelineSettings(tokenLimit, maxConcurrency, callDeadline, locale, summaryChunkTokens,
                structuralChunkSize, strict, parentExpandTokens, parentContext, maxContextTokens);
    }

    public PipelineSettings withParentExpandTokens(int tokens) {
        return new PipelineSettings(tokenLimit, maxConcurrency, callDeadline, locale, summaryChunkTokens,
                structuralChunkSize, failOnGap, tokens, parentContext, maxContextTokens);
    }

    public PipelineSettings withSummaryChunkTokens(int tokens) {
        return new PipelineSettings(tokenLimit, maxConcurrency, callDeadline, locale, tokens,
                structuralChunkSize, failOnGap, parentExpandTokens, parentContext, maxContextTokens);
    }

    public PipelineSettings withParentContext(boolean enabled) {
        return new PipelineSettings(tokenLimit, maxConcurrency, callDeadline, locale, summaryChunkTokens,
                structuralChunkSize, failOnGap, parentExpandTokens, enabled, maxContextTokens);
    }
}
