package com.stratum.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "stratum")
public class StratumProperties {

    private Batch batch = new Batch();
    private Concurrency concurrency = new Concurrency();
    private Annotation annotation = new Annotation();
    private Apply apply = new Apply();
    private Convert convert = new Convert();
    private Context context = new Context();

    // -- Flattened accessors --
    public int getTokenLimit() { return batch.tokenLimit; }
    public int getSummaryChunkTokens() { return batch.summaryChunkTokens; }
    public int getStructuralChunkSize() { return batch.structuralChunkSize; }
    public int getMaxConcurrency() { return concurrency.maxConcurrency; }
    public Duration getAnnotationTimeout() { return Duration.ofSeconds(annotation.timeoutSeconds); }
    public String getLocale() { return annotation.locale; }
    public boolean isFailOnGap() { return apply.failOnGap; }
    public int getParentExpandTokens() { return convert.parentExpandTokens; }
    public boolean isParentContextEnabled() { return context.enabled; }
    public int getMaxContextTokens() { return context.maxTokens; }

    public Batch getBatch() { return batch; }
    public void setBatch(Batch batch) { this.batch = batch; }
    public Concurrency getConcurrency() { return concurrency; }
    public void setConcurrency(Concurrency concurrency) { this.concurrency = concurrency; }
    public Annotation getAnnotation() { return annotation; }
    public void setAnnotation(Annotation annotation) { this.annotation = annotation; }
    public Apply getApply() { return apply; }
    public void setApply(Apply apply) { this.apply = apply; }
    public Convert getConvert() { return convert; }
    public void setConvert(Convert convert) { this.convert = convert; }
    public Context getContext() { return context; }
    public void setContext(Context context) { this.context = context; }

    public static class Batch {
        private int tokenLimit = 1000;
        private int summaryChunkTokens = 5000;
        private int structuralChunkSize = 40;

        public int getTokenLimit() { return tokenLimit; }
        public void setTokenLimit(int tokenLimit) { this.tokenLimit = tokenLimit; }
        public int getSummaryChunkTokens() { return summaryChunkTokens; }
        public void setSummaryChunkTokens(int summaryChunkTokens) { this.summaryChunkTokens = summaryChunkTokens; }
        public int getStructuralChunkSize() { return structuralChunkSize; }
        public void setStructuralChunkSize(int structuralChunkSize) { this.structuralChunkSize = structuralChunkSize; }
    }

    public static class Concurrency {
        private int maxConcurrency = 5;

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }
    }

    public static class Annotation {
        private int timeoutSeconds = 300;
        private String locale = "en";

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public String getLocale() { return locale; }
        public void setLocale(String locale) { this.locale = locale; }
    }

    public static class Apply {
        /** Treat a batch id that never arrived as a hard failure at finish time. */
        private boolean failOnGap = false;

        public boolean isFailOnGap() { return failOnGap; }
        public void setFailOnGap(boolean failOnGap) { this.failOnGap = failOnGap; }
    }

    public static class Convert {
        private int parentExpandTokens = 1000;

        public int getParentExpandTokens() { return parentExpandTokens; }
        public void setParentExpandTokens(int parentExpandTokens) { this.parentExpandTokens = parentExpandTokens; }
    }

    public static class Context {
        /** Extract a context for every analyzable parent before batches run. */
        private boolean enabled = true;
        private int maxTokens = 2000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }
    }
}
