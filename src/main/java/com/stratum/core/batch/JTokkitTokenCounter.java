package com.stratum.core.batch;

import org.springframework.ai.tokenizer.JTokkitTokenCountEstimator;
import org.springframework.ai.tokenizer.TokenCountEstimator;
import org.springframework.stereotype.Component;

/**
 * Default {@link TokenCounter} backed by Spring AI's JTokkit estimator (cl100k_base).
 */
@Component
public class JTokkitTokenCounter implements TokenCounter {

    private final TokenCountEstimator estimator;

    public JTokkitTokenCounter() {
        this(new JTokkitTokenCountEstimator());
    }

    JTokkitTokenCounter(TokenCountEstimator estimator) {
        this.estimator = estimator;
    }

    @Override
    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return estimator.estimate(text);
    }
}
