package com.stratum.core.batch;

/**
 * Cost metric used for batch packing. Any monotonic function of text size works as long
 * as one planning run uses a single counter.
 */
@FunctionalInterface
public interface TokenCounter {

    int count(String text);
}
