package com.stratum.core.port;

import java.time.Duration;

/**
 * An external call that exceeded its deadline. Handled exactly like a transport failure.
 */
public class AnnotationTimeoutException extends AnnotationTransportException {

    public AnnotationTimeoutException(String callName, int batchId, Duration deadline) {
        super(callName + " exceeded deadline of " + deadline.toSeconds() + "s", batchId, null);
    }
}
