package com.stratum.core.port;

import com.stratum.core.StratumException;

/**
 * An annotation or transformation call that failed at the transport level. Fatal for the
 * file; never retried by the scheduler.
 */
public class AnnotationTransportException extends StratumException {

    private final int batchId;

    public AnnotationTransportException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public AnnotationTransportException(String message, int batchId, Throwable cause) {
        super(message, cause);
        this.batchId = batchId;
    }

    /** The batch whose call failed, or 0 when the call was not a batch call. */
    public int batchId() {
        return batchId;
    }
}
