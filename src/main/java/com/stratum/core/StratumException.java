package com.stratum.core;

/**
 * Base class for failures raised by the Stratum core.
 */
public class StratumException extends RuntimeException {

    public StratumException(String message) {
        super(message);
    }

    public StratumException(String message, Throwable cause) {
        super(message, cause);
    }
}
