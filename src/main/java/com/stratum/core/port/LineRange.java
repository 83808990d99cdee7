package com.stratum.core.port;

import java.io.Serializable;

/**
 * Inclusive source line span.
 */
public record LineRange(int startLine, int endLine) implements Serializable {

    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }

    @Override
    public String toString() {
        return startLine + "~" + endLine;
    }
}
