package com.stratum.core.tree;

import com.stratum.core.StratumException;

/**
 * A syntax tree that cannot be collected: a malformed span or an unresolvable container name.
 * Fatal for the file; raised before any batch work begins.
 */
public class CollectionException extends StratumException {

    private final String kind;
    private final int startLine;
    private final int endLine;

    public CollectionException(String message, String kind, int startLine, int endLine) {
        super(message + " [" + kind + " " + startLine + "~" + endLine + "]");
        this.kind = kind;
        this.startLine = startLine;
        this.endLine = endLine;
    }

    public String kind() {
        return kind;
    }

    public int startLine() {
        return startLine;
    }

    public int endLine() {
        return endLine;
    }
}
