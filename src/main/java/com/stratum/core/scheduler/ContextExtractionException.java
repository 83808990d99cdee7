package com.stratum.core.scheduler;

import com.stratum.core.StratumException;
import com.stratum.core.tree.StatementNode;

/**
 * Context extraction failed for a parent node; its children cannot be analyzed reliably.
 */
public class ContextExtractionException extends StratumException {

    private final String location;

    public ContextExtractionException(StatementNode node, Throwable cause) {
        super("Context extraction failed for " + node.kind() + " " + node.span() + ": " + cause.getMessage(), cause);
        this.location = node.kind() + " " + node.span();
    }

    /** Kind and span of the parent, e.g. {@code "IF 8~14"}. */
    public String location() {
        return location;
    }
}
