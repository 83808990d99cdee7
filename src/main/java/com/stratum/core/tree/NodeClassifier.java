package com.stratum.core.tree;

/**
 * Decides, per syntax family, which node kinds open containers and which are
 * structural wrappers that are never analyzed.
 */
public interface NodeClassifier {

    /**
     * @param kind            the node kind
     * @param insideContainer whether an enclosing container is already open
     */
    boolean isContainer(String kind, boolean insideContainer);

    boolean isAnalyzable(String kind);

    /** Containers of this kind may be keyed {@code anonymous_<startLine>} when no name resolves. */
    boolean allowsAnonymousContainer(String kind);

    ContainerNameExtractor nameExtractor();

    /** Whether a {@code NEXT} edge should not be drawn from a node of this kind to its next sibling. */
    default boolean breaksSiblingChain(String kind) {
        return false;
    }
}
