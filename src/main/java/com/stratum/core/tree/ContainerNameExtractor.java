package com.stratum.core.tree;

import java.util.Optional;

/**
 * Resolves the declared name of a container node.
 */
@FunctionalInterface
public interface ContainerNameExtractor {

    /**
     * @param node    the raw container node
     * @param rawCode the node's numbered source lines
     * @return the declared name, or empty when none can be resolved
     */
    Optional<ContainerName> extract(RawNode node, String rawCode);
}
