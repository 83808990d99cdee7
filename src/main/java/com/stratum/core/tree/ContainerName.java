package com.stratum.core.tree;

/**
 * Declared name of a container entity.
 *
 * @param scope enclosing schema or package (nullable)
 * @param name  declared name
 */
public record ContainerName(String scope, String name) {}
