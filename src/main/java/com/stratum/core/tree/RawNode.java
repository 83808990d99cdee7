package com.stratum.core.tree;

import java.util.List;

/**
 * One element of the parser's syntax tree, before collection.
 *
 * @param startLine first source line, 1-based and inclusive
 * @param endLine   last source line, inclusive
 * @param kind      statement type or entity kind (e.g. "SELECT", "PROCEDURE", "CLASS")
 * @param name      declared name when the parser resolved one (nullable)
 * @param scope     enclosing schema or package when the parser resolved one (nullable)
 * @param children  nested elements in source order
 */
public record RawNode(
    int startLine,
    int endLine,
    String kind,
    String name,
    String scope,
    List<RawNode> children
) {
    public RawNode {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static RawNode of(int startLine, int endLine, String kind, RawNode... children) {
        return new RawNode(startLine, endLine, kind, null, null, List.of(children));
    }

    public static RawNode named(int startLine, int endLine, String kind, String name, RawNode... children) {
        return new RawNode(startLine, endLine, kind, name, null, List.of(children));
    }
}
