package com.stratum.core.port;

import com.stratum.core.tree.StatementNode;

/**
 * Stable graph identities for collected nodes and referenced entities.
 * <p>
 * A node key is {@code fileId#KIND@start-end}. Nodes repeating the kind and span of an
 * earlier node in the same file get a {@code /n} suffix, n counting from 2.
 */
public final class GraphKeys {

    public static final String ENTITY_PREFIX = "entity:";

    private GraphKeys() {}

    public static String node(String fileId, StatementNode node) {
        String key = fileId + "#" + node.kind() + "@" + node.startLine() + "-" + node.endLine();
        return node.keyOrdinal() == 0 ? key : key + "/" + (node.keyOrdinal() + 1);
    }

    /** Label of a node's summary inside its container's fragment map. */
    public static String fragment(StatementNode node) {
        String label = node.kind() + "_" + node.startLine() + "_" + node.endLine();
        return node.keyOrdinal() == 0 ? label : label + "_" + (node.keyOrdinal() + 1);
    }

    public static String entity(String target) {
        return ENTITY_PREFIX + target;
    }

    public static boolean isEntity(String key) {
        return key.startsWith(ENTITY_PREFIX);
    }
}
