package com.stratum.core.port;

import com.stratum.core.tree.CollectionResult;
import com.stratum.core.tree.RawNode;
import com.stratum.core.tree.StatementNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.stratum.core.tree.TestTrees.*;
import static org.junit.jupiter.api.Assertions.*;

class GraphKeysTest {

    @Test
    @DisplayName("repeated kind and span get numbered keys and fragment labels")
    void duplicateSpans() {
        CollectionResult collection = collect(RawNode.of(1, 3, "FILE",
                RawNode.of(2, 2, "SELECT"),
                RawNode.of(2, 2, "SELECT"),
                RawNode.of(2, 2, "UPDATE")), 3, analyzableProcedures());

        List<StatementNode> leaves = collection.nodes().stream().filter(n -> !n.hasChildren()).toList();

        assertEquals(List.of("db/proc.sql#SELECT@2-2", "db/proc.sql#SELECT@2-2/2", "db/proc.sql#UPDATE@2-2"),
                leaves.stream().map(n -> GraphKeys.node("db/proc.sql", n)).toList());
        assertEquals(List.of("SELECT_2_2", "SELECT_2_2_2", "UPDATE_2_2"),
                leaves.stream().map(GraphKeys::fragment).toList());
    }

    @Test
    @DisplayName("entity keys are prefixed and recognized")
    void entities() {
        assertEquals("entity:ORDERS", GraphKeys.entity("ORDERS"));
        assertTrue(GraphKeys.isEntity("entity:ORDERS"));
        assertFalse(GraphKeys.isEntity("db/proc.sql#SELECT@2-2"));
    }
}
