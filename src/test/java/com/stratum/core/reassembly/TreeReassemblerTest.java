package com.stratum.core.reassembly;

import com.stratum.core.tree.CollectionResult;
import com.stratum.core.tree.RawNode;
import com.stratum.core.tree.StatementNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.stratum.core.tree.TestTrees.*;
import static org.junit.jupiter.api.Assertions.*;

class TreeReassemblerTest {

    private final TreeReassembler reassembler = new TreeReassembler();

    @Test
    @DisplayName("identity transform reproduces the root's raw code")
    void identityRoundTrip() {
        CollectionResult result = collect(threeLevel(), 20, analyzableProcedures());

        ReassemblyResult out = reassembler.reassemble(result.nodes(), StatementNode::rawCode);

        assertTrue(out.clean());
        assertEquals(result.root().rawCode(), out.text());
    }

    @Test
    @DisplayName("identity round trip holds for wide trees in any input order")
    void identityRoundTripWideTree() {
        RawNode root = RawNode.of(1, 30, "FILE",
                RawNode.named(2, 20, "PROCEDURE", "P1",
                        RawNode.of(3, 4, "DECLARE"),
                        RawNode.of(5, 15, "IF",
                                RawNode.of(6, 8, "SELECT"),
                                RawNode.of(10, 14, "LOOP",
                                        RawNode.of(11, 11, "UPDATE"))),
                        RawNode.of(17, 19, "INSERT")),
                RawNode.of(22, 29, "BEGIN",
                        RawNode.of(23, 23, "DELETE"),
                        RawNode.of(25, 28, "SELECT")));
        CollectionResult result = collect(root, 30, analyzableProcedures());
        List<StatementNode> shuffled = new ArrayList<>(result.nodes());
        Collections.reverse(shuffled);

        ReassemblyResult out = reassembler.reassemble(shuffled, StatementNode::rawCode);

        assertEquals(result.root().rawCode(), out.text());
    }

    @Test
    @DisplayName("child output is re-indented to the marker's indentation")
    void indentation() {
        CollectionResult result = collect(RawNode.of(1, 3, "BLOCK", RawNode.of(2, 2, "ASSIGN")), 3,
                analyzableProcedures());
        Map<String, String> skeletons = Map.of("BLOCK", "begin\n    2: ...code...\nend");

        ReassemblyResult out = reassembler.reassemble(result.nodes(),
                n -> skeletons.get(n.kind()),
                n -> "x := 1;\ny := 2;",
                StatementNode::hasChildren);

        assertEquals("begin\n    x := 1;\n    y := 2;\nend", out.text());
    }

    @Test
    @DisplayName("a marker no child fills is reported and left in place")
    void unmatchedMarker() {
        CollectionResult result = collect(threeLevel(), 20, analyzableProcedures());
        List<StatementNode> withoutSelect = result.nodes().stream()
                .filter(n -> !n.kind().equals("SELECT"))
                .toList();

        ReassemblyResult out = reassembler.reassemble(withoutSelect, StatementNode::rawCode);

        assertFalse(out.clean());
        assertEquals(List.of(7), out.unmatchedPlaceholders());
        assertTrue(out.text().contains("7: ...code..."));
    }

    @Test
    @DisplayName("a child without a matching marker is appended to its parent")
    void appendWithoutMarker() {
        CollectionResult result = collect(RawNode.of(1, 3, "BLOCK", RawNode.of(2, 2, "ASSIGN")), 3,
                analyzableProcedures());

        ReassemblyResult out = reassembler.reassemble(result.nodes(),
                n -> "begin\nend",
                n -> "x := 1;",
                StatementNode::hasChildren);

        assertEquals("begin\nend\nx := 1;", out.text());
        assertTrue(out.clean());
    }

    @Test
    @DisplayName("splice replaces only the marker for the given start line")
    void spliceTargetsStartLine() {
        var target = new StringBuilder("a\n3: ...code...\n  5:  ... code ...\nz");

        TreeReassembler.splice(target, 5, "five");

        assertEquals("a\n3: ...code...\n  five\nz", target.toString());
    }
}
