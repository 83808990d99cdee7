package com.stratum.core.tree;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.stratum.core.tree.TestTrees.FIFTY_PER_NODE;
import static org.junit.jupiter.api.Assertions.*;

class ObjectNodeClassifierTest {

    private final ObjectNodeClassifier classifier = new ObjectNodeClassifier();

    @Test
    @DisplayName("nested types stay in the outermost container")
    void nestedTypes() {
        assertTrue(classifier.isContainer("CLASS", false));
        assertFalse(classifier.isContainer("CLASS", true));
        assertFalse(classifier.isContainer("METHOD", false));
        assertFalse(classifier.allowsAnonymousContainer("CLASS"));
    }

    @Test
    @DisplayName("annotation declarations are not mistaken for interfaces")
    void annotationName() {
        RawNode node = RawNode.of(1, 3, "ANNOTATION");
        assertEquals(Optional.of(new ContainerName(null, "Audited")),
                ObjectNodeClassifier.extractName(node, "1: public @interface Audited {"));
    }

    @Test
    @DisplayName("collects a class with a nested enum as one container")
    void collectsClass() {
        String source = String.join("\n",
                "package demo;",
                "public class Ledger {",
                "    enum State { OPEN, CLOSED }",
                "    void post() {",
                "        total += 1;",
                "    }",
                "}");
        RawNode root = RawNode.of(1, 7, "FILE",
                RawNode.of(1, 1, "PACKAGE"),
                RawNode.of(2, 7, "CLASS",
                        RawNode.of(3, 3, "ENUM"),
                        RawNode.of(4, 6, "METHOD",
                                RawNode.of(5, 5, "STATEMENT"))));

        CollectionResult result = new TreeCollector(classifier, FIFTY_PER_NODE)
                .collect(new SourceFile("src", "Ledger.java", root, source));

        assertEquals(1, result.containers().size());
        ContainerInfo info = result.containers().get("src:Ledger.java:Ledger:2");
        assertNotNull(info);
        // ENUM, STATEMENT, METHOD, CLASS
        assertEquals(4, info.pendingCount());
    }
}
