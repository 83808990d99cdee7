package com.stratum.core.tree;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SqlNodeClassifierTest {

    private final SqlNodeClassifier classifier = new SqlNodeClassifier();

    @Test
    @DisplayName("routines are structural containers")
    void routinesAreContainers() {
        assertTrue(classifier.isContainer("PROCEDURE", false));
        assertTrue(classifier.isContainer("FUNCTION", false));
        assertTrue(classifier.isContainer("TRIGGER", false));
        assertFalse(classifier.isAnalyzable("PROCEDURE"));
        assertFalse(classifier.isAnalyzable("DECLARE"));
        assertTrue(classifier.isAnalyzable("SELECT"));
    }

    @Test
    @DisplayName("BEGIN opens a container only at top level")
    void beginOnlyAtTopLevel() {
        assertTrue(classifier.isContainer("BEGIN", false));
        assertFalse(classifier.isContainer("BEGIN", true));
        assertTrue(classifier.allowsAnonymousContainer("BEGIN"));
        assertFalse(classifier.allowsAnonymousContainer("PROCEDURE"));
    }

    @Test
    @DisplayName("sibling chain breaks after routine declarations")
    void chainBreakers() {
        assertTrue(classifier.breaksSiblingChain("FUNCTION"));
        assertTrue(classifier.breaksSiblingChain("PACKAGE_VARIABLE"));
        assertFalse(classifier.breaksSiblingChain("SELECT"));
    }

    @Test
    @DisplayName("parser-supplied name wins over the header")
    void declaredName() {
        RawNode node = new RawNode(1, 3, "PROCEDURE", "calc", "fin", null);
        Optional<ContainerName> name = SqlNodeClassifier.extractName(node, "1: CREATE PROCEDURE other.thing");
        assertEquals(Optional.of(new ContainerName("fin", "calc")), name);
    }

    @Test
    @DisplayName("header parsing handles quoting and qualified names")
    void headerParsing() {
        assertEquals(Optional.of(new ContainerName(null, "load_rows")),
                SqlNodeClassifier.parseHeader("1: create procedure load_rows (p in number)"));
        assertEquals(Optional.of(new ContainerName("HR", "Pay Calc")),
                SqlNodeClassifier.parseHeader("3: CREATE OR REPLACE FUNCTION \"HR\".\"Pay Calc\" RETURN NUMBER"));
        assertEquals(Optional.of(new ContainerName("db", "hr.audit_emp")),
                SqlNodeClassifier.parseHeader("10: CREATE TRIGGER db.hr.audit_emp AFTER INSERT"));
    }

    @Test
    @DisplayName("no header and no declared name yields nothing")
    void noName() {
        assertTrue(SqlNodeClassifier.parseHeader("1: SELECT 1 FROM dual").isEmpty());
        assertTrue(SqlNodeClassifier.extractName(RawNode.of(1, 2, "BEGIN"), "1: BEGIN").isEmpty());
    }
}
