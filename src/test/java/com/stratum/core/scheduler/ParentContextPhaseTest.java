package com.stratum.core.scheduler;

import com.stratum.core.batch.AnalysisBatch;
import com.stratum.core.port.AnnotationPort;
import com.stratum.core.tree.CollectionResult;
import com.stratum.core.tree.RawNode;
import com.stratum.core.tree.StatementNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.stratum.core.tree.TestTrees.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ParentContextPhaseTest {

    private AnnotationPort port;
    private CollectionResult collection;

    /** Procedure(1-20) > Loop(3-18) > If(5-15) > Select(7-10). */
    @BeforeEach
    void setUp() {
        port = mock(AnnotationPort.class);
        when(port.extractContext(anyString(), anyString(), anyString())).thenAnswer(inv -> {
            String skeleton = inv.getArgument(0);
            return " ctx " + skeleton.substring(0, skeleton.indexOf(':')) + " ";
        });
        collection = collect(RawNode.named(1, 20, "PROCEDURE", "P1",
                RawNode.of(3, 18, "LOOP",
                        RawNode.of(5, 15, "IF",
                                RawNode.of(7, 10, "SELECT")))), 20, analyzableProcedures());
    }

    private ParentContextPhase phase(int maxContextTokens) {
        return new ParentContextPhase(port, FIFTY_PER_NODE, "db/proc.sql", "en", maxContextTokens);
    }

    private int run(ParentContextPhase phase) {
        try (var gate = new CallGate("test", 2, Duration.ofSeconds(5))) {
            return phase.run(collection, gate);
        }
    }

    private StatementNode node(String kind) {
        return collection.nodes().stream().filter(n -> n.kind().equals(kind)).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("parents are processed shallowest first with their ancestors' contexts")
    void topDown() {
        assertEquals(2, run(phase(2000)));

        verify(port).extractContext(startsWith("3: stmt 3"), eq(""), eq("en"));
        verify(port).extractContext(startsWith("5: stmt 5"), eq("[CONTEXT]\nctx 3\n[/CONTEXT]"), eq("en"));
        assertEquals("ctx 3", node("LOOP").context());
        assertEquals("ctx 5", node("IF").context());
    }

    @Test
    @DisplayName("the skeleton hides child code behind placeholder markers")
    void skeletonIsPlaceholderCode() {
        run(phase(2000));

        verify(port).extractContext(eq(node("IF").placeholderCode()), anyString(), eq("en"));
        assertTrue(node("IF").placeholderCode().contains("7: ...code..."));
    }

    @Test
    @DisplayName("container roots and leaves get no context")
    void containerRootSkipped() {
        run(phase(2000));

        verify(port, never()).extractContext(startsWith("1: stmt 1"), anyString(), anyString());
        verify(port, times(2)).extractContext(anyString(), anyString(), anyString());
        assertNull(node("PROCEDURE").context());
        assertNull(node("SELECT").context());
    }

    @Test
    @DisplayName("a batch carries its members' ancestor contexts, outermost first")
    void batchContext() {
        ParentContextPhase phase = phase(2000);
        run(phase);

        assertEquals("[CONTEXT]\nctx 3\n---\nctx 5\n[/CONTEXT]",
                phase.contextFor(new AnalysisBatch(1, List.of(node("SELECT")))));
    }

    @Test
    @DisplayName("ancestor contexts beyond the token limit are left out, nearest kept")
    void tokenLimit() {
        ParentContextPhase phase = phase(60);
        run(phase);

        assertEquals("[CONTEXT]\nctx 5\n[/CONTEXT]", phase.ancestorContext(node("SELECT")));
    }

    @Test
    @DisplayName("a failed extraction names the parent and stops deeper levels")
    void failure() {
        doThrow(new IllegalStateException("model unavailable"))
                .when(port).extractContext(startsWith("3: stmt 3"), anyString(), anyString());

        var e = assertThrows(ContextExtractionException.class, () -> run(phase(2000)));

        assertEquals("LOOP 3~18", e.location());
        verify(port, never()).extractContext(startsWith("5: stmt 5"), anyString(), anyString());
    }

    @Test
    @DisplayName("a tree without analyzable parents makes no calls")
    void noParents() {
        collection = collect(RawNode.of(1, 3, "FILE", RawNode.of(1, 1, "SELECT"), RawNode.of(2, 3, "UPDATE")),
                3, analyzableProcedures());

        assertEquals(0, run(phase(2000)));
        verifyNoInteractions(port);
    }
}
