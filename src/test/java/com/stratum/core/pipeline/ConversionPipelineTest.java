package com.stratum.core.pipeline;

import com.stratum.core.events.EventBus;
import com.stratum.core.events.StratumEvent;
import com.stratum.core.port.TransformationPort;
import com.stratum.core.tree.CollectionResult;
import com.stratum.core.tree.RawNode;
import com.stratum.core.tree.StatementNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.stratum.core.tree.TestTrees.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ConversionPipelineTest {

    private TransformationPort port;
    private EventBus eventBus;
    private List<StratumEvent> events;

    @BeforeEach
    void setUp() {
        port = mock(TransformationPort.class);
        when(port.transformSkeleton(anyString(), anyString())).thenAnswer(inv -> inv.getArgument(0));
        when(port.transformFragment(anyString(), anyString(), anyString())).thenAnswer(inv -> inv.getArgument(0));
        eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(events::add);
    }

    private ConversionPipeline pipeline(int parentExpandTokens) {
        return new ConversionPipeline(port, FIFTY_PER_NODE, eventBus, null,
                PipelineSettings.defaults().withParentExpandTokens(parentExpandTokens).withMaxConcurrency(2));
    }

    @Test
    @DisplayName("identity transforms reassemble to the original numbered source")
    void identityConversion() {
        ConversionResult result = pipeline(50).convert(file(threeLevel(), source(20)), analyzableProcedures());

        CollectionResult collection = collect(threeLevel(), 20, analyzableProcedures());
        assertEquals(collection.root().rawCode(), result.text());
        assertEquals(3, result.unitCount());
        assertTrue(result.unmatchedPlaceholders().isEmpty());
        verify(port, times(2)).transformSkeleton(anyString(), eq("en"));
        verify(port, times(1)).transformFragment(anyString(), anyString(), eq("en"));
    }

    @Test
    @DisplayName("small parents are transformed whole")
    void smallParentNotExpanded() {
        ConversionResult result = pipeline(1000).convert(file(threeLevel(), source(20)), analyzableProcedures());

        assertEquals(1, result.unitCount());
        verify(port, never()).transformSkeleton(anyString(), anyString());
        verify(port).transformFragment(startsWith("1: stmt 1"), eq(""), eq("en"));
    }

    @Test
    @DisplayName("fragments receive the transformed skeleton of their nearest expanded parent")
    void fragmentContext() {
        when(port.transformSkeleton(anyString(), anyString()))
                .thenAnswer(inv -> "// converted\n" + inv.getArgument(0));

        pipeline(50).convert(file(threeLevel(), source(20)), analyzableProcedures());

        verify(port).transformFragment(startsWith("7: stmt 7"), startsWith("// converted\n5: stmt 5"), eq("en"));
    }

    @Test
    @DisplayName("unit selection walks expanded parents in pre-order")
    void selectUnits() {
        CollectionResult collection = collect(threeLevel(), 20, analyzableProcedures());
        Set<StatementNode> frames = new HashSet<>();
        List<StatementNode> units = new ArrayList<>();

        pipeline(50).selectUnits(collection.root(), frames, units);

        assertEquals(List.of("PROCEDURE", "IF", "SELECT"), units.stream().map(StatementNode::kind).toList());
        assertEquals(2, frames.size());
    }

    @Test
    @DisplayName("stray markers are reported and announced")
    void unmatchedMarkers() {
        when(port.transformSkeleton(anyString(), anyString()))
                .thenAnswer(inv -> inv.getArgument(0) + "\n99: ...code...");

        ConversionResult result = pipeline(50).convert(file(threeLevel(), source(20)), analyzableProcedures());

        assertEquals(List.of(99, 99), result.unmatchedPlaceholders());
        assertTrue(events.stream().anyMatch(e -> e.eventType().equals("reassembly.warning")));
    }

    @Test
    @DisplayName("a failing transformation fails the file with the offending span")
    void transformationFailure() {
        when(port.transformFragment(anyString(), anyString(), anyString()))
                .thenThrow(new IllegalStateException("model unavailable"));

        var e = assertThrows(FileAnalysisException.class,
                () -> pipeline(50).convert(file(threeLevel(), source(20)), analyzableProcedures()));

        assertEquals("SELECT 7~10", e.location());
        assertEquals("file.failed", events.get(events.size() - 1).eventType());
    }

    @RepeatedTest(3)
    @DisplayName("the reported span is the unit that failed, not a sibling cancelled after it")
    void failureOrigin() {
        RawNode root = RawNode.named(1, 8, "PROCEDURE", "P1",
                RawNode.of(2, 3, "SELECT"),
                RawNode.of(5, 6, "UPDATE"));
        when(port.transformFragment(anyString(), anyString(), anyString())).thenAnswer(inv -> {
            String code = inv.getArgument(0);
            if (code.startsWith("5:")) {
                throw new IllegalStateException("model unavailable");
            }
            Thread.sleep(500);
            return code;
        });

        var e = assertThrows(FileAnalysisException.class,
                () -> pipeline(50).convert(file(root, source(8)), analyzableProcedures()));

        assertEquals("UPDATE 5~6", e.location());
        assertFalse(e.getCause() instanceof CancellationException);
    }
}
