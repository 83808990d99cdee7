package com.stratum.core.config;

import com.stratum.core.pipeline.PipelineSettings;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class StratumPropertiesTest {

    @Test
    void defaultsAreReasonable() {
        var props = new StratumProperties();
        assertEquals(1000, props.getTokenLimit());
        assertEquals(5, props.getMaxConcurrency());
        assertEquals(Duration.ofSeconds(300), props.getAnnotationTimeout());
        assertEquals("en", props.getLocale());
        assertFalse(props.isFailOnGap());
        assertTrue(props.isParentContextEnabled());
        assertEquals(2000, props.getMaxContextTokens());
    }

    @Test
    void pipelineSettingsFollowNestedValues() {
        var props = new StratumProperties();
        props.getBatch().setTokenLimit(2500);
        props.getConcurrency().setMaxConcurrency(8);
        props.getAnnotation().setTimeoutSeconds(45);
        props.getApply().setFailOnGap(true);
        props.getContext().setEnabled(false);
        props.getContext().setMaxTokens(500);

        PipelineSettings settings = PipelineSettings.from(props);

        assertEquals(2500, settings.tokenLimit());
        assertEquals(8, settings.maxConcurrency());
        assertEquals(Duration.ofSeconds(45), settings.callDeadline());
        assertTrue(settings.failOnGap());
        assertFalse(settings.parentContext());
        assertEquals(500, settings.maxContextTokens());
    }
}
