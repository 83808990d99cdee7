package com.stratum.core.llm;

import com.stratum.core.port.BatchAnnotation;
import com.stratum.core.port.GroupSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;
import org.springframework.ai.chat.prompt.ChatOptions;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link LlmService}.
 * <p>
 * Mocks the entire {@link ChatClient} chain so no real LLM calls are made.
 */
class LlmServiceTest {

    private ChatClient mockChatClient;
    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private ChatClient.Builder mockBuilder;
    private LlmService llmService;

    @BeforeEach
    void setUp() {
        mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockRequestSpec.system(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.user(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        mockBuilder = mock(ChatClient.Builder.class);
        when(mockBuilder.build()).thenReturn(mockChatClient);
        when(mockBuilder.defaultOptions(any(ChatOptions.class))).thenReturn(mockBuilder);

        llmService = new LlmService(mockBuilder, new LlmProperties(), "http://test:1234");
    }

    @Test
    @DisplayName("a configured model becomes the default chat option")
    void configuredModelIsDefaultOption() {
        var properties = new LlmProperties();
        properties.setModel("gpt-4o-mini");
        properties.setTemperature(0.2);

        new LlmService(mockBuilder, properties, "http://test:1234");

        ArgumentCaptor<ChatOptions> options = ArgumentCaptor.forClass(ChatOptions.class);
        verify(mockBuilder).defaultOptions(options.capture());
        assertEquals("gpt-4o-mini", options.getValue().getModel());
        assertEquals(0.2, options.getValue().getTemperature());
    }

    @Test
    @DisplayName("without a configured model the builder defaults are kept")
    void blankModelKeepsBuilderDefaults() {
        verify(mockBuilder, never()).defaultOptions(any(ChatOptions.class));
    }

    @Test
    @DisplayName("structuredCall appends format instructions to the user prompt")
    void structuredCallAppendsFormatInstructions() {
        when(mockCallResponse.content()).thenReturn("{\"summary\":\"loads rows\"}");

        llmService.structuredCall("System prompt", "User prompt", GroupSummary.class);

        verify(mockRequestSpec).system("System prompt");
        ArgumentCaptor<String> userCaptor = ArgumentCaptor.forClass(String.class);
        verify(mockRequestSpec).user(userCaptor.capture());
        assertTrue(userCaptor.getValue().startsWith("User prompt\n\n"));
        assertTrue(userCaptor.getValue().length() > "User prompt\n\n".length());
    }

    @Test
    @DisplayName("structuredCall deserializes nested annotation results")
    void structuredCallDeserializesAnnotations() {
        when(mockCallResponse.content()).thenReturn("""
                {"results":[{"startLine":3,"endLine":5,"summary":"reads orders",
                  "crossRefs":[{"target":"ORDERS","edgeType":"READS","properties":{}}]}]}
                """);

        BatchAnnotation result = llmService.structuredCall("sys", "usr", BatchAnnotation.class);

        assertEquals(1, result.results().size());
        assertEquals("reads orders", result.results().get(0).summary());
        assertEquals("ORDERS", result.results().get(0).crossRefs().get(0).target());
    }

    @Test
    @DisplayName("structuredCall falls back to lenient parsing for fenced responses")
    void structuredCallFallsBackForFences() {
        when(mockCallResponse.content()).thenReturn("```json\n{\"summary\":\"ok\",\"extra\":1}\n```");

        GroupSummary result = llmService.structuredCall("sys", "usr", GroupSummary.class);

        assertEquals("ok", result.summary());
    }

    @Test
    @DisplayName("empty content is an error")
    void emptyContent() {
        when(mockCallResponse.content()).thenReturn("  ");

        assertThrows(LlmEmptyResponseException.class,
                () -> llmService.structuredCall("sys", "usr", GroupSummary.class));
    }

    @Test
    @DisplayName("unparseable content is an error")
    void unparseableContent() {
        when(mockCallResponse.content()).thenReturn("I cannot help with that.");

        assertThrows(LlmParseException.class,
                () -> llmService.structuredCall("sys", "usr", GroupSummary.class));
    }

    @Test
    @DisplayName("textCall strips a surrounding code fence")
    void textCallStripsFence() {
        when(mockCallResponse.content()).thenReturn("```java\nint x = 1;\n```");

        assertEquals("int x = 1;", llmService.textCall("sys", "usr"));
    }
}
