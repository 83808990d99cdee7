package com.stratum.core.llm;

import com.stratum.core.port.AnnotationPort;
import com.stratum.core.port.BatchAnnotation;
import com.stratum.core.port.GroupSummary;
import com.stratum.core.port.LineRange;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link AnnotationPort} backed by {@link LlmService} structured calls.
 */
@Component
public class LlmAnnotationPort implements AnnotationPort {

    static final String ANALYZE_SYSTEM = """
            You summarize source code statements. For every requested line range, in the order listed, \
            return one result with the same startLine and endLine, a concise summary of what the statement does, and any \
            referenced tables, procedures or types as crossRefs (target, edgeType such as READS, WRITES, CALLS). \
            Omit ranges you cannot summarize.""";

    static final String GROUP_SYSTEM = """
            You combine statement summaries of one procedure or class into a single summary \
            describing its overall purpose and flow.""";

    static final String CONTEXT_SYSTEM = """
            You read the skeleton of a code block whose nested statements are elided as \
            "<line>: ...code..." markers. Describe in a few sentences what the block is for and the \
            variables, aliases, cursors and parameters its nested statements rely on. Use the enclosing \
            context, when given, to resolve names. Reply with plain text only.""";

    private final LlmService llmService;

    public LlmAnnotationPort(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public BatchAnnotation analyzeBatch(String payload, List<LineRange> ranges, String context, String locale) {
        String rangeList = ranges.stream()
                .map(r -> r.startLine() + "~" + r.endLine())
                .collect(Collectors.joining(", "));
        String user = "Language for summaries: " + locale
                + "\nRanges: " + rangeList
                + (context == null || context.isBlank() ? "" : "\n\nEnclosing context:\n" + context)
                + "\n\nCode:\n" + payload;
        return llmService.structuredCall(ANALYZE_SYSTEM, user, BatchAnnotation.class);
    }

    @Override
    public GroupSummary summarizeGroup(Map<String, String> namedFragments, String locale) {
        String fragments = namedFragments.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("\n"));
        String user = "Language for the summary: " + locale + "\n\nStatement summaries:\n" + fragments;
        return llmService.structuredCall(GROUP_SYSTEM, user, GroupSummary.class);
    }

    @Override
    public String extractContext(String skeleton, String ancestorContext, String locale) {
        String user = "Language: " + locale
                + (ancestorContext == null || ancestorContext.isBlank() ? "" : "\n\nEnclosing context:\n" + ancestorContext)
                + "\n\nSkeleton:\n" + skeleton;
        return llmService.textCall(CONTEXT_SYSTEM, user);
    }
}
