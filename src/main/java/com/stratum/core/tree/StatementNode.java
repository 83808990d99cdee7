package com.stratum.core.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * One syntax-tree element of a collected file.
 * <p>
 * Created by {@link TreeCollector} in a single traversal. After collection the only
 * mutable state is the summary and the parent context, each written once, the
 * incomplete flag, and the {@link CompletionSignal}.
 * Code views are derived on demand from the node's numbered source lines:
 * <ul>
 *   <li>{@link #rawCode()} – every line of the span as {@code "<lineNo>: <text>"}</li>
 *   <li>{@link #compactCode()} – child spans replaced by {@code "<start>~<end>: <summary>"}</li>
 *   <li>{@link #placeholderCode()} – child spans replaced by {@code "<start>: ...code..."}</li>
 * </ul>
 */
public final class StatementNode {

    public static final String PLACEHOLDER_TOKEN = "...code...";

    private final int id;
    private final int startLine;
    private final int endLine;
    private final String kind;
    private final List<String> lines;
    private final boolean analyzable;
    private final String containerKey;
    private final String containerName;
    private final List<StatementNode> children = new ArrayList<>();
    private final AtomicReference<String> summary = new AtomicReference<>();
    private final AtomicReference<String> context = new AtomicReference<>();
    private final AtomicBoolean incomplete = new AtomicBoolean();
    private final CompletionSignal completionSignal = new CompletionSignal();
    private StatementNode parent;
    private int tokenCount;
    private int keyOrdinal;

    StatementNode(int id, int startLine, int endLine, String kind, List<String> lines,
                  boolean analyzable, String containerKey, String containerName) {
        this.id = id;
        this.startLine = startLine;
        this.endLine = endLine;
        this.kind = kind;
        this.lines = List.copyOf(lines);
        this.analyzable = analyzable;
        this.containerKey = containerKey;
        this.containerName = containerName;
    }

    public int id() {
        return id;
    }

    public int startLine() {
        return startLine;
    }

    public int endLine() {
        return endLine;
    }

    public String kind() {
        return kind;
    }

    public boolean analyzable() {
        return analyzable;
    }

    public String containerKey() {
        return containerKey;
    }

    public String containerName() {
        return containerName;
    }

    public int tokenCount() {
        return tokenCount;
    }

    /**
     * Position of this node among earlier-collected nodes with the same kind and span;
     * 0 for the first. Keeps graph keys distinct for statements sharing a line.
     */
    public int keyOrdinal() {
        return keyOrdinal;
    }

    public StatementNode parent() {
        return parent;
    }

    public CompletionSignal completionSignal() {
        return completionSignal;
    }

    public List<StatementNode> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /** Source text of the span without line-number prefixes. */
    public List<String> sourceLines() {
        return lines;
    }

    public String summary() {
        return summary.get();
    }

    /**
     * Records the node's summary.
     *
     * @return false if a summary was already recorded; the first one is kept
     */
    public boolean recordSummary(String text) {
        return summary.compareAndSet(null, text);
    }

    /** Condensed description of this parent's role, produced before batch analysis; null if none. */
    public String context() {
        return context.get();
    }

    /**
     * @return false if a context was already recorded
     */
    public boolean recordContext(String text) {
        return context.compareAndSet(null, text);
    }

    /** True when this node or some analyzable descendant was left without a summary. */
    public boolean isIncomplete() {
        return incomplete.get();
    }

    public void markIncomplete() {
        incomplete.set(true);
    }

    public String span() {
        return startLine + "~" + endLine;
    }

    public String rawCode() {
        List<String> out = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            out.add(numbered(startLine + i));
        }
        return String.join("\n", out);
    }

    /**
     * Parent code with each child span replaced by the child's summary. A structural child
     * that is never analyzed contributes its raw lines; an analyzable child without a
     * summary contributes a placeholder marker.
     */
    public String compactCode() {
        if (children.isEmpty()) {
            return rawCode();
        }
        return render(child -> {
            String childSummary = child.summary();
            if (childSummary != null && !childSummary.isBlank()) {
                return child.startLine + "~" + child.endLine + ": " + childSummary.strip();
            }
            if (!child.analyzable) {
                return child.rawCode();
            }
            return placeholderFor(child);
        });
    }

    /** Parent code with each child span replaced by a placeholder marker, never by summary text. */
    public String placeholderCode() {
        if (children.isEmpty()) {
            return rawCode();
        }
        return render(StatementNode::placeholderFor);
    }

    public static String placeholderFor(StatementNode child) {
        return child.startLine + ": " + PLACEHOLDER_TOKEN;
    }

    void attachChild(StatementNode child) {
        child.parent = this;
        children.add(child);
    }

    void setTokenCount(int tokenCount) {
        this.tokenCount = tokenCount;
    }

    void setKeyOrdinal(int keyOrdinal) {
        this.keyOrdinal = keyOrdinal;
    }

    private String numbered(int lineNo) {
        return lineNo + ": " + lines.get(lineNo - startLine);
    }

    private String render(Function<StatementNode, String> childView) {
        List<StatementNode> sorted = new ArrayList<>(children);
        sorted.sort(Comparator.comparingInt(StatementNode::startLine));

        List<String> out = new ArrayList<>();
        int line = startLine;
        for (StatementNode child : sorted) {
            while (line <= endLine && line < child.startLine) {
                out.add(numbered(line++));
            }
            out.add(childView.apply(child));
            line = Math.max(line, child.endLine + 1);
        }
        while (line <= endLine) {
            out.add(numbered(line++));
        }
        return String.join("\n", out);
    }

    @Override
    public String toString() {
        return "StatementNode[" + id + " " + kind + " " + span() + "]";
    }
}
