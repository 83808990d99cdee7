package com.stratum.core.reassembly;

import com.stratum.core.tree.StatementNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds one linear text from per-node outputs by splicing children into their parent's
 * placeholder markers.
 * <p>
 * Nodes are walked by ascending start line (enclosing nodes first on ties). Entering a
 * frame-opening node pushes a frame seeded with the node's skeleton; every other node's text
 * is spliced into the top frame. A frame is closed, and spliced into its own parent, once
 * the walk passes its end line. Splicing replaces the marker line {@code <start>: ...code...}
 * for the child's start line, re-indenting the child to the marker's indentation; without a
 * matching marker the child is appended. Markers never filled are left in place and reported.
 */
public class TreeReassembler {

    private static final Logger log = LoggerFactory.getLogger(TreeReassembler.class);

    static final Pattern MARKER = Pattern.compile("(?m)^([ \\t]*)(\\d+):\\s*\\.\\.\\.\\s*code\\s*\\.\\.\\.[ \\t]*$");

    /**
     * Reassembles using each parent's {@link StatementNode#placeholderCode()} as its skeleton.
     */
    public ReassemblyResult reassemble(List<StatementNode> nodesInSourceOrder,
                                       Function<StatementNode, String> transformedLeaf) {
        return reassemble(nodesInSourceOrder, StatementNode::placeholderCode, transformedLeaf,
                StatementNode::hasChildren);
    }

    /**
     * @param nodes           the units to place; nodes outside any unit must be omitted
     * @param skeleton        initial text of a frame, one marker per child slot
     * @param transformedLeaf output of a non-frame unit
     * @param opensFrame      which units are expanded as frames
     */
    public ReassemblyResult reassemble(List<StatementNode> nodes,
                                       Function<StatementNode, String> skeleton,
                                       Function<StatementNode, String> transformedLeaf,
                                       Predicate<StatementNode> opensFrame) {
        List<StatementNode> ordered = new ArrayList<>(nodes);
        ordered.sort(Comparator.comparingInt(StatementNode::startLine)
                .thenComparing(Comparator.comparingInt(StatementNode::endLine).reversed())
                .thenComparingInt(TreeReassembler::depth));

        Deque<Frame> stack = new ArrayDeque<>();
        var output = new StringBuilder();

        for (StatementNode node : ordered) {
            while (!stack.isEmpty() && stack.peek().node().endLine() < node.startLine()) {
                close(stack, output);
            }
            if (opensFrame.test(node)) {
                stack.push(new Frame(node, new StringBuilder(nullToEmpty(skeleton.apply(node)))));
            } else {
                place(stack, output, node.startLine(), nullToEmpty(transformedLeaf.apply(node)));
            }
        }
        while (!stack.isEmpty()) {
            close(stack, output);
        }

        List<Integer> unmatched = new ArrayList<>();
        Matcher m = MARKER.matcher(output);
        while (m.find()) {
            unmatched.add(Integer.parseInt(m.group(2)));
        }
        if (!unmatched.isEmpty()) {
            log.warn("{} placeholder marker(s) left unmatched at lines {}", unmatched.size(), unmatched);
        }
        return new ReassemblyResult(output.toString(), unmatched);
    }

    private static void close(Deque<Frame> stack, StringBuilder output) {
        Frame frame = stack.pop();
        place(stack, output, frame.node().startLine(), frame.text().toString());
    }

    private static void place(Deque<Frame> stack, StringBuilder output, int startLine, String text) {
        if (stack.isEmpty()) {
            appendLine(output, text);
        } else {
            splice(stack.peek().text(), startLine, text);
        }
    }

    /**
     * Replaces the marker for {@code startLine} with {@code text}, or appends when there is none.
     */
    static void splice(StringBuilder target, int startLine, String text) {
        Matcher m = MARKER.matcher(target);
        while (m.find()) {
            if (Integer.parseInt(m.group(2)) == startLine) {
                target.replace(m.start(), m.end(), indent(text, m.group(1)));
                return;
            }
        }
        appendLine(target, text);
    }

    static String indent(String text, String indent) {
        if (indent.isEmpty()) {
            return text;
        }
        String[] lines = text.split("\n", -1);
        var sb = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            if (!lines[i].isEmpty()) {
                sb.append(indent);
            }
            sb.append(lines[i]);
        }
        return sb.toString();
    }

    private static void appendLine(StringBuilder target, String text) {
        if (target.length() > 0 && target.charAt(target.length() - 1) != '\n') {
            target.append('\n');
        }
        target.append(text);
    }

    private static int depth(StatementNode node) {
        int depth = 0;
        for (StatementNode p = node.parent(); p != null; p = p.parent()) {
            depth++;
        }
        return depth;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private record Frame(StatementNode node, StringBuilder text) {}
}
