package com.stratum.core.tree;

import com.stratum.core.batch.TokenCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a parsed syntax tree into a flat post-order list of {@link StatementNode}s plus
 * the container entities found along the way.
 * <p>
 * Structural (non-analyzable) nodes have their completion signal fired at creation since
 * nothing will ever analyze them. Every analyzable node inside a container adds one to
 * that container's pending count.
 */
public class TreeCollector {

    private static final Logger log = LoggerFactory.getLogger(TreeCollector.class);

    private final NodeClassifier classifier;
    private final TokenCounter tokenCounter;

    public TreeCollector(NodeClassifier classifier, TokenCounter tokenCounter) {
        this.classifier = classifier;
        this.tokenCounter = tokenCounter;
    }

    public CollectionResult collect(SourceFile file) {
        if (file.root() == null) {
            throw new CollectionException("Source file has no syntax tree", "FILE", 0, 0);
        }
        String[] sourceLines = splitLines(file.sourceText());
        var run = new Run(file, sourceLines);
        run.visit(file.root(), null, null);
        log.debug("Collected {} nodes and {} containers from {}",
                run.nodes.size(), run.containers.size(), file.fileId());
        return new CollectionResult(file.fileId(), run.nodes, run.containers);
    }

    static String[] splitLines(String text) {
        if (text == null || text.isEmpty()) {
            return new String[0];
        }
        String normalized = text.replace("\r\n", "\n");
        if (normalized.endsWith("\n")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized.split("\n", -1);
    }

    private final class Run {

        private final SourceFile file;
        private final String[] sourceLines;
        private final List<StatementNode> nodes = new ArrayList<>();
        private final Map<String, ContainerInfo> containers = new LinkedHashMap<>();
        private final Map<String, Integer> spanOccurrences = new HashMap<>();
        private int nextId = 1;

        Run(SourceFile file, String[] sourceLines) {
            this.file = file;
            this.sourceLines = sourceLines;
        }

        StatementNode visit(RawNode raw, String containerKey, String containerName) {
            validateSpan(raw);
            List<String> lines = List.of(sourceLines).subList(raw.startLine() - 1, raw.endLine());

            if (classifier.isContainer(raw.kind(), containerKey != null)) {
                ContainerInfo info = registerContainer(raw, lines);
                containerKey = info.key();
                containerName = info.name();
            }

            List<StatementNode> childNodes = new ArrayList<>(raw.children().size());
            for (RawNode child : raw.children()) {
                childNodes.add(visit(child, containerKey, containerName));
            }

            boolean analyzable = classifier.isAnalyzable(raw.kind());
            var node = new StatementNode(nextId++, raw.startLine(), raw.endLine(), raw.kind(), lines,
                    analyzable, containerKey, containerName);
            childNodes.forEach(node::attachChild);
            node.setTokenCount(tokenCounter.count(node.rawCode()));
            node.setKeyOrdinal(spanOccurrences.merge(raw.kind() + "@" + node.span(), 1, Integer::sum) - 1);

            if (!analyzable) {
                node.completionSignal().signal();
            } else if (containerKey != null) {
                containers.get(containerKey).addPending();
            }

            nodes.add(node);
            log.trace("Collected {} {} ({} tokens, {} children)",
                    raw.kind(), node.span(), node.tokenCount(), childNodes.size());
            return node;
        }

        private ContainerInfo registerContainer(RawNode raw, List<String> lines) {
            String numbered = numbered(raw.startLine(), lines);
            Optional<ContainerName> declared = classifier.nameExtractor().extract(raw, numbered);

            String name;
            String scope;
            if (declared.isPresent()) {
                name = declared.get().name();
                scope = declared.get().scope();
            } else if (classifier.allowsAnonymousContainer(raw.kind())) {
                name = "anonymous_" + raw.startLine();
                scope = null;
            } else {
                throw new CollectionException("Cannot resolve container name in " + file.fileId(),
                        raw.kind(), raw.startLine(), raw.endLine());
            }

            String key = containerKey(name, raw.startLine());
            return containers.computeIfAbsent(key, k -> {
                log.debug("Container found: {} {} ({}~{})", raw.kind(), k, raw.startLine(), raw.endLine());
                return new ContainerInfo(k, raw.kind(), name, scope, raw.startLine(), raw.endLine());
            });
        }

        private String containerKey(String name, int startLine) {
            String directory = file.directory() == null ? "" : file.directory();
            return directory + ":" + file.fileName() + ":" + name + ":" + startLine;
        }

        private void validateSpan(RawNode raw) {
            if (raw.startLine() < 1 || raw.endLine() < raw.startLine()) {
                throw new CollectionException("Malformed span in " + file.fileId(),
                        raw.kind(), raw.startLine(), raw.endLine());
            }
            if (raw.endLine() > sourceLines.length) {
                throw new CollectionException("Span extends past end of " + file.fileId()
                        + " (" + sourceLines.length + " lines)", raw.kind(), raw.startLine(), raw.endLine());
            }
        }

        private String numbered(int startLine, List<String> lines) {
            var sb = new StringBuilder();
            for (int i = 0; i < lines.size(); i++) {
                if (i > 0) {
                    sb.append('\n');
                }
                sb.append(startLine + i).append(": ").append(lines.get(i));
            }
            return sb.toString();
        }
    }
}
