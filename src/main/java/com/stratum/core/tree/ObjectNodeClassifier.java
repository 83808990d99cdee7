package com.stratum.core.tree;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Node classification for object-oriented source trees (Java-like syntax).
 * Nested type declarations stay in the outermost type's container.
 */
public class ObjectNodeClassifier implements NodeClassifier {

    static final Set<String> CONTAINER_KINDS = Set.of("CLASS", "INTERFACE", "ENUM", "RECORD", "ANNOTATION");

    static final Set<String> NON_ANALYZABLE_KINDS = Set.of("FILE", "PACKAGE", "IMPORT");

    private static final List<Pattern> DECLARATIONS = List.of(
            Pattern.compile("@interface\\s+(\\w+)"),
            Pattern.compile("\\bclass\\s+(\\w+)"),
            Pattern.compile("\\binterface\\s+(\\w+)"),
            Pattern.compile("\\benum\\s+(\\w+)"),
            Pattern.compile("\\brecord\\s+(\\w+)"));

    @Override
    public boolean isContainer(String kind, boolean insideContainer) {
        return CONTAINER_KINDS.contains(kind) && !insideContainer;
    }

    @Override
    public boolean isAnalyzable(String kind) {
        return !NON_ANALYZABLE_KINDS.contains(kind);
    }

    @Override
    public boolean allowsAnonymousContainer(String kind) {
        return false;
    }

    @Override
    public ContainerNameExtractor nameExtractor() {
        return ObjectNodeClassifier::extractName;
    }

    static Optional<ContainerName> extractName(RawNode node, String rawCode) {
        if (node.name() != null && !node.name().isBlank()) {
            return Optional.of(new ContainerName(node.scope(), node.name()));
        }
        if (rawCode == null) {
            return Optional.empty();
        }
        for (Pattern declaration : DECLARATIONS) {
            Matcher m = declaration.matcher(rawCode);
            if (m.find()) {
                return Optional.of(new ContainerName(node.scope(), m.group(1)));
            }
        }
        return Optional.empty();
    }
}
