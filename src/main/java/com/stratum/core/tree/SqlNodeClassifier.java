package com.stratum.core.tree;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Node classification for procedural SQL (PL/SQL, T-SQL style) trees.
 */
public class SqlNodeClassifier implements NodeClassifier {

    static final Set<String> CONTAINER_KINDS =
            Set.of("PROCEDURE", "FUNCTION", "CREATE_PROCEDURE_BODY", "TRIGGER", "BEGIN");

    static final Set<String> NON_ANALYZABLE_KINDS =
            Set.of("CREATE_PROCEDURE_BODY", "FILE", "PROCEDURE", "FUNCTION", "DECLARE", "TRIGGER", "SPEC");

    private static final Set<String> CHAIN_BREAKERS =
            Set.of("FUNCTION", "PROCEDURE", "PACKAGE_VARIABLE", "TRIGGER");

    private static final Pattern HEADER = Pattern.compile(
            "\\b(?:CREATE\\s+(?:OR\\s+REPLACE\\s+)?)?(?:PROCEDURE|FUNCTION|TRIGGER)\\s+"
                    + "((?:\"[^\"]+\"|[A-Za-z_][\\w$#]*)(?:\\s*\\.\\s*(?:\"[^\"]+\"|[A-Za-z_][\\w$#]*)){0,2})",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern LINE_PREFIX = Pattern.compile("(?m)^\\d+\\s*:\\s*");

    @Override
    public boolean isContainer(String kind, boolean insideContainer) {
        if (!CONTAINER_KINDS.contains(kind)) {
            return false;
        }
        // a BEGIN block only opens a container at top level
        return !"BEGIN".equals(kind) || !insideContainer;
    }

    @Override
    public boolean isAnalyzable(String kind) {
        return !NON_ANALYZABLE_KINDS.contains(kind);
    }

    @Override
    public boolean allowsAnonymousContainer(String kind) {
        return "BEGIN".equals(kind);
    }

    @Override
    public ContainerNameExtractor nameExtractor() {
        return SqlNodeClassifier::extractName;
    }

    @Override
    public boolean breaksSiblingChain(String kind) {
        return CHAIN_BREAKERS.contains(kind);
    }

    static Optional<ContainerName> extractName(RawNode node, String rawCode) {
        if ("BEGIN".equals(node.kind())) {
            return Optional.empty();
        }
        if (node.name() != null && !node.name().isBlank()) {
            return Optional.of(new ContainerName(node.scope(), node.name()));
        }
        return parseHeader(rawCode);
    }

    /**
     * Parses {@code CREATE [OR REPLACE] PROCEDURE|FUNCTION|TRIGGER [schema.]name}.
     * A three-part name keeps the last two parts as the name.
     */
    static Optional<ContainerName> parseHeader(String code) {
        if (code == null) {
            return Optional.empty();
        }
        Matcher m = HEADER.matcher(LINE_PREFIX.matcher(code).replaceAll(""));
        if (!m.find()) {
            return Optional.empty();
        }
        List<String> parts = Arrays.stream(m.group(1).split("\\s*\\.\\s*"))
                .map(part -> part.strip().replace("\"", ""))
                .collect(Collectors.toList());
        return switch (parts.size()) {
            case 3 -> Optional.of(new ContainerName(parts.get(0), parts.get(1) + "." + parts.get(2)));
            case 2 -> Optional.of(new ContainerName(parts.get(0), parts.get(1)));
            case 1 -> Optional.of(new ContainerName(null, parts.get(0)));
            default -> Optional.empty();
        };
    }
}
