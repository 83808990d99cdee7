package com.stratum.graph;

import com.stratum.core.port.GraphKeys;
import com.stratum.core.port.GraphSink;
import com.stratum.core.port.LineRange;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * {@link GraphSink} writing parameterised {@code MERGE} statements through the Neo4j Java driver.
 * <p>
 * Values always travel as parameters. Labels and relationship types cannot be parameters, so
 * they are reduced to {@code [A-Z0-9_]} before being placed in the statement. Edge endpoints
 * are merged as {@code :Statement} nodes, or {@code :Entity} nodes for entity keys.
 */
public class Neo4jGraphSink implements GraphSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Neo4jGraphSink.class);

    private static final Pattern NON_IDENTIFIER = Pattern.compile("[^A-Z0-9_]");
    static final String STATEMENT_LABEL = "Statement";
    static final String ENTITY_LABEL = "Entity";

    private final Driver driver;
    private final String database;

    public Neo4jGraphSink(Driver driver, String database) {
        this.driver = driver;
        this.database = database;
    }

    @Override
    public void upsertNode(String nodeKey, String kind, LineRange span, Map<String, Object> properties) {
        String cypher = "MERGE (n:Statement {key: $key}) "
                + "SET n:" + identifier(kind) + ", n.kind = $kind, n.startLine = $startLine, "
                + "n.endLine = $endLine, n += $props";
        run(cypher, Map.of(
                "key", nodeKey,
                "kind", kind,
                "startLine", span.startLine(),
                "endLine", span.endLine(),
                "props", sanitize(properties)));
    }

    @Override
    public void upsertNodeSummary(String nodeKey, String kind, LineRange span, String summary,
                                  Map<String, Object> extraProperties) {
        String cypher = "MERGE (n:Statement {key: $key}) "
                + "SET n:" + identifier(kind) + ", n.kind = $kind, n.startLine = $startLine, "
                + "n.endLine = $endLine, n.summary = $summary, n += $props";
        run(cypher, Map.of(
                "key", nodeKey,
                "kind", kind,
                "startLine", span.startLine(),
                "endLine", span.endLine(),
                "summary", summary,
                "props", sanitize(extraProperties)));
    }

    @Override
    public void upsertEdge(String fromKey, String toKey, String edgeType, Map<String, Object> properties) {
        String cypher = "MERGE (a:" + labelOf(fromKey) + " {key: $from}) "
                + "MERGE (b:" + labelOf(toKey) + " {key: $to}) "
                + (GraphKeys.isEntity(toKey) ? "SET b.name = $toName " : "")
                + "MERGE (a)-[r:" + identifier(edgeType) + "]->(b) "
                + "SET r += $props";
        run(cypher, Map.of(
                "from", fromKey,
                "to", toKey,
                "toName", GraphKeys.isEntity(toKey) ? toKey.substring(GraphKeys.ENTITY_PREFIX.length()) : toKey,
                "props", sanitize(properties)));
    }

    @Override
    public void upsertContainerSummary(String containerKey, String summary) {
        run("MERGE (c:Container {key: $key}) SET c.summary = $summary",
                Map.of("key", containerKey, "summary", summary));
    }

    @Override
    public void close() {
        driver.close();
    }

    private void run(String cypher, Map<String, Object> params) {
        log.trace("Cypher: {}", cypher);
        try (Session session = driver.session(SessionConfig.forDatabase(database))) {
            session.executeWriteWithoutResult(tx -> tx.run(cypher, params));
        }
    }

    static String identifier(String raw) {
        String cleaned = NON_IDENTIFIER.matcher(raw.toUpperCase(Locale.ROOT)).replaceAll("_");
        if (cleaned.isEmpty() || Character.isDigit(cleaned.charAt(0))) {
            cleaned = "T_" + cleaned;
        }
        return cleaned;
    }

    static String labelOf(String key) {
        return GraphKeys.isEntity(key) ? ENTITY_LABEL : STATEMENT_LABEL;
    }

    /**
     * Reduces properties to values Neo4j accepts: nulls are dropped, nested maps are flattened
     * into {@code parent_child} keys, and lists holding anything but scalars become strings.
     */
    static Map<String, Object> sanitize(Map<String, Object> properties) {
        var clean = new LinkedHashMap<String, Object>();
        flatten("", properties, clean);
        return clean;
    }

    private static void flatten(String prefix, Map<?, ?> source, Map<String, Object> target) {
        source.forEach((k, v) -> {
            String key = prefix + k;
            if (v == null) {
                return;
            }
            if (v instanceof Map<?, ?> nested) {
                flatten(key + "_", nested, target);
            } else if (v instanceof Collection<?> values) {
                boolean scalars = values.stream().allMatch(Neo4jGraphSink::isScalar);
                target.put(key, scalars ? List.copyOf(values) : values.toString());
            } else if (isScalar(v)) {
                target.put(key, v);
            } else {
                log.debug("Storing property {} of type {} as text", key, v.getClass().getSimpleName());
                target.put(key, v.toString());
            }
        });
    }

    private static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }
}
