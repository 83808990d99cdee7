package com.stratum.core.tree;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the parser's syntax-tree JSON ({@code startLine}, {@code endLine}, {@code type},
 * optional {@code name}/{@code schema}, {@code children}) into {@link RawNode}s.
 */
public class RawTreeReader {

    private final ObjectMapper mapper;

    public RawTreeReader() {
        this(new ObjectMapper());
    }

    public RawTreeReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public RawNode read(Path path) {
        try {
            return toRawNode(mapper.readTree(Files.readString(path)));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read syntax tree " + path, e);
        }
    }

    public RawNode read(String json) {
        try {
            return toRawNode(mapper.readTree(json));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse syntax tree JSON", e);
        }
    }

    private RawNode toRawNode(JsonNode json) {
        if (json == null || !json.hasNonNull("type")) {
            throw new CollectionException("Syntax tree node without a type", "UNKNOWN",
                    intField(json, "startLine"), intField(json, "endLine"));
        }
        List<RawNode> children = new ArrayList<>();
        JsonNode childArray = json.get("children");
        if (childArray != null && childArray.isArray()) {
            for (JsonNode child : childArray) {
                children.add(toRawNode(child));
            }
        }
        return new RawNode(
                intField(json, "startLine"),
                intField(json, "endLine"),
                json.get("type").asText(),
                textField(json, "name"),
                textField(json, "schema"),
                children);
    }

    private static int intField(JsonNode json, String field) {
        return json != null && json.hasNonNull(field) ? json.get(field).asInt() : 0;
    }

    private static String textField(JsonNode json, String field) {
        return json.hasNonNull(field) ? json.get(field).asText() : null;
    }
}
