package com.stratum.dispatch.cli;

import com.stratum.core.tree.NodeClassifier;
import com.stratum.core.tree.ObjectNodeClassifier;
import com.stratum.core.tree.RawTreeReader;
import com.stratum.core.tree.SourceFile;
import com.stratum.core.tree.SqlNodeClassifier;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared arguments: pairs of syntax-tree JSON and source file, plus the syntax family.
 */
public class SourceOptions {

    @Parameters(arity = "2..*", paramLabel = "AST SOURCE",
            description = "Pairs of parsed syntax-tree JSON and the source file it was parsed from")
    List<Path> paths = new ArrayList<>();

    @Option(names = {"--family", "-f"}, defaultValue = "sql",
            description = "Syntax family: sql or object (default: ${DEFAULT-VALUE})")
    String family;

    NodeClassifier classifier() {
        return switch (family.toLowerCase()) {
            case "sql" -> new SqlNodeClassifier();
            case "object", "oo", "java" -> new ObjectNodeClassifier();
            default -> throw new IllegalArgumentException("Unknown syntax family: " + family);
        };
    }

    List<SourceFile> sourceFiles() {
        if (paths.size() % 2 != 0) {
            throw new IllegalArgumentException("Expected AST/SOURCE pairs, got " + paths.size() + " path(s)");
        }
        var reader = new RawTreeReader();
        var files = new ArrayList<SourceFile>();
        for (int i = 0; i < paths.size(); i += 2) {
            Path ast = paths.get(i);
            Path source = paths.get(i + 1);
            Path dir = source.toAbsolutePath().getParent();
            try {
                files.add(new SourceFile(dir == null ? "" : dir.toString(), source.getFileName().toString(),
                        reader.read(ast), Files.readString(source)));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read " + source, e);
            }
        }
        return files;
    }
}
