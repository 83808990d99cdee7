package com.stratum.core.tree;

/**
 * A parsed source file ready for collection.
 *
 * @param directory  directory the file was read from, used in container keys
 * @param fileName   file name, used in container keys
 * @param root       root of the parsed syntax tree
 * @param sourceText full source text the tree's spans refer to
 */
public record SourceFile(String directory, String fileName, RawNode root, String sourceText) {

    public String fileId() {
        return directory == null || directory.isBlank() ? fileName : directory + "/" + fileName;
    }
}
