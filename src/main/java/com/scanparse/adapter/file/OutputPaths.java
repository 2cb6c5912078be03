package com.scanparse.adapter.file;

import java.nio.file.Path;

/**
 * Derives output file locations from input files.
 */
public final class OutputPaths {

    private OutputPaths() {
    }

    /**
     * Sibling of {@code input} with its last extension replaced.
     * {@code exprs/in.txt} becomes {@code exprs/in.output}; {@code a.b.txt} becomes {@code a.b.output};
     * a name without an extension, or one whose only dot is leading, keeps its whole name.
     *
     * @param input     Input file
     * @param extension Extension without the dot
     * @return Output path next to the input
     */
    public static Path siblingWithExtension(Path input, String extension) {
        Path fileName = input.getFileName();
        if (fileName == null) {
            throw new IllegalArgumentException("Input path has no file name: " + input);
        }

        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;

        return input.resolveSibling(stem + "." + extension);
    }
}
