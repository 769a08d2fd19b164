package com.typewarden.core.model;

/**
 * A single line in the code base that carries an {@code any} marker.
 *
 * @param filePath    path of the file, as discovered by the scanner
 * @param lineNumber  1-based line number
 * @param codeSnippet the trimmed source line
 */
public record Occurrence(
    String filePath,
    int lineNumber,
    String codeSnippet
) {}
