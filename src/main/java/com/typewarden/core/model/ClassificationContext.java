package com.typewarden.core.model;

import java.util.List;

/**
 * Everything the classifier is allowed to look at for a single occurrence.
 * Built once by the scanner and never mutated afterwards.
 *
 * @param filePath           file containing the occurrence
 * @param lineNumber         1-based line number
 * @param codeSnippet        the trimmed source line
 * @param surroundingLines   the lines within the configured radius, target line included
 * @param hasExistingComment whether a human comment sits on or directly above the line
 * @param existingComment    that comment's text, or {@code null}
 * @param isInTestFile       whether the file is a test file
 * @param domainContext      domain verdict, {@code null} until the analyzer has run
 */
public record ClassificationContext(
    String filePath,
    int lineNumber,
    String codeSnippet,
    List<String> surroundingLines,
    boolean hasExistingComment,
    String existingComment,
    boolean isInTestFile,
    DomainContext domainContext
) {
    public ClassificationContext {
        surroundingLines = surroundingLines != null ? List.copyOf(surroundingLines) : List.of();
    }

    public ClassificationContext withDomainContext(DomainContext domain) {
        return new ClassificationContext(filePath, lineNumber, codeSnippet, surroundingLines,
                hasExistingComment, existingComment, isInTestFile, domain);
    }

    public int hintCount() {
        return domainContext != null ? domainContext.intentionalityHints().size() : 0;
    }
}
