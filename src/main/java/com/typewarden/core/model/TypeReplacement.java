package com.typewarden.core.model;

/**
 * One planned line-level edit.
 *
 * @param original           literal text that must occur on the target line
 * @param replacement        text substituted for the first occurrence of {@code original}
 * @param filePath           target file
 * @param lineNumber         1-based target line
 * @param confidence         the safety score of this edit
 * @param validationRequired whether the edit needs a compiler check before it is trusted
 * @param category           the category the edit came from, or {@code null}
 */
public record TypeReplacement(
    String original,
    String replacement,
    String filePath,
    int lineNumber,
    double confidence,
    boolean validationRequired,
    AnyTypeCategory category
) {
    public TypeReplacement(String original, String replacement, String filePath,
                           int lineNumber, double confidence, boolean validationRequired) {
        this(original, replacement, filePath, lineNumber, confidence, validationRequired, null);
    }
}
