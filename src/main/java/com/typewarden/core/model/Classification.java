package com.typewarden.core.model;

/**
 * Classifier verdict for one occurrence. Re-classifying produces a new value.
 *
 * @param category             the winning category
 * @param isIntentional        whether the {@code any} should be preserved
 * @param confidence           heuristic confidence in [0, 1]
 * @param suggestedReplacement narrower type, or {@code null} when none is proposable
 */
public record Classification(
    AnyTypeCategory category,
    boolean isIntentional,
    double confidence,
    String suggestedReplacement
) {
    public Classification {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1]: " + confidence);
        }
    }

    public boolean hasSuggestion() {
        return suggestedReplacement != null && !suggestedReplacement.isBlank();
    }
}
