package com.typewarden.core.analysis;

import java.util.List;

/**
 * How well one intentional occurrence is documented.
 *
 * @param comment                    the explanatory comment text, or {@code null} when there is none
 * @param lintDisableExplained       the eslint directive carries a {@code -- reason} description
 * @param complete                   a non-poor comment and an explained directive are both present
 */
public record DocumentationValidation(
    boolean hasComment,
    String comment,
    CommentQuality commentQuality,
    boolean hasLintDisable,
    boolean lintDisableExplained,
    boolean complete,
    List<String> suggestions
) {
    public DocumentationValidation {
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
    }
}
