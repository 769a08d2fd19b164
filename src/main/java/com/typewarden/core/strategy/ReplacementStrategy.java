package com.typewarden.core.strategy;

import com.typewarden.core.model.AnyTypeCategory;
import com.typewarden.core.model.ClassificationContext;

import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A rewrite rule owning exactly one category.
 *
 * @param category  the category this strategy owns
 * @param priority  consultation order, lower first
 * @param pattern   locates the fragment to rewrite in the snippet
 * @param validator category-specific precondition, checked after the pattern
 * @param replacer  computes the replacement for the matched fragment
 */
public record ReplacementStrategy(
    AnyTypeCategory category,
    int priority,
    Pattern pattern,
    Predicate<ClassificationContext> validator,
    BiFunction<Matcher, ClassificationContext, String> replacer
) {

    public boolean validate(ClassificationContext context) {
        return pattern.matcher(codeOf(context)).find() && validator.test(context);
    }

    /**
     * Proposes the edit for this context, or empty when the strategy does not apply.
     */
    public Optional<Proposal> propose(ClassificationContext context) {
        if (!validate(context)) {
            return Optional.empty();
        }
        Matcher m = pattern.matcher(codeOf(context));
        if (!m.find()) {
            return Optional.empty();
        }
        String replacement = replacer.apply(m, context);
        if (replacement == null || replacement.equals(m.group())) {
            return Optional.empty();
        }
        return Optional.of(new Proposal(category, m.group(), replacement));
    }

    public String replace(ClassificationContext context) {
        return propose(context).map(Proposal::replacement).orElse(null);
    }

    private static String codeOf(ClassificationContext context) {
        String snippet = context.codeSnippet();
        int idx = snippet.indexOf("//");
        return idx >= 0 ? snippet.substring(0, idx) : snippet;
    }

    /**
     * A concrete edit: replace the literal {@code original} with {@code replacement}.
     */
    public record Proposal(AnyTypeCategory category, String original, String replacement) {}
}
