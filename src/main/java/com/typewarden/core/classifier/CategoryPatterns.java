package com.typewarden.core.classifier;

import com.typewarden.core.model.AnyTypeCategory;

import java.util.List;
import java.util.regex.Matcher;

/**
 * The pattern table behind the classifier and the longest-match rule that
 * picks a single winner from it.
 */
public final class CategoryPatterns {

    private CategoryPatterns() {}

    static final List<CategoryPattern> ALL = List.of(
            CategoryPattern.of(AnyTypeCategory.ARRAY_TYPE, ":\\s*any\\[\\]", 0.95),
            CategoryPattern.of(AnyTypeCategory.ARRAY_TYPE, ":\\s*Array<\\s*any\\s*>", 0.95),

            CategoryPattern.of(AnyTypeCategory.RECORD_TYPE, "Record<\\s*(?:string|number)\\s*,\\s*any\\s*>", 0.85),
            CategoryPattern.of(AnyTypeCategory.RECORD_TYPE,
                    "\\[\\s*\\w+\\s*:\\s*(?:string|number)\\s*\\]\\s*:\\s*any\\b", 0.8),

            CategoryPattern.of(AnyTypeCategory.FUNCTION_PARAM,
                    "[(,]\\s*[A-Za-z_$][\\w$]*\\??\\s*:\\s*any\\b(?!\\[)", 0.6),

            CategoryPattern.of(AnyTypeCategory.RETURN_TYPE, "\\)\\s*:\\s*any\\b(?!\\[)\\s*(?:\\{|=>|;)", 0.65),

            CategoryPattern.of(AnyTypeCategory.TYPE_ASSERTION, "\\bas\\s+any\\b(?!\\[)", 0.5),
            CategoryPattern.of(AnyTypeCategory.TYPE_ASSERTION, "<any>(?=\\s*[\\w$(\\[])", 0.5),

            CategoryPattern.of(AnyTypeCategory.TEST_MOCK, "(?i)\\bmock\\w*\\??\\s*:\\s*any\\b", 0.85),
            CategoryPattern.of(AnyTypeCategory.TEST_MOCK, "\\b(?:jest|vi)\\.fn\\([^)]*\\)\\s+as\\s+any\\b", 0.85),

            CategoryPattern.of(AnyTypeCategory.EXTERNAL_API,
                    "\\b(?:response|res|data|payload|body|json|apiResponse)\\??\\s*:\\s*any\\b(?!\\[)", 0.8),
            CategoryPattern.of(AnyTypeCategory.EXTERNAL_API, "\\.json\\(\\)\\)?\\s*as\\s+any\\b", 0.8),

            CategoryPattern.of(AnyTypeCategory.DYNAMIC_CONFIG,
                    "(?i)\\b\\w*(?:config|options|settings|params|props|opts)\\??\\s*:\\s*any\\b(?!\\[)", 0.75),

            CategoryPattern.of(AnyTypeCategory.LEGACY_COMPATIBILITY,
                    "(?i)\\b\\w*(?:legacy|deprecated|compat)\\w*\\??\\s*:\\s*any\\b", 0.7),

            CategoryPattern.of(AnyTypeCategory.ERROR_HANDLING, "catch\\s*\\(\\s*\\w+\\s*:\\s*any\\s*\\)", 0.9),
            CategoryPattern.of(AnyTypeCategory.ERROR_HANDLING,
                    "\\b(?:error|err|e|ex|exception)\\??\\s*:\\s*any\\b(?!\\[)", 0.9)
    );

    /**
     * A pattern hit on a specific snippet.
     *
     * @param pattern     the pattern that matched
     * @param matchLength length of the matched text, the specificity measure
     */
    public record Match(CategoryPattern pattern, int matchLength) {
        public AnyTypeCategory category() {
            return pattern.category();
        }
    }

    /**
     * Returns the winning match: longest matched text first, then category
     * priority, then the higher base score. {@code null} when nothing matches.
     */
    public static Match bestMatch(String snippet) {
        Match best = null;
        for (CategoryPattern candidate : ALL) {
            Matcher m = candidate.pattern().matcher(snippet);
            int longest = -1;
            while (m.find()) {
                longest = Math.max(longest, m.end() - m.start());
            }
            if (longest < 0) continue;
            var match = new Match(candidate, longest);
            if (best == null || beats(match, best)) {
                best = match;
            }
        }
        return best;
    }

    private static boolean beats(Match challenger, Match incumbent) {
        if (challenger.matchLength() != incumbent.matchLength()) {
            return challenger.matchLength() > incumbent.matchLength();
        }
        int byPriority = Integer.compare(challenger.category().priority(), incumbent.category().priority());
        if (byPriority != 0) {
            return byPriority < 0;
        }
        return challenger.pattern().baseScore() > incumbent.pattern().baseScore();
    }
}
