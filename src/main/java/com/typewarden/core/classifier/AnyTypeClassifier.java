package com.typewarden.core.classifier;

import com.typewarden.core.model.AnyTypeCategory;
import com.typewarden.core.model.Classification;
import com.typewarden.core.model.ClassificationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assigns each occurrence a category, an intentionality verdict and a confidence.
 * <p>
 * Deterministic: the same context always yields an equal {@link Classification}.
 */
@Service
public class AnyTypeClassifier {

    private static final Logger log = LoggerFactory.getLogger(AnyTypeClassifier.class);

    static final double UNMATCHED_CONFIDENCE = 0.5;
    static final double DOCUMENTED_INTENT_CONFIDENCE = 0.95;
    static final double COMMENT_INTENTIONAL_BOOST = 0.05;
    static final double COMMENT_UNINTENTIONAL_PENALTY = 0.1;
    static final double TEST_MOCK_BOOST = 0.1;
    static final double PER_EXTRA_HINT_PENALTY = 0.05;

    private static final Pattern DOCUMENTED_INTENT = Pattern.compile(
            "(?i)intentional(?:ly)?\\s+any|eslint-disable(?:-next-line|-line)?[^\\n]*no-explicit-any");
    private static final Pattern FOLLOW_UP_MARKER = Pattern.compile("(?i)\\b(?:todo|fixme)\\b");
    private static final Pattern CATCH_CLAUSE = Pattern.compile("\\bcatch\\s*\\(");
    private static final Pattern TYPE_GUARD = Pattern.compile(
            "\\btypeof\\s|\\sinstanceof\\s|\\.parse\\(|\\bis[A-Z]\\w*\\(");
    private static final Pattern STATIC_CONFIG_SHAPE = Pattern.compile(
            "\\b(?:interface|type)\\s+(\\w*(?:Config|Options|Settings|Params|Props))\\b");

    public Classification classify(ClassificationContext context) {
        String snippet = codeOnly(context.codeSnippet());
        CategoryPatterns.Match match = CategoryPatterns.bestMatch(snippet);
        if (match == null) {
            log.debug("No category pattern matched {}:{}, preserving", context.filePath(), context.lineNumber());
            return new Classification(AnyTypeCategory.ERROR_HANDLING, true, UNMATCHED_CONFIDENCE, null);
        }

        AnyTypeCategory category = match.category();
        String suggestion = suggestReplacement(category, context);

        if (hasDocumentedIntent(context)) {
            return new Classification(category, true, DOCUMENTED_INTENT_CONFIDENCE, suggestion);
        }

        boolean intentional = category.isPreservationWorthy() && suggestion == null;
        double confidence = match.pattern().baseScore();
        if (context.hasExistingComment()) {
            confidence += intentional ? COMMENT_INTENTIONAL_BOOST : -COMMENT_UNINTENTIONAL_PENALTY;
        }
        if (context.isInTestFile() && category == AnyTypeCategory.TEST_MOCK) {
            confidence += TEST_MOCK_BOOST;
        }
        confidence -= PER_EXTRA_HINT_PENALTY * Math.max(0, context.hintCount() - 1);

        return new Classification(category, intentional, round(clamp(confidence)), suggestion);
    }

    public List<Classification> classifyBatch(List<ClassificationContext> contexts) {
        var results = new ArrayList<Classification>(contexts.size());
        for (ClassificationContext context : contexts) {
            results.add(classify(context));
        }
        return results;
    }

    /**
     * Returns the narrower type this category can take in this context, or
     * {@code null} when the {@code any} should stay.
     */
    String suggestReplacement(AnyTypeCategory category, ClassificationContext context) {
        return switch (category) {
            case ARRAY_TYPE -> "unknown[]";
            case RECORD_TYPE -> "Record<string, unknown>";
            case FUNCTION_PARAM, RETURN_TYPE, TYPE_ASSERTION -> "unknown";
            case TEST_MOCK -> context.isInTestFile() ? null : "unknown";
            case EXTERNAL_API -> surroundingMatches(context, TYPE_GUARD) ? "unknown" : null;
            case DYNAMIC_CONFIG -> staticConfigShape(context);
            case LEGACY_COMPATIBILITY -> null;
            case ERROR_HANDLING -> CATCH_CLAUSE.matcher(context.codeSnippet()).find() ? null : "unknown";
        };
    }

    static boolean hasDocumentedIntent(ClassificationContext context) {
        if (!context.hasExistingComment() || context.existingComment() == null) {
            return false;
        }
        String comment = context.existingComment();
        return DOCUMENTED_INTENT.matcher(comment).find() && !FOLLOW_UP_MARKER.matcher(comment).find();
    }

    private static String staticConfigShape(ClassificationContext context) {
        for (String line : context.surroundingLines()) {
            Matcher m = STATIC_CONFIG_SHAPE.matcher(line);
            if (m.find()) {
                return m.group(1);
            }
        }
        return null;
    }

    private static boolean surroundingMatches(ClassificationContext context, Pattern pattern) {
        for (String line : context.surroundingLines()) {
            if (pattern.matcher(line).find()) return true;
        }
        return false;
    }

    static String codeOnly(String snippet) {
        int idx = snippet.indexOf("//");
        return idx >= 0 ? snippet.substring(0, idx) : snippet;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
