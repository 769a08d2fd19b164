package com.typewarden.core.strategy;

import com.typewarden.core.model.AnyTypeCategory;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Turns a classifier confidence into the risk-adjusted score that gates every
 * file mutation.
 */
@Component
public class SafetyScorer {

    static final double ARRAY_BOOST = 0.15;
    static final double RECORD_BOOST = 0.1;
    static final double UNKNOWN_BOOST = 0.1;
    static final double TEST_FILE_BOOST = 0.05;
    static final double DECLARATION_BOOST = 0.05;
    static final double FUNCTION_PENALTY = 0.1;
    static final double ERROR_CONTEXT_PENALTY = 0.2;

    private static final Pattern FUNCTION_LINE = Pattern.compile("\\bfunction\\b|=>");
    private static final Pattern ERROR_LINE = Pattern.compile("(?i)\\bcatch\\b|\\berror\\b");
    private static final Pattern DECLARATION_LINE = Pattern.compile("\\b(?:interface|type)\\s+\\w+");

    /**
     * @param confidence  classifier confidence in [0, 1]
     * @param category    category of the edit, may be {@code null}
     * @param original    fragment being replaced
     * @param replacement replacement fragment
     * @param line        the full target line
     * @param testFile    whether the target is a test file
     * @return the safety score, clamped to [0, 1]
     */
    public double score(double confidence, AnyTypeCategory category, String original,
                        String replacement, String line, boolean testFile) {
        double score = confidence;
        if (category == AnyTypeCategory.ARRAY_TYPE || original.contains("any[]") || original.contains("Array<")) {
            score += ARRAY_BOOST;
        }
        if (category == AnyTypeCategory.RECORD_TYPE || original.contains("Record<")) {
            score += RECORD_BOOST;
        }
        if (replacement.contains("unknown")) {
            score += UNKNOWN_BOOST;
        }
        if (testFile) {
            score += TEST_FILE_BOOST;
        }
        if (DECLARATION_LINE.matcher(line).find()) {
            score += DECLARATION_BOOST;
        }
        if (FUNCTION_LINE.matcher(line).find()) {
            score -= FUNCTION_PENALTY;
        }
        if (category == AnyTypeCategory.ERROR_HANDLING || ERROR_LINE.matcher(line).find()) {
            score -= ERROR_CONTEXT_PENALTY;
        }
        return Math.round(Math.max(0.0, Math.min(1.0, score)) * 1000.0) / 1000.0;
    }
}
