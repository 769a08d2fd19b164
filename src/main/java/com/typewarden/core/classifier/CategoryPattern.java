package com.typewarden.core.classifier;

import com.typewarden.core.model.AnyTypeCategory;

import java.util.regex.Pattern;

/**
 * One syntactic signal for a category, with the base confidence it carries.
 */
public record CategoryPattern(
    AnyTypeCategory category,
    Pattern pattern,
    double baseScore
) {
    static CategoryPattern of(AnyTypeCategory category, String regex, double baseScore) {
        return new CategoryPattern(category, Pattern.compile(regex), baseScore);
    }
}
