package com.typewarden.core.analysis;

import com.typewarden.core.model.AnyTypeCategory;

import java.util.List;

/**
 * An occurrence a human should look at before any automated rewrite.
 */
public record ManualReviewItem(
    String filePath,
    int lineNumber,
    String codeSnippet,
    AnyTypeCategory category,
    double confidence,
    List<String> reasons,
    ReviewPriority priority,
    int estimatedMinutes
) {}
