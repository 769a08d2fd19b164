package com.typewarden.core.analysis;

import com.typewarden.core.model.AnyTypeCategory;
import com.typewarden.core.model.CodeDomain;

public record UndocumentedOccurrence(
    String filePath,
    int lineNumber,
    String codeSnippet,
    AnyTypeCategory category,
    CodeDomain domain,
    ReviewPriority priority,
    String suggestedComment
) {}
