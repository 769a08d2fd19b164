package com.typewarden.core.analysis;

import java.util.List;

/**
 * Documentation coverage of the intentional {@code any} usages that are kept.
 *
 * @param checkedOccurrences   intentional occurrences whose file could be read
 * @param skippedOccurrences   intentional occurrences in files that could not be read
 * @param compliancePercentage documented / checked, 100 when nothing was checked
 * @param averageQualityScore  mean {@link CommentQuality#score()} of documented occurrences, 0 when none
 */
public record DocumentationQualityReport(
    int checkedOccurrences,
    int skippedOccurrences,
    int documentedOccurrences,
    int completeOccurrences,
    double compliancePercentage,
    double averageQualityScore,
    List<DistributionEntry> qualityDistribution,
    List<UndocumentedOccurrence> undocumented,
    List<String> undocumentedFiles,
    List<String> recommendations
) {}
