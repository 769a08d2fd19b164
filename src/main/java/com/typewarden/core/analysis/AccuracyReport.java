package com.typewarden.core.analysis;

import java.util.List;

/**
 * Self-consistency check of a bounded classification sample.
 *
 * @param sampleSize        number of classifications examined
 * @param accurateCount     how many passed their category heuristic
 * @param overallAccuracy   percentage, 100 when the sample is empty
 * @param averageConfidence mean confidence of the sample, 0 when empty
 * @param byCategory        per-category breakdown, only categories present in the sample
 * @param confidenceBuckets confidence histogram over the sample
 */
public record AccuracyReport(
    int sampleSize,
    int accurateCount,
    double overallAccuracy,
    double averageConfidence,
    List<CategoryAccuracy> byCategory,
    List<DistributionEntry> confidenceBuckets
) {}
