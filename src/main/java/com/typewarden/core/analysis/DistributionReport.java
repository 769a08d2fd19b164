package com.typewarden.core.analysis;

import java.util.List;

/**
 * Domain, category and intentionality breakdown of the current occurrences.
 * Every enum value is listed, with zero counts where nothing matched.
 */
public record DistributionReport(
    int totalOccurrences,
    List<DistributionEntry> domains,
    List<DistributionEntry> categories,
    List<DistributionEntry> intentionality
) {}
