package com.typewarden.core.analysis;

import java.time.Instant;
import java.util.List;

public record AnalysisReport(
    Instant generatedAt,
    DistributionReport distribution,
    AccuracyReport accuracy,
    SuccessRateReport successRates,
    List<ManualReviewItem> manualReview,
    DocumentationQualityReport documentation,
    List<String> recommendations
) {}
