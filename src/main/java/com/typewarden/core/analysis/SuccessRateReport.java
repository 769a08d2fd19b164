package com.typewarden.core.analysis;

import com.typewarden.core.model.AnyTypeCategory;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Replacement success so far and a linear projection to the target.
 *
 * @param currentSuccessRate   succeeded / attempted, as a percentage
 * @param totalAttempted       replacements submitted to the safe replacer
 * @param totalSucceeded       replacements committed
 * @param targetSuccessRate    configured goal, as a percentage
 * @param ratePerDay           average change of the success rate per day over the trend window
 * @param daysToTarget         projected days until the target is reached
 * @param projectedCompletion  today plus {@code daysToTarget}
 * @param categorySuccessRates per-category success percentages
 * @param trend                historical success-rate samples, oldest first
 */
public record SuccessRateReport(
    double currentSuccessRate,
    int totalAttempted,
    int totalSucceeded,
    double targetSuccessRate,
    double ratePerDay,
    int daysToTarget,
    LocalDate projectedCompletion,
    Map<AnyTypeCategory, Double> categorySuccessRates,
    List<SuccessRatePoint> trend
) {}
