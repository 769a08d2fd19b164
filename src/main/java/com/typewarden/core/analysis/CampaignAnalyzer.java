package com.typewarden.core.analysis;

import com.typewarden.core.config.CampaignProperties;
import com.typewarden.core.model.AnyTypeCategory;
import com.typewarden.core.model.Classification;
import com.typewarden.core.model.ClassificationContext;
import com.typewarden.core.model.ClassifiedOccurrence;
import com.typewarden.core.model.CodeDomain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;

/**
 * Aggregates classifications and replacement outcomes into reports.
 * Read-only with respect to the campaign: nothing here feeds back into replacement.
 */
@Service
public class CampaignAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(CampaignAnalyzer.class);

    static final int ACCURACY_SAMPLE_CAP = 100;
    static final int FALLBACK_DAYS = 30;
    static final Duration TREND_WINDOW = Duration.ofDays(7);

    static final double REVIEW_CONFIDENCE_THRESHOLD = 0.7;
    static final int REVIEW_HINT_THRESHOLD = 2;
    static final double HIGH_PRIORITY_CONFIDENCE = 0.6;
    static final double MEDIUM_PRIORITY_CONFIDENCE = 0.8;

    private final ReplacementOutcomeTracker outcomes;
    private final DocumentationQualityAnalyzer documentationAnalyzer;
    private final Clock clock;
    private final double targetSuccessRate;

    public CampaignAnalyzer(CampaignProperties properties, ReplacementOutcomeTracker outcomes,
                            DocumentationQualityAnalyzer documentationAnalyzer, Clock clock) {
        this.outcomes = outcomes;
        this.documentationAnalyzer = documentationAnalyzer;
        this.clock = clock;
        this.targetSuccessRate = properties.getCampaign().getTargetSuccessRate();
    }

    public AnalysisReport generateReport(List<ClassifiedOccurrence> occurrences) {
        DistributionReport distribution = analyzeDistribution(occurrences);
        AccuracyReport accuracy = analyzeAccuracy(occurrences);
        SuccessRateReport successRates = analyzeSuccessRates();
        List<ManualReviewItem> review = generateManualReviewRecommendations(occurrences);
        DocumentationQualityReport documentation = documentationAnalyzer.generateQualityReport(occurrences);
        List<String> recommendations = recommendations(distribution, accuracy, successRates, review, documentation);
        log.info("Analysis report: {} occurrences, accuracy {}%, success rate {}%, {} review items",
                distribution.totalOccurrences(), format(accuracy.overallAccuracy()),
                format(successRates.currentSuccessRate()), review.size());
        return new AnalysisReport(clock.instant(), distribution, accuracy, successRates, review, documentation,
                recommendations);
    }

    public DistributionReport analyzeDistribution(List<ClassifiedOccurrence> occurrences) {
        int total = occurrences.size();
        var domainCounts = new EnumMap<CodeDomain, Integer>(CodeDomain.class);
        var categoryCounts = new EnumMap<AnyTypeCategory, Integer>(AnyTypeCategory.class);
        int intentional = 0;
        for (ClassifiedOccurrence occurrence : occurrences) {
            ClassificationContext context = occurrence.context();
            CodeDomain domain = context.domainContext() != null ? context.domainContext().domain() : CodeDomain.UTILITY;
            domainCounts.merge(domain, 1, Integer::sum);
            categoryCounts.merge(occurrence.classification().category(), 1, Integer::sum);
            if (occurrence.classification().isIntentional()) intentional++;
        }

        var domains = new ArrayList<DistributionEntry>();
        for (CodeDomain domain : CodeDomain.values()) {
            domains.add(DistributionEntry.of(domain.name(), domainCounts.getOrDefault(domain, 0), total));
        }
        var categories = new ArrayList<DistributionEntry>();
        for (AnyTypeCategory category : AnyTypeCategory.values()) {
            categories.add(DistributionEntry.of(category.name(), categoryCounts.getOrDefault(category, 0), total));
        }
        List<DistributionEntry> split = List.of(
                DistributionEntry.of("intentional", intentional, total),
                DistributionEntry.of("unintentional", total - intentional, total));
        return new DistributionReport(total, domains, categories, split);
    }

    /**
     * Checks the first {@value #ACCURACY_SAMPLE_CAP} classifications against
     * category-specific syntactic expectations. A self-consistency measure, not ground truth.
     */
    public AccuracyReport analyzeAccuracy(List<ClassifiedOccurrence> occurrences) {
        List<ClassifiedOccurrence> sample = occurrences.subList(0, Math.min(ACCURACY_SAMPLE_CAP, occurrences.size()));
        var perCategory = new EnumMap<AnyTypeCategory, int[]>(AnyTypeCategory.class);
        int accurate = 0;
        double confidenceSum = 0;
        int[] buckets = new int[5];

        for (ClassifiedOccurrence occurrence : sample) {
            Classification classification = occurrence.classification();
            boolean ok = isConsistent(classification.category(), occurrence.context());
            int[] counts = perCategory.computeIfAbsent(classification.category(), k -> new int[2]);
            counts[0]++;
            if (ok) {
                counts[1]++;
                accurate++;
            }
            confidenceSum += classification.confidence();
            buckets[bucketOf(classification.confidence())]++;
        }

        var byCategory = new ArrayList<CategoryAccuracy>();
        perCategory.forEach((category, counts) ->
                byCategory.add(new CategoryAccuracy(category, counts[0], counts[1], counts[1] * 100.0 / counts[0])));

        int n = sample.size();
        List<DistributionEntry> confidenceBuckets = List.of(
                DistributionEntry.of("90-100", buckets[0], n),
                DistributionEntry.of("80-90", buckets[1], n),
                DistributionEntry.of("70-80", buckets[2], n),
                DistributionEntry.of("60-70", buckets[3], n),
                DistributionEntry.of("0-60", buckets[4], n));

        return new AccuracyReport(n, accurate, n > 0 ? accurate * 100.0 / n : 100.0,
                n > 0 ? confidenceSum / n : 0.0, byCategory, confidenceBuckets);
    }

    public SuccessRateReport analyzeSuccessRates() {
        Instant now = clock.instant();
        double current = outcomes.currentSuccessRate();
        List<SuccessRatePoint> trend = outcomes.trend();

        List<SuccessRatePoint> window = trend.stream()
                .filter(p -> !p.timestamp().isBefore(now.minus(TREND_WINDOW)))
                .toList();
        double ratePerDay = 0.0;
        if (window.size() >= 2) {
            SuccessRatePoint first = window.get(0);
            SuccessRatePoint last = window.get(window.size() - 1);
            double days = Math.max(1.0, Duration.between(first.timestamp(), last.timestamp()).toHours() / 24.0);
            ratePerDay = (last.successRate() - first.successRate()) / days;
        }

        int daysToTarget = projectDays(current, targetSuccessRate, ratePerDay);
        LocalDate projected = LocalDate.ofInstant(now, ZoneOffset.UTC).plusDays(daysToTarget);
        return new SuccessRateReport(current, outcomes.totalAttempted(), outcomes.totalSucceeded(),
                targetSuccessRate, ratePerDay, daysToTarget, projected, outcomes.categorySuccessRates(), trend);
    }

    /**
     * {@code ceil((target - current) / rate)}, zero once the target is met, and
     * {@value #FALLBACK_DAYS} when the rate is not positive.
     */
    static int projectDays(double current, double target, double ratePerPeriod) {
        if (current >= target) return 0;
        if (ratePerPeriod <= 0) return FALLBACK_DAYS;
        return (int) Math.ceil((target - current) / ratePerPeriod);
    }

    public List<ManualReviewItem> generateManualReviewRecommendations(List<ClassifiedOccurrence> occurrences) {
        var items = new ArrayList<ManualReviewItem>();
        for (ClassifiedOccurrence occurrence : occurrences) {
            Classification c = occurrence.classification();
            ClassificationContext context = occurrence.context();
            int hints = context.hintCount();
            boolean conflicting = c.isIntentional() && c.hasSuggestion();

            var reasons = new ArrayList<String>();
            if (c.confidence() < REVIEW_CONFIDENCE_THRESHOLD) {
                reasons.add("Low classification confidence (" + format(c.confidence()) + ")");
            }
            if (hints > REVIEW_HINT_THRESHOLD) {
                reasons.add("Ambiguous domain context (" + hints + " intentionality hints)");
            }
            if (conflicting) {
                reasons.add("Conflicting signals: marked intentional but a replacement is suggested");
            }
            if (c.category().isHighRisk()) {
                reasons.add("High-risk category " + c.category());
            }
            if (reasons.isEmpty()) continue;

            ReviewPriority priority = priorityOf(c.confidence(), hints, conflicting);
            int minutes = 5 + 5 * reasons.size() + (priority == ReviewPriority.HIGH ? 10 : 0);
            items.add(new ManualReviewItem(context.filePath(), context.lineNumber(), context.codeSnippet(),
                    c.category(), c.confidence(), reasons, priority, minutes));
        }
        items.sort(Comparator.comparing(ManualReviewItem::priority)
                .thenComparingDouble(ManualReviewItem::confidence)
                .thenComparing(ManualReviewItem::filePath)
                .thenComparingInt(ManualReviewItem::lineNumber));
        return items;
    }

    static ReviewPriority priorityOf(double confidence, int hints, boolean conflicting) {
        if (confidence < HIGH_PRIORITY_CONFIDENCE || conflicting) return ReviewPriority.HIGH;
        if (confidence < MEDIUM_PRIORITY_CONFIDENCE || hints > 1) return ReviewPriority.MEDIUM;
        return ReviewPriority.LOW;
    }

    static boolean isConsistent(AnyTypeCategory category, ClassificationContext context) {
        String snippet = context.codeSnippet();
        String text = (snippet + "\n" + String.join("\n", context.surroundingLines())).toLowerCase(Locale.ROOT);
        return switch (category) {
            case ERROR_HANDLING -> containsAny(text, "catch", "error", "err", "exception");
            case TEST_MOCK -> context.isInTestFile() || text.contains("mock");
            case ARRAY_TYPE -> snippet.contains("any[]") || snippet.contains("Array<");
            case RECORD_TYPE -> snippet.contains("Record<") || snippet.contains("]:");
            case FUNCTION_PARAM -> snippet.contains("(");
            case RETURN_TYPE -> snippet.contains("):") || snippet.contains(") :");
            case TYPE_ASSERTION -> snippet.contains("as any") || snippet.contains("<any>");
            case EXTERNAL_API -> containsAny(text, "api", "response", "fetch", "data", "payload", "request");
            case DYNAMIC_CONFIG -> containsAny(text, "config", "options", "settings", "params", "props");
            case LEGACY_COMPATIBILITY -> containsAny(text, "legacy", "deprecated", "compat", "old");
        };
    }

    private List<String> recommendations(DistributionReport distribution, AccuracyReport accuracy,
                                         SuccessRateReport successRates, List<ManualReviewItem> review,
                                         DocumentationQualityReport documentation) {
        var out = new ArrayList<String>();
        DistributionEntry unintentional = distribution.intentionality().get(1);
        if (unintentional.count() > 0) {
            out.add(unintentional.count() + " unintentional occurrences are candidates for automated replacement");
        }
        if (accuracy.sampleSize() > 0 && accuracy.overallAccuracy() < 80.0) {
            out.add("Classification accuracy is " + format(accuracy.overallAccuracy())
                    + "%; review the category patterns before the next batch");
        }
        long high = review.stream().filter(i -> i.priority() == ReviewPriority.HIGH).count();
        if (high > 0) {
            out.add(high + " high-priority occurrences need manual review");
        }
        if (successRates.totalAttempted() > 0 && successRates.currentSuccessRate() < successRates.targetSuccessRate()) {
            out.add("Success rate " + format(successRates.currentSuccessRate()) + "% is below the "
                    + format(successRates.targetSuccessRate()) + "% target; projected to reach it by "
                    + successRates.projectedCompletion());
        }
        if (documentation.checkedOccurrences() > 0
                && documentation.compliancePercentage() < DocumentationQualityAnalyzer.TARGET_COVERAGE) {
            out.add(documentation.undocumented().size() + " intentional occurrences are undocumented ("
                    + format(documentation.compliancePercentage()) + "% coverage)");
        }
        return out;
    }

    private static int bucketOf(double confidence) {
        if (confidence >= 0.9) return 0;
        if (confidence >= 0.8) return 1;
        if (confidence >= 0.7) return 2;
        if (confidence >= 0.6) return 3;
        return 4;
    }

    private static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) return true;
        }
        return false;
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
