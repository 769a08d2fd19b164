package com.typewarden.core.engine;

import com.typewarden.core.analysis.AnalysisReport;
import com.typewarden.core.analysis.CampaignAnalyzer;
import com.typewarden.core.analysis.ReplacementOutcomeTracker;
import com.typewarden.core.analysis.SafetyEvent;
import com.typewarden.core.classifier.AnyTypeClassifier;
import com.typewarden.core.config.CampaignProperties;
import com.typewarden.core.metrics.CampaignMetrics;
import com.typewarden.core.model.BatchResult;
import com.typewarden.core.model.Classification;
import com.typewarden.core.model.ClassificationContext;
import com.typewarden.core.model.ClassifiedOccurrence;
import com.typewarden.core.model.Occurrence;
import com.typewarden.core.model.TypeReplacement;
import com.typewarden.core.monitor.AnalysisReportSource;
import com.typewarden.core.replacer.ReplacementIoException;
import com.typewarden.core.replacer.SafeTypeReplacer;
import com.typewarden.core.scanner.ContextBuilder;
import com.typewarden.core.scanner.OccurrenceScanner;
import com.typewarden.core.strategy.ReplacementStrategy;
import com.typewarden.core.strategy.ReplacementStrategySet;
import com.typewarden.core.strategy.SafetyScorer;
import com.typewarden.core.vcs.GitCheckpointService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives a campaign end to end: scan, classify, plan, then apply in adaptively
 * sized batches through the {@link SafeTypeReplacer}.
 * <p>
 * Also serves the latest classification set to the monitor as an {@link AnalysisReport}.
 */
@Service
public class CampaignEngine implements AnalysisReportSource {

    private static final Logger log = LoggerFactory.getLogger(CampaignEngine.class);

    static final double VALIDATION_FREE_SCORE = 0.9;

    private final CampaignProperties.Campaign settings;
    private final OccurrenceScanner scanner;
    private final ContextBuilder contextBuilder;
    private final AnyTypeClassifier classifier;
    private final ReplacementStrategySet strategies;
    private final SafetyScorer safetyScorer;
    private final SafeTypeReplacer replacer;
    private final CampaignAnalyzer analyzer;
    private final ReplacementOutcomeTracker outcomes;
    private final GitCheckpointService checkpoints;
    private final CampaignMetrics metrics;

    private volatile List<ClassifiedOccurrence> lastClassified = List.of();

    public CampaignEngine(CampaignProperties properties,
                          OccurrenceScanner scanner,
                          ContextBuilder contextBuilder,
                          AnyTypeClassifier classifier,
                          ReplacementStrategySet strategies,
                          SafetyScorer safetyScorer,
                          SafeTypeReplacer replacer,
                          CampaignAnalyzer analyzer,
                          ReplacementOutcomeTracker outcomes,
                          GitCheckpointService checkpoints,
                          CampaignMetrics metrics) {
        this.settings = properties.getCampaign();
        this.scanner = scanner;
        this.contextBuilder = contextBuilder;
        this.classifier = classifier;
        this.strategies = strategies;
        this.safetyScorer = safetyScorer;
        this.replacer = replacer;
        this.analyzer = analyzer;
        this.outcomes = outcomes;
        this.checkpoints = checkpoints;
        this.metrics = metrics;
    }

    public List<ClassifiedOccurrence> classify(Path root) throws IOException {
        List<Occurrence> occurrences = scanner.scan(root);
        List<ClassificationContext> contexts = contextBuilder.buildAll(occurrences);
        var classified = new ArrayList<ClassifiedOccurrence>(contexts.size());
        for (ClassificationContext context : contexts) {
            Classification classification = classifier.classify(context);
            metrics.recordClassification(classification.category().name(), classification.isIntentional());
            classified.add(new ClassifiedOccurrence(context, classification));
        }
        lastClassified = List.copyOf(classified);
        long intentional = classified.stream().filter(c -> c.classification().isIntentional()).count();
        log.info("Classified {} occurrences under {} ({} intentional)", classified.size(), root, intentional);
        return classified;
    }

    /**
     * Turns confident, unintentional classifications into replacements.
     * Each replacement carries its safety score as its confidence.
     */
    public List<TypeReplacement> plan(List<ClassifiedOccurrence> classified) {
        var planned = new ArrayList<TypeReplacement>();
        for (ClassifiedOccurrence occurrence : classified) {
            Classification classification = occurrence.classification();
            if (classification.isIntentional()
                    || classification.confidence() < settings.getMinClassificationConfidence()) {
                continue;
            }
            ClassificationContext context = occurrence.context();
            Optional<ReplacementStrategy.Proposal> proposal = strategies.propose(context);
            if (proposal.isEmpty()) {
                log.debug("No strategy applies to {}:{}", context.filePath(), context.lineNumber());
                continue;
            }
            ReplacementStrategy.Proposal p = proposal.get();
            double score = safetyScorer.score(classification.confidence(), p.category(), p.original(),
                    p.replacement(), context.codeSnippet(), context.isInTestFile());
            planned.add(new TypeReplacement(p.original(), p.replacement(), context.filePath(),
                    context.lineNumber(), score, score < VALIDATION_FREE_SCORE, p.category()));
        }
        log.info("Planned {} replacements from {} classified occurrences", planned.size(), classified.size());
        return planned;
    }

    public CampaignRunResult runCampaign(Path root) throws IOException {
        String checkpointId = null;
        if (settings.isGitCheckpoint()) {
            checkpointId = checkpoints.createCheckpoint(root, "typewarden checkpoint " + Instant.now())
                    .orElse(null);
        }

        List<ClassifiedOccurrence> classified = classify(root);
        List<TypeReplacement> planned = plan(classified);

        Map<String, List<TypeReplacement>> byFile = new LinkedHashMap<>();
        for (TypeReplacement replacement : planned) {
            byFile.computeIfAbsent(replacement.filePath(), k -> new ArrayList<>()).add(replacement);
        }
        List<String> files = new ArrayList<>(byFile.keySet());

        var policy = new AdaptiveBatchPolicy(settings.getMaxFilesPerBatch());
        var batches = new ArrayList<BatchResult>();
        int applied = 0;
        int failed = 0;
        int next = 0;
        while (next < files.size() && batches.size() < settings.getMaxBatches()) {
            int end = Math.min(files.size(), next + policy.currentSize());
            var batch = new ArrayList<TypeReplacement>();
            for (String file : files.subList(next, end)) {
                batch.addAll(byFile.get(file));
            }
            next = end;

            BatchResult result;
            try {
                result = replacer.applyReplacements(batch);
            } catch (ReplacementIoException e) {
                outcomes.recordSafetyEvent(SafetyEvent.Kind.IO_ABORT, e.getMessage());
                throw e;
            }
            batches.add(result);
            applied += result.appliedReplacements().size();
            failed += result.failedReplacements().size();

            int attempted = result.attemptedCount();
            double ratio = attempted > 0 ? (double) result.appliedReplacements().size() / attempted : 1.0;
            int nextSize = policy.record(ratio);
            log.info("Batch {} of campaign: {}/{} applied, next batch size {}",
                    batches.size(), result.appliedReplacements().size(), attempted, nextSize);
        }

        int remaining = files.size() - next;
        if (remaining > 0) {
            log.info("Batch limit of {} reached with {} files remaining", settings.getMaxBatches(), remaining);
        }
        return new CampaignRunResult(checkpointId, classified.size(), planned.size(), batches,
                applied, failed, remaining);
    }

    @Override
    public AnalysisReport currentReport() {
        return analyzer.generateReport(lastClassified);
    }
}
