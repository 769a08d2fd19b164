package com.typewarden.core.replacer;

import com.typewarden.core.config.CampaignProperties;
import com.typewarden.core.engine.CampaignLock;
import com.typewarden.core.events.CampaignEvent;
import com.typewarden.core.events.EventBus;
import com.typewarden.core.logging.MdcContext;
import com.typewarden.core.metrics.CampaignMetrics;
import com.typewarden.core.model.BatchResult;
import com.typewarden.core.model.FailedReplacement;
import com.typewarden.core.model.ReplacementState;
import com.typewarden.core.model.TypeReplacement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Applies planned type replacements as all-or-nothing transactions.
 * <p>
 * Per batch: items below the safety threshold are rejected before any I/O;
 * the rest are grouped by file, each file is backed up once and edited in a
 * single pass, and one type check decides between keeping every edit and
 * restoring every touched file from its backup. Runs under {@link CampaignLock}
 * so monitor probes never see a half-applied batch.
 */
@Service
public class SafeTypeReplacer {

    private static final Logger log = LoggerFactory.getLogger(SafeTypeReplacer.class);

    private static final int MAX_FALLBACK_ERROR_LENGTH = 200;

    private final BackupStore backupStore;
    private final TypeChecker typeChecker;
    private final CompilerOutputParser parser;
    private final CampaignLock lock;
    private final EventBus eventBus;
    private final CampaignMetrics metrics;
    private final Clock clock;
    private final double safetyThreshold;

    public SafeTypeReplacer(CampaignProperties properties,
                            BackupStore backupStore,
                            TypeChecker typeChecker,
                            CompilerOutputParser parser,
                            CampaignLock lock,
                            EventBus eventBus,
                            CampaignMetrics metrics,
                            Clock clock) {
        double threshold = properties.getReplacer().getSafetyThreshold();
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalStateException("typewarden.replacer.safety-threshold must be in [0, 1]: " + threshold);
        }
        this.backupStore = backupStore;
        this.typeChecker = typeChecker;
        this.parser = parser;
        this.lock = lock;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.safetyThreshold = threshold;
    }

    public BatchResult applyReplacement(TypeReplacement replacement) {
        return applyReplacements(List.of(replacement));
    }

    /**
     * Applies a batch of replacements as one transaction.
     *
     * @return the terminal outcome; never partially committed
     * @throws ReplacementIoException if a read, backup, write or restore fails
     * @throws RuntimeException from the type checker, after every touched file is restored
     */
    public BatchResult applyReplacements(List<TypeReplacement> replacements) {
        String batchId = "batch-" + UUID.randomUUID().toString().substring(0, 8);
        return lock.runExclusive(batchId, () -> runTransaction(batchId, replacements));
    }

    /**
     * Deletes backups older than the given number of days.
     */
    public int cleanupOldBackups(int daysToKeep) {
        int deleted = backupStore.deleteOlderThan(Duration.ofDays(daysToKeep));
        metrics.recordBackupCleanup(deleted);
        return deleted;
    }

    public double getSafetyThreshold() {
        return safetyThreshold;
    }

    private BatchResult runTransaction(String batchId, List<TypeReplacement> replacements) {
        MdcContext.setBatch(batchId);
        long start = System.currentTimeMillis();
        var tx = new ReplacementTransaction(batchId);
        try {
            log.info("Starting batch {} with {} replacements", batchId, replacements.size());

            List<TypeReplacement> admitted = applySafetyGate(tx, replacements);
            for (Map.Entry<String, List<TypeReplacement>> entry : groupByFile(admitted).entrySet()) {
                editFile(tx, entry.getKey(), entry.getValue());
            }

            BatchResult result;
            String outcome;
            if (!tx.hasTouchedFiles()) {
                result = tx.untouched();
                outcome = "no_op";
            } else {
                result = checkAndResolve(tx);
                outcome = result.rollbackPerformed() ? "rolled_back" : "committed";
            }

            for (FailedReplacement failure : result.failedReplacements()) {
                metrics.recordRejection(failure.reason().name().toLowerCase(Locale.ROOT));
            }
            metrics.recordBatch(outcome, result.appliedReplacements().size(), System.currentTimeMillis() - start);
            log.info("Batch {} finished: {} applied, {} failed, rollback={}",
                    batchId, result.appliedReplacements().size(), result.failedReplacements().size(),
                    result.rollbackPerformed());

            eventBus.publish(new CampaignEvent(CampaignEvent.BATCH_COMPLETED, batchId,
                    Map.of("result", result), clock.instant()));
            return result;
        } catch (ReplacementIoException e) {
            log.error("Batch {} aborted by I/O failure: {}", batchId, e.getMessage());
            restoreAfterAbort(tx, e);
            throw e;
        } catch (RuntimeException e) {
            log.error("Batch {} aborted by unexpected failure, restoring {} file(s): {}",
                    batchId, tx.backups().size(), e.getMessage());
            restoreAfterAbort(tx, e);
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private List<TypeReplacement> applySafetyGate(ReplacementTransaction tx, List<TypeReplacement> replacements) {
        var admitted = new ArrayList<TypeReplacement>();
        for (TypeReplacement replacement : replacements) {
            if (replacement.confidence() < safetyThreshold) {
                tx.reject(replacement, FailedReplacement.Reason.SAFETY_GATE, String.format(Locale.ROOT,
                        "Rejected before any write: safety score %.2f is below threshold %.2f",
                        replacement.confidence(), safetyThreshold));
            } else {
                admitted.add(replacement);
            }
        }
        return admitted;
    }

    private static Map<String, List<TypeReplacement>> groupByFile(List<TypeReplacement> replacements) {
        var byFile = new LinkedHashMap<String, List<TypeReplacement>>();
        for (TypeReplacement replacement : replacements) {
            byFile.computeIfAbsent(replacement.filePath(), k -> new ArrayList<>()).add(replacement);
        }
        return byFile;
    }

    /**
     * Applies every edit for one file in memory, then backs the file up and
     * writes it once. Items failing a precondition are rejected and the file is
     * left alone when nothing applies.
     */
    private void editFile(ReplacementTransaction tx, String filePath, List<TypeReplacement> edits) {
        MdcContext.setFile(tx.batchId(), filePath);
        try {
            Path path = Path.of(filePath);
            String content;
            try {
                content = Files.readString(path, StandardCharsets.UTF_8);
            } catch (CharacterCodingException e) {
                for (TypeReplacement edit : edits) {
                    tx.reject(edit, FailedReplacement.Reason.PRECONDITION,
                            "File " + filePath + " is not valid UTF-8 and was left untouched");
                }
                log.warn("Skipping {}: not valid UTF-8", filePath);
                return;
            } catch (IOException e) {
                throw new ReplacementIoException("Failed to read " + filePath, e);
            }

            String[] lines = content.split("\n", -1);
            int lineCount = content.isEmpty() ? 0 : content.endsWith("\n") ? lines.length - 1 : lines.length;

            var ordered = new ArrayList<>(edits);
            ordered.sort(Comparator.comparingInt(TypeReplacement::lineNumber).reversed());

            var applied = new ArrayList<TypeReplacement>();
            for (TypeReplacement edit : ordered) {
                int index = edit.lineNumber() - 1;
                if (index < 0 || index >= lineCount) {
                    tx.reject(edit, FailedReplacement.Reason.PRECONDITION, String.format(Locale.ROOT,
                            "Invalid line number %d for file %s (file has %d lines)",
                            edit.lineNumber(), filePath, lineCount));
                    continue;
                }
                String line = lines[index];
                int at = edit.original() == null || edit.original().isEmpty() ? -1 : line.indexOf(edit.original());
                if (at < 0) {
                    tx.reject(edit, FailedReplacement.Reason.PRECONDITION, String.format(Locale.ROOT,
                            "Pattern '%s' not found in line %d of %s: %s",
                            edit.original(), edit.lineNumber(), filePath, line.trim()));
                    continue;
                }
                lines[index] = line.substring(0, at) + edit.replacement() + line.substring(at + edit.original().length());
                applied.add(edit);
            }

            if (applied.isEmpty()) {
                log.debug("No applicable edits for {}, file untouched", filePath);
                return;
            }

            tx.backedUp(filePath, backupStore.createBackup(path));
            try {
                Files.writeString(path, String.join("\n", lines), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new ReplacementIoException("Failed to write " + filePath, e);
            }
            tx.edited(filePath, applied);
            log.debug("Applied {} edits to {}", applied.size(), filePath);
        } finally {
            MdcContext.clearFile();
        }
    }

    private BatchResult checkAndResolve(ReplacementTransaction tx) {
        TypeCheckResult check = typeChecker.check();
        tx.transitionAll(ReplacementState.COMPILATION_CHECKED);

        List<CompilerDiagnostic> diagnostics = parser.parse(check.output());
        boolean passed = check.passed() && diagnostics.isEmpty();
        metrics.recordTypeCheck(passed, check.timedOut(), check.elapsed().toMillis());

        if (passed) {
            tx.transitionAll(ReplacementState.COMMITTED);
            return tx.committed();
        }

        List<String> errors = compilationErrors(check, diagnostics);
        log.warn("Type check failed for batch {} with {} errors, rolling back {} files",
                tx.batchId(), errors.size(), tx.backups().size());

        String summary = errors.get(0) + (errors.size() > 1 ? " (and " + (errors.size() - 1) + " more)" : "");
        for (TypeReplacement replacement : tx.appliedReplacements()) {
            tx.reject(replacement, FailedReplacement.Reason.COMPILATION,
                    "Rolled back after type check failure: " + summary);
        }
        for (Map.Entry<String, Backup> entry : tx.backups().entrySet()) {
            backupStore.restore(entry.getValue());
            tx.transition(entry.getKey(), ReplacementState.ROLLED_BACK);
        }
        metrics.recordRollback(tx.backups().size());
        return tx.rolledBack(errors);
    }

    public static List<String> compilationErrors(TypeCheckResult check, List<CompilerDiagnostic> diagnostics) {
        var errors = new ArrayList<String>();
        for (CompilerDiagnostic diagnostic : diagnostics) {
            errors.add(diagnostic.rawText());
        }
        if (!errors.isEmpty()) {
            return errors;
        }
        if (check.timedOut()) {
            errors.add("Type check timed out after " + check.elapsed().toSeconds() + "s");
            return errors;
        }
        String firstLine = check.output() == null ? "" : check.output().lines()
                .map(String::trim)
                .filter(l -> !l.isEmpty())
                .findFirst()
                .orElse("");
        if (firstLine.length() > MAX_FALLBACK_ERROR_LENGTH) {
            firstLine = firstLine.substring(0, MAX_FALLBACK_ERROR_LENGTH);
        }
        errors.add(firstLine.isEmpty()
                ? "Type check failed with exit code " + check.exitCode()
                : "Type check failed with exit code " + check.exitCode() + ": " + firstLine);
        return errors;
    }

    /**
     * Puts every file backed up so far back in place before the failure
     * propagates. Restore failures are attached to the original exception.
     */
    private void restoreAfterAbort(ReplacementTransaction tx, RuntimeException cause) {
        for (Map.Entry<String, Backup> entry : tx.backups().entrySet()) {
            if (tx.states().get(entry.getKey()).isTerminal()) {
                continue;
            }
            try {
                backupStore.restore(entry.getValue());
                tx.transition(entry.getKey(), ReplacementState.ROLLED_BACK);
            } catch (ReplacementIoException restoreFailure) {
                cause.addSuppressed(restoreFailure);
            }
        }
    }
}
