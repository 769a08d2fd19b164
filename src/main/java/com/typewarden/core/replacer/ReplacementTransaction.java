package com.typewarden.core.replacer;

import com.typewarden.core.model.BatchResult;
import com.typewarden.core.model.FailedReplacement;
import com.typewarden.core.model.ReplacementState;
import com.typewarden.core.model.TypeReplacement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Book-keeping for one batch: per-file state, backups, applied edits and failures.
 * Not thread-safe; a transaction lives on the thread that holds the campaign lock.
 */
class ReplacementTransaction {

    private static final Logger log = LoggerFactory.getLogger(ReplacementTransaction.class);

    private final String batchId;
    private final Map<String, ReplacementState> states = new LinkedHashMap<>();
    private final Map<String, Backup> backups = new LinkedHashMap<>();
    private final Map<String, List<TypeReplacement>> applied = new LinkedHashMap<>();
    private final List<FailedReplacement> failures = new ArrayList<>();

    ReplacementTransaction(String batchId) {
        this.batchId = batchId;
    }

    String batchId() {
        return batchId;
    }

    void reject(TypeReplacement replacement, FailedReplacement.Reason reason, String message) {
        log.info("Rejected {}:{} ({}): {}", replacement.filePath(), replacement.lineNumber(), reason, message);
        failures.add(new FailedReplacement(replacement, reason, message));
    }

    void backedUp(String file, Backup backup) {
        states.put(file, ReplacementState.PLANNED);
        transition(file, ReplacementState.BACKED_UP);
        backups.put(file, backup);
    }

    void edited(String file, List<TypeReplacement> edits) {
        transition(file, ReplacementState.EDITED);
        applied.put(file, List.copyOf(edits));
    }

    void transitionAll(ReplacementState next) {
        for (String file : new ArrayList<>(states.keySet())) {
            transition(file, next);
        }
    }

    void transition(String file, ReplacementState next) {
        ReplacementState current = states.get(file);
        if (current == null || !current.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal transition for " + file + ": " + current + " -> " + next);
        }
        states.put(file, next);
        log.debug("{} {} -> {}", file, current, next);
    }

    Map<String, Backup> backups() {
        return backups;
    }

    boolean hasTouchedFiles() {
        return !backups.isEmpty();
    }

    List<TypeReplacement> appliedReplacements() {
        var all = new ArrayList<TypeReplacement>();
        applied.values().forEach(all::addAll);
        return all;
    }

    List<FailedReplacement> failures() {
        return failures;
    }

    Map<String, ReplacementState> states() {
        return states;
    }

    BatchResult committed() {
        return new BatchResult(batchId, failures.isEmpty(), appliedReplacements(), failures,
                false, List.of(), states);
    }

    BatchResult untouched() {
        return new BatchResult(batchId, failures.isEmpty(), List.of(), failures, false, List.of(), states);
    }

    BatchResult rolledBack(List<String> compilationErrors) {
        return new BatchResult(batchId, false, List.of(), failures, true, compilationErrors, states);
    }
}
