package com.typewarden.core.model;

import java.util.List;
import java.util.Map;

/**
 * Terminal outcome of one replacement transaction.
 *
 * @param batchId              identifier used in logs and events
 * @param success              true only when everything was applied and the build passed
 * @param appliedReplacements  edits that were committed
 * @param failedReplacements   edits that were rejected or rolled back, each with a message
 * @param rollbackPerformed    whether touched files were restored from backup
 * @param compilationErrors    one entry per compiler diagnostic line
 * @param fileStates           terminal state per touched file
 */
public record BatchResult(
    String batchId,
    boolean success,
    List<TypeReplacement> appliedReplacements,
    List<FailedReplacement> failedReplacements,
    boolean rollbackPerformed,
    List<String> compilationErrors,
    Map<String, ReplacementState> fileStates
) {
    public BatchResult {
        appliedReplacements = List.copyOf(appliedReplacements);
        failedReplacements = List.copyOf(failedReplacements);
        compilationErrors = List.copyOf(compilationErrors);
        fileStates = Map.copyOf(fileStates);
        if (success && (rollbackPerformed || !compilationErrors.isEmpty() || !failedReplacements.isEmpty())) {
            throw new IllegalArgumentException(
                    "A successful batch cannot carry failures, compilation errors or a rollback");
        }
    }

    public int attemptedCount() {
        return appliedReplacements.size() + failedReplacements.size();
    }
}
