package com.typewarden.core.engine;

import com.typewarden.core.model.BatchResult;

import java.util.List;

/**
 * Outcome of one {@link CampaignEngine#runCampaign} call.
 *
 * @param checkpointId        git checkpoint taken before the run, or {@code null}
 * @param occurrencesFound    occurrences the scan located
 * @param plannedReplacements edits that passed classification and strategy selection
 * @param batches             every batch submitted, in order
 * @param appliedCount        edits committed across all batches
 * @param failedCount         edits rejected or rolled back across all batches
 * @param filesRemaining      planned files not reached before the batch limit
 */
public record CampaignRunResult(
    String checkpointId,
    int occurrencesFound,
    int plannedReplacements,
    List<BatchResult> batches,
    int appliedCount,
    int failedCount,
    int filesRemaining
) {
    public CampaignRunResult {
        batches = List.copyOf(batches);
    }

    public double successRate() {
        int attempted = appliedCount + failedCount;
        return attempted > 0 ? appliedCount * 100.0 / attempted : 0.0;
    }
}
