package com.typewarden.core.analysis;

/**
 * One bucket of a distribution. {@code percentage} is in [0, 100].
 */
public record DistributionEntry(String label, int count, double percentage) {

    static DistributionEntry of(String label, int count, int total) {
        return new DistributionEntry(label, count, total > 0 ? count * 100.0 / total : 0.0);
    }
}
