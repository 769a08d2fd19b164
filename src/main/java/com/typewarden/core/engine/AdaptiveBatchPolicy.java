package com.typewarden.core.engine;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sizes the next batch from the success ratio of the last few batches.
 * Shrinks fast when batches start failing and grows slowly back to the configured maximum.
 */
public class AdaptiveBatchPolicy {

    static final int WINDOW = 3;
    static final double SHRINK_BELOW = 0.5;
    static final double GROW_ABOVE = 0.9;
    static final double GROWTH_FACTOR = 1.2;

    private final int maxSize;
    private final Deque<Double> recent = new ArrayDeque<>();
    private int currentSize;

    public AdaptiveBatchPolicy(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.currentSize = maxSize;
    }

    public int currentSize() {
        return currentSize;
    }

    /**
     * @param successRatio committed / attempted for the batch just finished, in [0, 1]
     * @return the size of the next batch
     */
    public int record(double successRatio) {
        recent.addLast(successRatio);
        while (recent.size() > WINDOW) {
            recent.removeFirst();
        }
        double average = recent.stream().mapToDouble(Double::doubleValue).average().orElse(1.0);
        if (average < SHRINK_BELOW) {
            currentSize = Math.max(1, currentSize / 2);
        } else if (average > GROW_ABOVE) {
            currentSize = Math.min(maxSize, (int) Math.ceil(currentSize * GROWTH_FACTOR));
        }
        return currentSize;
    }
}
