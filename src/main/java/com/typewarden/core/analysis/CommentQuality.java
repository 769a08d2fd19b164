package com.typewarden.core.analysis;

/**
 * Grade of the comment explaining an intentional {@code any}, with the score
 * averaged into the documentation report.
 */
public enum CommentQuality {
    POOR(25),
    FAIR(50),
    GOOD(75),
    EXCELLENT(100);

    private final int score;

    CommentQuality(int score) {
        this.score = score;
    }

    public int score() {
        return score;
    }
}
