package com.typewarden.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a file inside one replacement transaction.
 */
public enum ReplacementState {
    PLANNED,
    BACKED_UP,
    EDITED,
    COMPILATION_CHECKED,
    COMMITTED,
    ROLLED_BACK;

    public boolean canTransitionTo(ReplacementState next) {
        return allowedNext().contains(next);
    }

    public boolean isTerminal() {
        return this == COMMITTED || this == ROLLED_BACK;
    }

    private Set<ReplacementState> allowedNext() {
        return switch (this) {
            case PLANNED -> EnumSet.of(BACKED_UP);
            case BACKED_UP -> EnumSet.of(EDITED, ROLLED_BACK);
            case EDITED -> EnumSet.of(COMPILATION_CHECKED, ROLLED_BACK);
            case COMPILATION_CHECKED -> EnumSet.of(COMMITTED, ROLLED_BACK);
            case COMMITTED, ROLLED_BACK -> EnumSet.noneOf(ReplacementState.class);
        };
    }
}
