package com.typewarden.core.model;

/**
 * The ten classification buckets, declared in tie-break priority order
 * (highest first).
 */
public enum AnyTypeCategory {
    ARRAY_TYPE(false),
    RECORD_TYPE(false),
    FUNCTION_PARAM(false),
    RETURN_TYPE(false),
    TYPE_ASSERTION(false),
    TEST_MOCK(true),
    EXTERNAL_API(true),
    DYNAMIC_CONFIG(true),
    LEGACY_COMPATIBILITY(true),
    ERROR_HANDLING(true);

    private final boolean preservationWorthy;

    AnyTypeCategory(boolean preservationWorthy) {
        this.preservationWorthy = preservationWorthy;
    }

    /**
     * Categories whose {@code any} is usually deliberate and should only be
     * rewritten when a narrower type is clearly available.
     */
    public boolean isPreservationWorthy() {
        return preservationWorthy;
    }

    /** 1 is the highest priority. */
    public int priority() {
        return ordinal() + 1;
    }

    public boolean isHighRisk() {
        return this == EXTERNAL_API || this == DYNAMIC_CONFIG || this == LEGACY_COMPATIBILITY;
    }
}
