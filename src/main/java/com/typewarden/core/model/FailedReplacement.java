package com.typewarden.core.model;

/**
 * A replacement that did not make it into the committed tree, with the reason why.
 */
public record FailedReplacement(
    TypeReplacement replacement,
    Reason reason,
    String message
) {
    public enum Reason { PRECONDITION, SAFETY_GATE, COMPILATION }
}
