package com.typewarden.core.model;

/**
 * An occurrence's context paired with its classification.
 */
public record ClassifiedOccurrence(
    ClassificationContext context,
    Classification classification
) {}
