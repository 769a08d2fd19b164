package com.typewarden.core.model;

/**
 * Coarse subsystem label used to bias classification and type inference.
 */
public enum CodeDomain {
    ASTROLOGICAL,
    RECIPE,
    CAMPAIGN,
    INTELLIGENCE,
    SERVICE,
    COMPONENT,
    UTILITY,
    TEST
}
