package com.typewarden.core.monitor;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertType {
    LOW_SUCCESS_RATE("low_success_rate"),
    BUILD_FAILURE("build_failure"),
    CONSECUTIVE_BUILD_FAILURES("consecutive_build_failures"),
    LOW_CLASSIFICATION_ACCURACY("low_classification_accuracy"),
    PROGRESS_STALL("progress_stall"),
    FREQUENT_SAFETY_EVENTS("frequent_safety_events"),
    SYSTEM_ERROR("system_error");

    private final String key;

    AlertType(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static AlertType fromKey(String key) {
        for (AlertType type : values()) {
            if (type.key.equals(key) || type.name().equals(key)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown alert type: " + key);
    }
}
