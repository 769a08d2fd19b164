package com.typewarden.core.analysis;

public enum ReviewPriority { HIGH, MEDIUM, LOW }
