package com.typewarden.core.analysis;

import com.typewarden.core.model.AnyTypeCategory;

public record CategoryAccuracy(AnyTypeCategory category, int sampled, int accurate, double accuracy) {}
