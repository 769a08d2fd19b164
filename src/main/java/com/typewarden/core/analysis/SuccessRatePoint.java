package com.typewarden.core.analysis;

import java.time.Instant;

public record SuccessRatePoint(Instant timestamp, double successRate) {}
