package com.typewarden.core.monitor;

import java.time.Instant;

public record TrendPoint(Instant timestamp, double value) {}
