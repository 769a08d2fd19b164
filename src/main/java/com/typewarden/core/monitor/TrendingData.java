package com.typewarden.core.monitor;

import java.util.List;

/**
 * Time series for the dashboard, oldest first.
 *
 * @param successRate success percentage after each batch
 * @param buildTimeMs duration of each build probe
 * @param buildErrors error count of each build probe
 */
public record TrendingData(
    List<TrendPoint> successRate,
    List<TrendPoint> buildTimeMs,
    List<TrendPoint> buildErrors
) {}
