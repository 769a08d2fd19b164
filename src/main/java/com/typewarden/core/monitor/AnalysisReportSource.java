package com.typewarden.core.monitor;

import com.typewarden.core.analysis.AnalysisReport;

/**
 * Supplies the monitor with the latest campaign analysis.
 */
@FunctionalInterface
public interface AnalysisReportSource {

    AnalysisReport currentReport();
}
