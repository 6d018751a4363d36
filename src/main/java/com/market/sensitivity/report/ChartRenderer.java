package com.market.sensitivity.report;

import com.market.sensitivity.analysis.AnalysisResult;

import java.nio.file.Path;

/**
 * Presentation sink for a finished analysis.
 */
public interface ChartRenderer {

    /**
     * @return location of the rendered output
     */
    Path render(AnalysisResult result);
}
