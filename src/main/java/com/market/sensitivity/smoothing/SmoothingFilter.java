package com.market.sensitivity.smoothing;

import com.market.sensitivity.series.TimeSeries;

/**
 * Display post-processing applied to a finished series. Implementations must
 * return a series on the same index as the input.
 */
public interface SmoothingFilter {

    TimeSeries smooth(TimeSeries series);
}
