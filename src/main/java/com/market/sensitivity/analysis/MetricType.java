package com.market.sensitivity.analysis;

/**
 * Derived metrics whose market sensitivity is analyzed.
 */
public enum MetricType {

    PERFORMANCE_RATIO("Performance_Ratio", "Performance Ratio"),
    VOLATILITY_ADJUSTED_RATIO("Volatility_Adjusted_Ratio", "Volatility-Adjusted Ratio");

    private final String key;
    private final String displayName;

    MetricType(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }
}
