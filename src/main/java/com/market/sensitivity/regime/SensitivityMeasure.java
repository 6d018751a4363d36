package com.market.sensitivity.regime;

public enum SensitivityMeasure {

    UPSIDE_SENSITIVITY("upside_sensitivity", "Upside Sensitivity"),
    DOWNSIDE_SENSITIVITY("downside_sensitivity", "Downside Sensitivity"),
    COMPOSITE_SENSITIVITY("composite_sensitivity", "Composite Sensitivity"),
    MARKET_INDEPENDENCE("market_independence", "Market Independence");

    private final String key;
    private final String displayName;

    SensitivityMeasure(String key, String displayName) {
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
