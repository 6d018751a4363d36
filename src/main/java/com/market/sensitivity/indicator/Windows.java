package com.market.sensitivity.indicator;

/**
 * Window argument checks shared by the rolling computations.
 */
public final class Windows {

    private Windows() {}

    public static void requireValid(int window) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be >= 1, was " + window);
        }
    }
}
