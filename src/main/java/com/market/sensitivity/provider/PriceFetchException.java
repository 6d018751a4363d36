package com.market.sensitivity.provider;

/**
 * Price history for a symbol could not be retrieved.
 */
public class PriceFetchException extends RuntimeException {
    private final String symbol;

    public PriceFetchException(String symbol, String message) {
        super("[" + symbol + "] " + message);
        this.symbol = symbol;
    }

    public PriceFetchException(String symbol, String message, Throwable cause) {
        super("[" + symbol + "] " + message, cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
