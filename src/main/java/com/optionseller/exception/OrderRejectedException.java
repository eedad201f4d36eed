package com.optionseller.exception;

/**
 * Thrown when the broker refuses a sell order. Carries the upstream reason as reported
 * by the broker.
 */
public class OrderRejectedException extends RuntimeException {

    private final String tradingSymbol;
    private final String reason;

    public OrderRejectedException(String tradingSymbol, String reason) {
        super("Order rejected for " + tradingSymbol + ": " + reason);
        this.tradingSymbol = tradingSymbol;
        this.reason = reason;
    }

    public OrderRejectedException(String tradingSymbol, String reason, Throwable cause) {
        super("Order rejected for " + tradingSymbol + ": " + reason, cause);
        this.tradingSymbol = tradingSymbol;
        this.reason = reason;
    }

    public String getTradingSymbol() {
        return tradingSymbol;
    }

    public String getReason() {
        return reason;
    }
}
