package com.optionseller.model;

/**
 * Result of one leg's sell order submission. Exactly one of orderId and
 * failureReason is set.
 */
public record LegOrderResult(
    OptionType leg,
    String tradingSymbol,
    int quantity,
    double stopLossPrice,
    String orderId,
    String failureReason
) {

    public static LegOrderResult placed(OptionType leg, String tradingSymbol, int quantity,
                                        double stopLossPrice, String orderId) {
        return new LegOrderResult(leg, tradingSymbol, quantity, stopLossPrice, orderId, null);
    }

    public static LegOrderResult failed(OptionType leg, String tradingSymbol, int quantity,
                                        double stopLossPrice, String failureReason) {
        return new LegOrderResult(leg, tradingSymbol, quantity, stopLossPrice, null, failureReason);
    }

    public boolean isPlaced() {
        return orderId != null;
    }
}
