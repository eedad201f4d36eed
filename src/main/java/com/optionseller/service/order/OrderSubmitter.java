package com.optionseller.service.order;

import com.optionseller.exception.OrderRejectedException;

/**
 * Places protective sell orders on one option leg.
 */
public interface OrderSubmitter {

    /**
     * Places a stop-loss-market SELL order.
     *
     * @param stopLossPrice trigger price, already on the exchange tick
     * @return broker order id
     * @throws OrderRejectedException when the broker refuses the order
     */
    String placeSellOrder(String tradingSymbol, int quantity, double stopLossPrice);
}
