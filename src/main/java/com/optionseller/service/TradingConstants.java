package com.optionseller.service;

/**
 * Constants used across trading services
 * Centralizes Kite string literals to avoid duplication and typos
 */
public final class TradingConstants {

    // Exchanges
    public static final String EXCHANGE_NFO = "NFO";
    public static final String EXCHANGE_NSE = "NSE";

    // Products
    public static final String PRODUCT_MIS = "MIS";

    // Order Varieties
    public static final String VARIETY_REGULAR = "regular";

    // Order Validity
    public static final String VALIDITY_DAY = "DAY";

    // Transaction Types
    public static final String TRANSACTION_SELL = "SELL";

    // Order Types
    public static final String ORDER_TYPE_SL_M = "SL-M";

    /** Minimum price increment for NFO options. */
    public static final double TICK_SIZE = 0.05;

    public static final String ERR_ORDER_PLACEMENT_FAILED_NO_ID = "Order placement failed - no order ID returned";

    private TradingConstants() {
        throw new AssertionError("Cannot instantiate constants class");
    }
}
