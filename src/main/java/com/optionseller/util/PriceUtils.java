package com.optionseller.util;

import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.math.RoundingMode;

import static com.optionseller.service.TradingConstants.TICK_SIZE;

/**
 * Price helpers for exchange-facing values.
 */
@UtilityClass
public class PriceUtils {

    /**
     * Snap a price to the nearest option tick, halves rounding up.
     *
     * @param price raw price
     * @return price as a multiple of {@code TICK_SIZE}
     */
    public static double roundToTick(double price) {
        BigDecimal tick = BigDecimal.valueOf(TICK_SIZE);
        return BigDecimal.valueOf(price)
                .divide(tick, 0, RoundingMode.HALF_UP)
                .multiply(tick)
                .doubleValue();
    }

    public static boolean isAtLeastOneTick(double price) {
        return price >= TICK_SIZE;
    }
}
