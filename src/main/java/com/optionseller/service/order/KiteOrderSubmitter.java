package com.optionseller.service.order;

import com.optionseller.config.SellerConfig;
import com.optionseller.dto.OrderRequest;
import com.optionseller.exception.OrderRejectedException;
import com.optionseller.service.TradingService;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;

import static com.optionseller.service.TradingConstants.*;

/**
 * Sends SL-M intraday SELL orders through Kite. The stop-loss goes out unchanged as the
 * trigger price.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KiteOrderSubmitter implements OrderSubmitter {

    private final TradingService tradingService;
    private final SellerConfig sellerConfig;

    @Override
    public String placeSellOrder(String tradingSymbol, int quantity, double stopLossPrice) {
        OrderRequest request = OrderRequest.builder()
                .tradingSymbol(tradingSymbol)
                .exchange(sellerConfig.getInstrumentExchange())
                .transactionType(TRANSACTION_SELL)
                .quantity(quantity)
                .product(PRODUCT_MIS)
                .orderType(ORDER_TYPE_SL_M)
                .triggerPrice(stopLossPrice)
                .validity(VALIDITY_DAY)
                .build();

        try {
            return tradingService.placeOrder(request);
        } catch (KiteException e) {
            log.warn("SELL order placement failed for {}, error [{}]: {}", tradingSymbol, e.code, e.message);
            throw new OrderRejectedException(tradingSymbol, e.message != null ? e.message : "Kite error " + e.code, e);
        } catch (IOException e) {
            log.warn("SELL order placement failed for {}, network error: {}", tradingSymbol, e.getMessage());
            throw new OrderRejectedException(tradingSymbol, "Network error: " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            throw new OrderRejectedException(tradingSymbol, e.getMessage(), e);
        }
    }
}
