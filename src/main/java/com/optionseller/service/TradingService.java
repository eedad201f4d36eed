package com.optionseller.service;

import com.optionseller.dto.OrderRequest;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.models.Instrument;
import com.zerodhatech.models.LTPQuote;
import com.zerodhatech.models.Order;
import com.zerodhatech.models.OrderParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static com.optionseller.service.TradingConstants.*;

/**
 * Thin wrapper over the Kite Connect SDK. Methods surface the SDK's checked exceptions;
 * the market and order adapters translate them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TradingService {

    private final KiteConnect kiteConnect;

    /**
     * Get LTP for instruments given as {@code EXCHANGE:TRADINGSYMBOL}
     */
    public Map<String, LTPQuote> getLTP(String[] instruments) throws KiteException, IOException {
        log.debug("Fetching LTP for {} instruments", instruments.length);
        Map<String, LTPQuote> ltp = kiteConnect.getLTP(instruments);
        log.debug("Fetched LTP for {} instruments", ltp != null ? ltp.size() : 0);
        return ltp;
    }

    /**
     * Get the full instrument dump for an exchange
     */
    public List<Instrument> getInstruments(String exchange) throws KiteException, IOException {
        log.info("Fetching instruments for exchange: {}", exchange);
        long startTime = System.currentTimeMillis();
        List<Instrument> instruments = kiteConnect.getInstruments(exchange);
        log.info("Fetched {} instruments for {} in {}ms",
                instruments != null ? instruments.size() : 0, exchange, System.currentTimeMillis() - startTime);
        return instruments;
    }

    /**
     * Place a new regular order and return its order id
     */
    public String placeOrder(OrderRequest orderRequest) throws KiteException, IOException {
        log.info("Placing order - Symbol: {}, Type: {}, Qty: {}, Trigger: {}",
            orderRequest.getTradingSymbol(), orderRequest.getTransactionType(),
            orderRequest.getQuantity(), orderRequest.getTriggerPrice());

        Order order = kiteConnect.placeOrder(buildOrderParams(orderRequest), VARIETY_REGULAR);

        if (order != null && order.orderId != null && !order.orderId.isEmpty()) {
            log.info("Order placed successfully: {} - {} {} {}",
                order.orderId, orderRequest.getTransactionType(), orderRequest.getQuantity(), orderRequest.getTradingSymbol());
            return order.orderId;
        }
        log.error("Order placement failed - no order ID returned");
        throw new IllegalStateException(ERR_ORDER_PLACEMENT_FAILED_NO_ID);
    }

    private OrderParams buildOrderParams(OrderRequest orderRequest) {
        OrderParams orderParams = new OrderParams();
        orderParams.tradingsymbol = orderRequest.getTradingSymbol();
        orderParams.exchange = orderRequest.getExchange();
        orderParams.transactionType = orderRequest.getTransactionType();
        orderParams.quantity = orderRequest.getQuantity();
        orderParams.product = orderRequest.getProduct();
        orderParams.orderType = orderRequest.getOrderType();
        orderParams.price = orderRequest.getPrice();
        orderParams.triggerPrice = orderRequest.getTriggerPrice();
        orderParams.validity = orderRequest.getValidity();
        return orderParams;
    }
}
