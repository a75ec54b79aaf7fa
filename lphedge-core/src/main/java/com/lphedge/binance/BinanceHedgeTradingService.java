package com.lphedge.binance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lphedge.binance.model.BinanceOrderRequest;
import com.lphedge.binance.model.BinanceOrderResponse;
import com.lphedge.binance.model.BinanceOrderSide;
import com.lphedge.binance.model.BookTicker;
import com.lphedge.config.HedgeProperties;
import com.lphedge.hedge.OrderResult;
import com.lphedge.hedge.port.FuturesOrderSink;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Places hedge orders as limit orders on the touch: sells at the best ask, buys back at the best bid.
 * In {@code PAPER} mode nothing is sent and a synthetic acknowledgement is returned.
 */
@Slf4j
@RequiredArgsConstructor
public class BinanceHedgeTradingService implements FuturesOrderSink {

  static final String PAPER_STATUS = "PAPER";

  private final @NonNull HedgeProperties properties;
  private final @NonNull BinanceFuturesClient client;
  private final @NonNull ObjectMapper objectMapper;

  @Override
  public OrderResult openSell(String symbol, String quantity) {
    return place(symbol, BinanceOrderSide.SELL, quantity, false);
  }

  @Override
  public OrderResult closeSell(String symbol, String quantity) {
    return place(symbol, BinanceOrderSide.BUY, quantity, true);
  }

  private OrderResult place(String symbol, BinanceOrderSide side, String quantity, boolean reduceOnly) {
    if (properties.risk().killSwitch()) {
      throw new IllegalStateException("Trading disabled by kill switch (lph.risk.kill-switch=true)");
    }
    enforceRiskLimits(quantity);

    BookTicker ticker = client.bookTicker(symbol);
    BigDecimal price = side == BinanceOrderSide.SELL ? ticker.askPrice() : ticker.bidPrice();
    if (price == null || price.signum() <= 0) {
      throw new IllegalStateException("No usable " + (side == BinanceOrderSide.SELL ? "ask" : "bid")
          + " price for " + symbol + ": " + ticker);
    }
    BinanceOrderRequest request = new BinanceOrderRequest(symbol, side, quantity, price, "GTC", reduceOnly);

    if (properties.mode() == HedgeProperties.TradingMode.PAPER) {
      log.info("PAPER order symbol={} side={} quantity={} price={} reduceOnly={}", symbol, side, quantity, price, reduceOnly);
      return new OrderResult("paper-" + UUID.randomUUID(), symbol, side.name(), PAPER_STATUS,
          price.toPlainString(), quantity, reduceOnly, null);
    }

    JsonNode raw = client.placeOrder(request);
    BinanceOrderResponse ack = objectMapper.convertValue(raw, BinanceOrderResponse.class);
    log.info("order placed symbol={} side={} quantity={} price={} reduceOnly={} orderId={} status={}",
        symbol, side, quantity, price, reduceOnly, ack.orderId(), ack.status());
    return new OrderResult(
        ack.orderId() == null ? null : ack.orderId().toString(),
        ack.symbol() == null ? symbol : ack.symbol(),
        ack.side() == null ? side.name() : ack.side(),
        ack.status(),
        ack.price() == null ? price.toPlainString() : ack.price(),
        ack.origQty() == null ? quantity : ack.origQty(),
        ack.reduceOnly() == null ? reduceOnly : ack.reduceOnly(),
        raw
    );
  }

  private void enforceRiskLimits(String quantity) {
    BigDecimal qty;
    try {
      qty = new BigDecimal(quantity);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("quantity is not a decimal: " + quantity, e);
    }
    if (qty.signum() <= 0) {
      throw new IllegalArgumentException("quantity must be > 0, got " + quantity);
    }
    BigDecimal max = properties.risk().maxOrderQuantity();
    if (max != null && max.signum() > 0 && qty.compareTo(max) > 0) {
      throw new IllegalStateException("Order quantity " + quantity + " exceeds lph.risk.max-order-quantity=" + max.toPlainString());
    }
  }
}
