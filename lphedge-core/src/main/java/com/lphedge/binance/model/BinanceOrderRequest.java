package com.lphedge.binance.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Limit order for {@code POST /fapi/v1/order}. Quantity is passed through as the caller formatted it so
 * the exchange sees the precision the hedge step implies.
 */
public record BinanceOrderRequest(
    String symbol,
    BinanceOrderSide side,
    String quantity,
    BigDecimal price,
    String timeInForce,
    boolean reduceOnly
) {
  public BinanceOrderRequest {
    Objects.requireNonNull(symbol, "symbol");
    Objects.requireNonNull(side, "side");
    Objects.requireNonNull(quantity, "quantity");
    Objects.requireNonNull(price, "price");
    if (timeInForce == null || timeInForce.isBlank()) {
      timeInForce = "GTC";
    }
  }
}
