package com.lphedge.binance.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BinanceOrderResponse(
    Long orderId,
    String clientOrderId,
    String symbol,
    String side,
    String type,
    String status,
    String price,
    String origQty,
    String executedQty,
    Boolean reduceOnly,
    String timeInForce,
    Long updateTime
) {
}
