package com.lphedge.binance.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Entry of {@code GET /fapi/v3/positionRisk}. Numbers arrive as strings and are kept that way.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BinancePosition(
    String symbol,
    String positionSide,
    String positionAmt,
    String entryPrice,
    String breakEvenPrice,
    String markPrice,
    @JsonProperty("unRealizedProfit") String unrealizedProfit,
    String liquidationPrice,
    String notional,
    String marginAsset,
    String initialMargin,
    String maintMargin,
    Long updateTime
) {
}
