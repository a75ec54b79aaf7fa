package com.lphedge.binance.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FundingRate(
    String symbol,
    long fundingTime,
    BigDecimal fundingRate,
    BigDecimal markPrice
) {
}
