package com.lphedge.binance.model;

public enum BinanceOrderSide {
  BUY,
  SELL
}
