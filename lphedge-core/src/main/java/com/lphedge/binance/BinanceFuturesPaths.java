package com.lphedge.binance;

final class BinanceFuturesPaths {

  private BinanceFuturesPaths() {
  }

  static final String POSITION_RISK = "/fapi/v3/positionRisk";
  static final String ORDER = "/fapi/v1/order";
  static final String BOOK_TICKER = "/fapi/v1/ticker/bookTicker";
  static final String FUNDING_RATE = "/fapi/v1/fundingRate";
}
