package com.lphedge.hedge.port;

import com.lphedge.hedge.OrderResult;

public interface FuturesOrderSink {

  /**
   * Sells {@code quantity} base units, opening or extending the short.
   */
  OrderResult openSell(String symbol, String quantity);

  /**
   * Buys back {@code quantity} base units of the short. Reduce-only: never opens or flips a position.
   */
  OrderResult closeSell(String symbol, String quantity);
}
