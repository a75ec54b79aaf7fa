package com.lphedge.hedge;

/**
 * Merged view of both hedge legs for one poll cycle.
 *
 * @param blockNumber             chain height the LP position was read at
 * @param symbol                  futures instrument
 * @param ammBaseAmount           base tokens withdrawable from the LP position
 * @param ammUsdtAmount           quote tokens withdrawable from the LP position
 * @param ammCollectableBase      uncollected base-token fees
 * @param ammCollectableUsdt      uncollected quote-token fees
 * @param ammCollectableValueUsdt uncollected fees valued in quote
 * @param futuresPosition         signed futures size in base units, negative when short
 * @param unrealizedPnl           futures unrealized PnL in quote
 * @param futuresTimestamp        venue update time, epoch millis
 * @param basePriceUsdt           futures mark price
 * @param baseDelta               net base exposure, LP amount plus futures position
 * @param baseDeltaRatio          base delta divided by the larger leg
 * @param ammTotalValueUsdt       LP position valued in quote
 * @param totalValueUsdt          LP value plus futures unrealized PnL
 */
public record PositionSnapshot(
    long blockNumber,
    String symbol,
    double ammBaseAmount,
    double ammUsdtAmount,
    double ammCollectableBase,
    double ammCollectableUsdt,
    double ammCollectableValueUsdt,
    double futuresPosition,
    double unrealizedPnl,
    long futuresTimestamp,
    double basePriceUsdt,
    double baseDelta,
    double baseDeltaRatio,
    double ammTotalValueUsdt,
    double totalValueUsdt
) {

  public double ammBaseValueUsdt() {
    return ammBaseAmount * basePriceUsdt;
  }

  public double ammCollectableBaseValueUsdt() {
    return ammCollectableBase * basePriceUsdt;
  }
}
