package com.lphedge.hedge;

/**
 * Futures position as reported by the exchange. Numeric fields stay as the venue's decimal strings;
 * {@link SnapshotBuilder} owns parsing them.
 */
public record FuturesPositionRecord(
    String symbol,
    String positionAmt,
    String markPrice,
    String unrealizedPnl,
    long updateTime
) {
}
