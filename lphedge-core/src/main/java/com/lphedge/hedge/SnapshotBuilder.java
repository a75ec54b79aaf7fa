package com.lphedge.hedge;

import com.lphedge.hedge.error.MalformedVenueDataException;
import com.lphedge.hedge.error.PositionNotFoundException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Merges one LP position and one futures position into a {@link PositionSnapshot}.
 * <p>
 * Every LP token is assumed to carry 18 decimals. The builder performs no I/O; collaborators are read
 * before it is called.
 */
public final class SnapshotBuilder {

  public static final int AMM_TOKEN_DECIMALS = 18;
  public static final double EPSILON = 1e-8;

  public PositionSnapshot build(
      Map<BigInteger, AmmPositionRecord> ammPositions,
      List<FuturesPositionRecord> futuresPositions,
      StrategyConfig cfg,
      long blockNumber
  ) {
    Objects.requireNonNull(cfg, "cfg");

    AmmPositionRecord lp = selectAmmPosition(ammPositions == null ? List.of() : ammPositions.values(), cfg);
    boolean baseIsToken0 = sameAddress(lp.token0(), cfg.baseTokenAddress());

    double ammBaseAmount = fromFixedPoint("withdrawable" + (baseIsToken0 ? "0" : "1"),
        baseIsToken0 ? lp.withdrawable0() : lp.withdrawable1());
    double ammUsdtAmount = fromFixedPoint("withdrawable" + (baseIsToken0 ? "1" : "0"),
        baseIsToken0 ? lp.withdrawable1() : lp.withdrawable0());
    double ammCollectableBase = fromFixedPoint("collectable" + (baseIsToken0 ? "0" : "1"),
        baseIsToken0 ? lp.collectable0() : lp.collectable1());
    double ammCollectableUsdt = fromFixedPoint("collectable" + (baseIsToken0 ? "1" : "0"),
        baseIsToken0 ? lp.collectable1() : lp.collectable0());

    FuturesPositionRecord futures = selectFuturesPosition(futuresPositions == null ? List.of() : futuresPositions, cfg);
    double futuresPosition = parseDecimal("positionAmt", futures.positionAmt());
    double basePriceUsdt = parseDecimal("markPrice", futures.markPrice());
    double unrealizedPnl = parseDecimal("unrealizedPnl", futures.unrealizedPnl());

    double baseDelta = ammBaseAmount + futuresPosition;
    double baseDeltaRatio = deltaRatio(ammBaseAmount, futuresPosition);
    double ammTotalValueUsdt = ammBaseAmount * basePriceUsdt + ammUsdtAmount;
    double ammCollectableValueUsdt = ammCollectableBase * basePriceUsdt + ammCollectableUsdt;
    double totalValueUsdt = ammTotalValueUsdt + unrealizedPnl;

    return new PositionSnapshot(
        blockNumber,
        cfg.symbol(),
        ammBaseAmount,
        ammUsdtAmount,
        ammCollectableBase,
        ammCollectableUsdt,
        ammCollectableValueUsdt,
        futuresPosition,
        unrealizedPnl,
        futures.updateTime(),
        basePriceUsdt,
        baseDelta,
        baseDeltaRatio,
        ammTotalValueUsdt,
        totalValueUsdt
    );
  }

  /**
   * Net exposure normalised by the larger leg. The denominator is floored at {@link #EPSILON}, so two
   * empty legs give a ratio of zero instead of NaN.
   */
  public static double deltaRatio(double ammBaseAmount, double futuresPosition) {
    double reference = Math.max(Math.max(Math.abs(ammBaseAmount), Math.abs(futuresPosition)), EPSILON);
    return (ammBaseAmount + futuresPosition) / reference;
  }

  static double fromFixedPoint(String field, BigInteger raw) {
    if (raw == null) {
      throw new MalformedVenueDataException(field, null, null);
    }
    return new BigDecimal(raw).movePointLeft(AMM_TOKEN_DECIMALS).doubleValue();
  }

  static double parseDecimal(String field, String raw) {
    if (raw == null || raw.isBlank()) {
      throw new MalformedVenueDataException(field, raw, null);
    }
    try {
      // BigDecimal refuses NaN, Infinity and type suffixes that Double.parseDouble would let through
      return new BigDecimal(raw.trim()).doubleValue();
    } catch (NumberFormatException e) {
      throw new MalformedVenueDataException(field, raw, e);
    }
  }

  private static AmmPositionRecord selectAmmPosition(Collection<AmmPositionRecord> positions, StrategyConfig cfg) {
    AmmPositionRecord match = null;
    int matches = 0;
    for (AmmPositionRecord p : positions) {
      if (p == null || !matchesPair(p, cfg)) {
        continue;
      }
      matches++;
      match = p;
    }
    if (matches == 0) {
      throw new PositionNotFoundException("No LP position found for base_token=" + cfg.baseTokenAddress()
          + " usdt_token=" + cfg.usdtTokenAddress() + " (positions scanned=" + positions.size() + ")");
    }
    if (matches > 1) {
      throw new PositionNotFoundException("Ambiguous LP position: " + matches + " positions match base_token="
          + cfg.baseTokenAddress() + " usdt_token=" + cfg.usdtTokenAddress());
    }
    return match;
  }

  private static boolean matchesPair(AmmPositionRecord p, StrategyConfig cfg) {
    String base = cfg.baseTokenAddress();
    String usdt = cfg.usdtTokenAddress();
    return (sameAddress(p.token0(), base) && sameAddress(p.token1(), usdt))
        || (sameAddress(p.token0(), usdt) && sameAddress(p.token1(), base));
  }

  private static FuturesPositionRecord selectFuturesPosition(List<FuturesPositionRecord> positions, StrategyConfig cfg) {
    List<FuturesPositionRecord> matching = positions.stream()
        .filter(Objects::nonNull)
        .filter(p -> cfg.symbol().equals(p.symbol()))
        .toList();
    if (matching.isEmpty()) {
      throw new PositionNotFoundException("No futures position found for symbol=" + cfg.symbol());
    }
    if (matching.size() > 1) {
      throw new PositionNotFoundException("Ambiguous futures position: " + matching.size()
          + " entries for symbol=" + cfg.symbol() + " (is the account in hedge mode?)");
    }
    return matching.get(0);
  }

  private static boolean sameAddress(String a, String b) {
    if (a == null || b == null) {
      return false;
    }
    return a.trim().toLowerCase(Locale.ROOT).equals(b.trim().toLowerCase(Locale.ROOT));
  }
}
