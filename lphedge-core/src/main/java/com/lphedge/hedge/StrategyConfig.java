package com.lphedge.hedge;

import com.lphedge.hedge.error.HedgeConfigurationException;

/**
 * Identifiers and thresholds for one hedged pair. Pure data: clients are injected into
 * {@link LphStrategy} separately.
 *
 * @param ownerAddress           address owning the LP position NFTs
 * @param positionManagerAddress NonfungiblePositionManager contract the positions live in
 * @param baseTokenAddress       ERC-20 address of the base asset (e.g. WBNB)
 * @param usdtTokenAddress       ERC-20 address of the quote stablecoin
 * @param symbol                 futures instrument, e.g. {@code BNBUSDC}
 * @param ratioThreshold         n, the delta ratio must exceed this to trigger
 * @param deltaThreshold         m, |delta| must exceed this to trigger; also the order quantity step
 */
public record StrategyConfig(
    String ownerAddress,
    String positionManagerAddress,
    String baseTokenAddress,
    String usdtTokenAddress,
    String symbol,
    double ratioThreshold,
    double deltaThreshold
) {

  /**
   * Builds a config and rejects values the engine cannot work with. A non-positive step would make
   * quantity rounding meaningless, so it is refused here rather than at cycle time.
   */
  public static StrategyConfig of(
      String ownerAddress,
      String positionManagerAddress,
      String baseTokenAddress,
      String usdtTokenAddress,
      String symbol,
      double ratioThreshold,
      double deltaThreshold
  ) {
    requireText("ownerAddress", ownerAddress);
    requireText("positionManagerAddress", positionManagerAddress);
    requireText("baseTokenAddress", baseTokenAddress);
    requireText("usdtTokenAddress", usdtTokenAddress);
    requireText("symbol", symbol);
    if (baseTokenAddress.trim().equalsIgnoreCase(usdtTokenAddress.trim())) {
      throw new HedgeConfigurationException("baseTokenAddress and usdtTokenAddress must differ: " + baseTokenAddress);
    }
    if (!Double.isFinite(ratioThreshold)) {
      throw new HedgeConfigurationException("ratioThreshold must be finite, got " + ratioThreshold);
    }
    if (!Double.isFinite(deltaThreshold) || deltaThreshold <= 0) {
      throw new HedgeConfigurationException("deltaThreshold must be a positive finite number, got " + deltaThreshold);
    }
    return new StrategyConfig(
        ownerAddress.trim(),
        positionManagerAddress.trim(),
        baseTokenAddress.trim(),
        usdtTokenAddress.trim(),
        symbol.trim(),
        ratioThreshold,
        deltaThreshold
    );
  }

  private static void requireText(String name, String value) {
    if (value == null || value.isBlank()) {
      throw new HedgeConfigurationException(name + " must be set");
    }
  }
}
