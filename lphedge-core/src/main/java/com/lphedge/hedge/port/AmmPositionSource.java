package com.lphedge.hedge.port;

import com.lphedge.hedge.AmmPositionRecord;

import java.math.BigInteger;
import java.util.Map;

/**
 * Read access to the on-chain LP positions of one owner.
 */
public interface AmmPositionSource {

  /**
   * Refreshes the internal position table for {@code ownerAddress}.
   */
  void sync(String ownerAddress);

  /**
   * Positions loaded by the last {@link #sync(String)}, keyed by position token id.
   */
  Map<BigInteger, AmmPositionRecord> positions();

  long currentBlock();
}
