package com.lphedge.hedge;

import java.math.BigInteger;

/**
 * One LP position as read from the position manager. Amounts are raw on-chain integers.
 *
 * @param withdrawable0 token0 received if all liquidity were removed now
 * @param withdrawable1 token1 received if all liquidity were removed now
 * @param collectable0  token0 fees owed to the position
 * @param collectable1  token1 fees owed to the position
 */
public record AmmPositionRecord(
    BigInteger tokenId,
    String token0,
    String token1,
    BigInteger liquidity,
    BigInteger withdrawable0,
    BigInteger withdrawable1,
    BigInteger collectable0,
    BigInteger collectable1
) {
}
