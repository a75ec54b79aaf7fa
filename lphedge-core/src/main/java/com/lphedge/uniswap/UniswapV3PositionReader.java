package com.lphedge.uniswap;

import com.lphedge.hedge.AmmPositionRecord;
import com.lphedge.hedge.port.AmmPositionSource;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Reads every LP position an owner holds in a Uniswap V3 style NonfungiblePositionManager.
 * <p>
 * Withdrawable and collectable amounts are obtained by simulating {@code decreaseLiquidity} and
 * {@code collect} with {@code eth_call} from the owner's address, all pinned to one block so the table is
 * consistent. A failed simulation leaves that pair of amounts at zero.
 */
@Slf4j
public final class UniswapV3PositionReader implements AmmPositionSource {

  private final EthCallClient rpc;
  private final String positionManagerAddress;

  private volatile Map<BigInteger, AmmPositionRecord> positions = Map.of();

  public UniswapV3PositionReader(EthCallClient rpc, String positionManagerAddress) {
    this.rpc = Objects.requireNonNull(rpc, "rpc");
    this.positionManagerAddress = Objects.requireNonNull(positionManagerAddress, "positionManagerAddress");
  }

  @Override
  public void sync(String ownerAddress) {
    BigInteger block = rpc.blockNumber();
    long count = uint(call(ownerAddress, PositionManagerCalls.balanceOf(ownerAddress), block), 0).longValueExact();

    Map<BigInteger, AmmPositionRecord> next = new TreeMap<>();
    for (long index = 0; index < count; index++) {
      BigInteger tokenId = uint(call(ownerAddress, PositionManagerCalls.tokenOfOwnerByIndex(ownerAddress, index), block), 0);
      AmmPositionRecord position = readPosition(ownerAddress, tokenId, block);
      next.put(tokenId, position);
    }
    positions = Collections.unmodifiableMap(next);
    log.debug("synced {} LP positions for owner={} at block={}", next.size(), ownerAddress, block);
  }

  @Override
  public Map<BigInteger, AmmPositionRecord> positions() {
    return positions;
  }

  @Override
  public long currentBlock() {
    return rpc.blockNumber().longValueExact();
  }

  private AmmPositionRecord readPosition(String owner, BigInteger tokenId, BigInteger block) {
    List<Type> info = call(owner, PositionManagerCalls.positions(tokenId), block);
    String token0 = (String) info.get(2).getValue();
    String token1 = (String) info.get(3).getValue();
    BigInteger liquidity = uint(info, 7);

    BigInteger[] withdrawable = {BigInteger.ZERO, BigInteger.ZERO};
    if (liquidity.signum() > 0) {
      withdrawable = simulate("decreaseLiquidity", owner, tokenId, block,
          PositionManagerCalls.encodeDecreaseAllLiquidity(tokenId, liquidity));
    }
    BigInteger[] collectable = simulate("collect", owner, tokenId, block,
        PositionManagerCalls.encodeCollectAll(tokenId, owner));

    return new AmmPositionRecord(
        tokenId,
        token0,
        token1,
        liquidity,
        withdrawable[0],
        withdrawable[1],
        collectable[0],
        collectable[1]
    );
  }

  private BigInteger[] simulate(String method, String owner, BigInteger tokenId, BigInteger block, String data) {
    try {
      String raw = rpc.call(owner, positionManagerAddress, data, block);
      List<Type> amounts = FunctionReturnDecoder.decode(raw, PositionManagerCalls.amountPairOutputs());
      if (amounts.size() < 2) {
        log.warn("{} simulation returned no amounts tokenId={} block={}", method, tokenId, block);
        return new BigInteger[]{BigInteger.ZERO, BigInteger.ZERO};
      }
      return new BigInteger[]{uint(amounts, 0), uint(amounts, 1)};
    } catch (OnchainCallException e) {
      log.warn("{} simulation failed tokenId={} block={}: {}", method, tokenId, block, e.getMessage());
      return new BigInteger[]{BigInteger.ZERO, BigInteger.ZERO};
    }
  }

  private List<Type> call(String from, Function function, BigInteger block) {
    String raw = rpc.call(from, positionManagerAddress, FunctionEncoder.encode(function), block);
    List<Type> decoded = FunctionReturnDecoder.decode(raw, function.getOutputParameters());
    if (decoded == null || decoded.size() < function.getOutputParameters().size()) {
      throw new OnchainCallException(function.getName() + " on " + positionManagerAddress
          + " returned malformed data at block " + block + ": " + raw);
    }
    return decoded;
  }

  private static BigInteger uint(List<Type> values, int index) {
    return (BigInteger) values.get(index).getValue();
  }
}
