package com.lphedge.uniswap;

import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Int24;
import org.web3j.abi.datatypes.generated.Uint128;
import org.web3j.abi.datatypes.generated.Uint24;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint96;
import org.web3j.crypto.Hash;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory position manager answering the calls {@link UniswapV3PositionReader} makes.
 */
final class FakeEthCallClient implements EthCallClient {

  private static final String BALANCE_OF = selector("balanceOf(address)");
  private static final String TOKEN_OF_OWNER_BY_INDEX = selector("tokenOfOwnerByIndex(address,uint256)");
  private static final String POSITIONS = selector("positions(uint256)");
  private static final String DECREASE_LIQUIDITY = selector(PositionManagerCalls.DECREASE_LIQUIDITY_SIGNATURE);
  private static final String COLLECT = selector(PositionManagerCalls.COLLECT_SIGNATURE);

  record Position(String token0, String token1, BigInteger liquidity, BigInteger withdrawable0,
                  BigInteger withdrawable1, BigInteger collectable0, BigInteger collectable1) {
  }

  private final Map<BigInteger, Position> positions = new LinkedHashMap<>();
  final Set<BigInteger> revertingCollects = new HashSet<>();
  final List<BigInteger> blocksSeen = new ArrayList<>();
  final List<String> fromSeen = new ArrayList<>();
  int decreaseCalls;
  BigInteger head = BigInteger.valueOf(123);

  void add(long tokenId, Position position) {
    positions.put(BigInteger.valueOf(tokenId), position);
  }

  @Override
  public BigInteger blockNumber() {
    return head;
  }

  @Override
  public String call(String from, String to, String data, BigInteger blockNumber) {
    blocksSeen.add(blockNumber);
    fromSeen.add(from);
    String selector = data.substring(0, 10);
    String args = data.substring(10);

    if (selector.equals(BALANCE_OF)) {
      return encode(new Uint256(positions.size()));
    }
    if (selector.equals(TOKEN_OF_OWNER_BY_INDEX)) {
      int index = word(args, 1).intValueExact();
      return encode(new Uint256(new ArrayList<>(positions.keySet()).get(index)));
    }
    if (selector.equals(POSITIONS)) {
      Position p = positions.get(word(args, 0));
      return encode(
          new Uint96(BigInteger.ZERO),
          new Address("0x0000000000000000000000000000000000000000"),
          new Address(p.token0()),
          new Address(p.token1()),
          new Uint24(BigInteger.valueOf(500)),
          new Int24(BigInteger.valueOf(-887_220)),
          new Int24(BigInteger.valueOf(887_220)),
          new Uint128(p.liquidity()),
          new Uint256(BigInteger.ZERO),
          new Uint256(BigInteger.ZERO),
          new Uint128(BigInteger.ZERO),
          new Uint128(BigInteger.ZERO)
      );
    }
    if (selector.equals(DECREASE_LIQUIDITY)) {
      decreaseCalls++;
      Position p = positions.get(word(args, 0));
      return encode(new Uint256(p.withdrawable0()), new Uint256(p.withdrawable1()));
    }
    if (selector.equals(COLLECT)) {
      BigInteger tokenId = word(args, 0);
      if (revertingCollects.contains(tokenId)) {
        throw new OnchainCallException("eth_call to " + to + " reverted: Not approved");
      }
      Position p = positions.get(tokenId);
      return encode(new Uint256(p.collectable0()), new Uint256(p.collectable1()));
    }
    throw new IllegalArgumentException("unexpected call " + selector);
  }

  @SuppressWarnings("rawtypes")
  private static String encode(Type... values) {
    return "0x" + FunctionEncoder.encodeConstructor(Arrays.asList(values));
  }

  private static String selector(String signature) {
    return Hash.sha3String(signature).substring(0, 10);
  }

  private static BigInteger word(String args, int index) {
    return new BigInteger(args.substring(index * 64, (index + 1) * 64), 16);
  }
}
