package com.lphedge.uniswap;

import lombok.NonNull;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.Utils;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Int24;
import org.web3j.abi.datatypes.generated.Uint128;
import org.web3j.abi.datatypes.generated.Uint24;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint96;
import org.web3j.crypto.Hash;

import java.math.BigInteger;
import java.util.List;

/**
 * Calldata for the NonfungiblePositionManager views and the two state-changing calls that are only
 * ever simulated with {@code eth_call}.
 */
final class PositionManagerCalls {

  static final BigInteger UINT64_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);
  static final BigInteger UINT128_MAX = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

  static final String DECREASE_LIQUIDITY_SIGNATURE = "decreaseLiquidity((uint256,uint128,uint256,uint256,uint256))";
  static final String COLLECT_SIGNATURE = "collect((uint256,address,uint128,uint128))";

  private PositionManagerCalls() {
  }

  static Function balanceOf(@NonNull String owner) {
    return new Function(
        "balanceOf",
        List.of(new Address(owner)),
        List.of(new TypeReference<Uint256>() {
        })
    );
  }

  static Function tokenOfOwnerByIndex(@NonNull String owner, long index) {
    return new Function(
        "tokenOfOwnerByIndex",
        List.of(new Address(owner), new Uint256(BigInteger.valueOf(index))),
        List.of(new TypeReference<Uint256>() {
        })
    );
  }

  static Function positions(@NonNull BigInteger tokenId) {
    return new Function(
        "positions",
        List.of(new Uint256(tokenId)),
        List.of(
            new TypeReference<Uint96>() {
            },
            new TypeReference<Address>() {
            },
            new TypeReference<Address>() {
            },
            new TypeReference<Address>() {
            },
            new TypeReference<Uint24>() {
            },
            new TypeReference<Int24>() {
            },
            new TypeReference<Int24>() {
            },
            new TypeReference<Uint128>() {
            },
            new TypeReference<Uint256>() {
            },
            new TypeReference<Uint256>() {
            },
            new TypeReference<Uint128>() {
            },
            new TypeReference<Uint128>() {
            }
        )
    );
  }

  /**
   * Output layout shared by {@code decreaseLiquidity} and {@code collect}: {@code (uint256 amount0, uint256 amount1)}.
   */
  static List<TypeReference<Type>> amountPairOutputs() {
    return Utils.convert(List.of(
        new TypeReference<Uint256>() {
        },
        new TypeReference<Uint256>() {
        }
    ));
  }

  /**
   * {@code decreaseLiquidity} removing all {@code liquidity}, no slippage floor and a deadline that
   * never passes.
   */
  static String encodeDecreaseAllLiquidity(@NonNull BigInteger tokenId, @NonNull BigInteger liquidity) {
    // the params struct is static, so its ABI encoding is the flat encoding of its members
    return methodId(DECREASE_LIQUIDITY_SIGNATURE) + FunctionEncoder.encodeConstructor(List.of(
        new Uint256(tokenId),
        new Uint128(liquidity),
        new Uint256(BigInteger.ZERO),
        new Uint256(BigInteger.ZERO),
        new Uint256(UINT64_MAX)
    ));
  }

  /**
   * {@code collect} of every owed token to {@code recipient}.
   */
  static String encodeCollectAll(@NonNull BigInteger tokenId, @NonNull String recipient) {
    return methodId(COLLECT_SIGNATURE) + FunctionEncoder.encodeConstructor(List.of(
        new Uint256(tokenId),
        new Address(recipient),
        new Uint128(UINT128_MAX),
        new Uint128(UINT128_MAX)
    ));
  }

  /**
   * {@code 0x}-prefixed 4-byte selector of a canonical function signature.
   */
  static String methodId(@NonNull String signature) {
    return Hash.sha3String(signature).substring(0, 10);
  }
}
