package com.lphedge.uniswap;

import java.math.BigInteger;

/**
 * The two JSON-RPC methods the position reader needs.
 */
public interface EthCallClient {

  BigInteger blockNumber();

  /**
   * {@code eth_call} against {@code to} at {@code blockNumber}; returns the hex-encoded return data.
   *
   * @throws OnchainCallException when the node reports an error or the call reverts
   */
  String call(String from, String to, String data, BigInteger blockNumber);
}
