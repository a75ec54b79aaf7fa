package com.lphedge.uniswap;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.core.methods.response.EthCall;

import java.io.IOException;
import java.math.BigInteger;

@RequiredArgsConstructor
public final class Web3jEthCallClient implements EthCallClient {

  private final @NonNull Web3j web3j;

  @Override
  public BigInteger blockNumber() {
    EthBlockNumber response;
    try {
      response = web3j.ethBlockNumber().send();
    } catch (IOException e) {
      throw new OnchainCallException("eth_blockNumber failed", e);
    }
    if (response.hasError()) {
      throw new OnchainCallException("eth_blockNumber error: " + response.getError().getMessage());
    }
    return response.getBlockNumber();
  }

  @Override
  public String call(String from, String to, String data, BigInteger blockNumber) {
    Transaction tx = Transaction.createEthCallTransaction(from, to, data);
    EthCall response;
    try {
      response = web3j.ethCall(tx, DefaultBlockParameter.valueOf(blockNumber)).send();
    } catch (IOException e) {
      throw new OnchainCallException("eth_call to " + to + " failed", e);
    }
    if (response.hasError()) {
      throw new OnchainCallException("eth_call to " + to + " error: " + response.getError().getMessage());
    }
    if (response.isReverted()) {
      throw new OnchainCallException("eth_call to " + to + " reverted: " + response.getRevertReason());
    }
    return response.getValue();
  }
}
