package com.lphedge.uniswap;

public final class OnchainCallException extends RuntimeException {

  public OnchainCallException(String message) {
    super(message);
  }

  public OnchainCallException(String message, Throwable cause) {
    super(message, cause);
  }
}
