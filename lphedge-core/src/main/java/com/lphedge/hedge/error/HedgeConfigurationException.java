package com.lphedge.hedge.error;

public final class HedgeConfigurationException extends HedgeException {

  public HedgeConfigurationException(String message) {
    super(ErrorKind.CONFIGURATION, message);
  }
}
