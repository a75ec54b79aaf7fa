package com.lphedge.hedge.error;

public final class PositionNotFoundException extends HedgeException {

  public PositionNotFoundException(String message) {
    super(ErrorKind.NOT_FOUND, message);
  }
}
