package com.lphedge.hedge.error;

import java.util.Objects;

/**
 * Base type for every failure that aborts a hedge cycle.
 * <p>
 * A cycle either produces a complete snapshot and decision or throws one of these; nothing is retried
 * or recovered inside the engine.
 */
public abstract class HedgeException extends RuntimeException {

  private final ErrorKind kind;

  protected HedgeException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  protected HedgeException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind kind() {
    return kind;
  }
}
