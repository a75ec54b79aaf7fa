package com.lphedge.hedge.error;

/**
 * Wraps a failure raised by an external collaborator (RPC node, exchange API, chat API).
 * The original exception is kept as the cause, untouched.
 */
public class CollaboratorFailureException extends HedgeException {

  private final String collaborator;

  public CollaboratorFailureException(String collaborator, Throwable cause) {
    super(ErrorKind.COLLABORATOR_FAILURE, collaborator + " failed: " + cause, cause);
    this.collaborator = collaborator;
  }

  public String collaborator() {
    return collaborator;
  }
}
