package com.lphedge.hedge.error;

public enum ErrorKind {
  NOT_FOUND,
  MALFORMED_DATA,
  COLLABORATOR_FAILURE,
  CONFIGURATION,
}
