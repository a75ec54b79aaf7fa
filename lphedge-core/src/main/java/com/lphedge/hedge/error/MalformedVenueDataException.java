package com.lphedge.hedge.error;

public final class MalformedVenueDataException extends HedgeException {

  private final String field;
  private final String rawValue;

  public MalformedVenueDataException(String field, String rawValue, Throwable cause) {
    super(ErrorKind.MALFORMED_DATA, "Failed to parse " + field + " from venue value '" + rawValue + "'", cause);
    this.field = field;
    this.rawValue = rawValue;
  }

  public String field() {
    return field;
  }

  public String rawValue() {
    return rawValue;
  }
}
