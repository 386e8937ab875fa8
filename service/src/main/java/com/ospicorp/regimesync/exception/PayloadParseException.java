package com.ospicorp.regimesync.exception;

public class PayloadParseException extends RegimeSyncException {
  private final String rawValue;

  public PayloadParseException(String message, String rawValue) {
    this(message, rawValue, null);
  }

  public PayloadParseException(String message, String rawValue, Throwable cause) {
    super(rawValue == null ? message : message + ": \"" + rawValue + "\"", cause);
    this.rawValue = rawValue;
  }

  public String rawValue() {
    return rawValue;
  }
}
