package com.ospicorp.regimesync.exception;

public class RegimeSyncException extends RuntimeException {

  public RegimeSyncException(String message) {
    super(message);
  }

  public RegimeSyncException(String message, Throwable cause) {
    super(message, cause);
  }
}
