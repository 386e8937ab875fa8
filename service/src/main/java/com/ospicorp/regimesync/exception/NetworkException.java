package com.ospicorp.regimesync.exception;

/**
 * Transport failure, timeout or non-2xx answer from the monitoring API.
 */
public class NetworkException extends RegimeSyncException {
  private final String operation;
  private final Integer status;

  public NetworkException(String operation, Integer status, String message, Throwable cause) {
    super(operation + " failed: " + message, cause);
    this.operation = operation;
    this.status = status;
  }

  public String operation() {
    return operation;
  }

  /** HTTP status code, or {@code null} when no response was received. */
  public Integer status() {
    return status;
  }
}
