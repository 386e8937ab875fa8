package com.ospicorp.regimesync.exception;

public class RunInProgressException extends RegimeSyncException {

  public RunInProgressException(String runId) {
    super("Run " + runId + " is still in progress");
  }
}
