package com.ospicorp.dataops.error;

public class ComputationException extends DataOpsException {

  public ComputationException(String message, String errorCode, String moreInfo) {
    super(message, errorCode, moreInfo);
  }
}
