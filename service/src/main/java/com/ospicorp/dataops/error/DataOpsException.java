package com.ospicorp.dataops.error;

public abstract class DataOpsException extends RuntimeException {
  private final String errorCode;
  private final String moreInfo;

  protected DataOpsException(String message, String errorCode, String moreInfo) {
    super(message);
    this.errorCode = errorCode;
    this.moreInfo = moreInfo;
  }

  public String errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return moreInfo;
  }
}
