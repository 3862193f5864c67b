package com.acme.inventory.core;

/** A failure that retrying will not fix: authorization, credentials, validation. */
public class PermanentException extends RuntimeException {
  private final String errorCode;

  public PermanentException(String message) {
    this(null, message, null);
  }

  public PermanentException(String message, Throwable e) {
    this(null, message, e);
  }

  public PermanentException(String errorCode, String message, Throwable e) {
    super(message, e);
    this.errorCode = errorCode;
  }

  public String getErrorCode() {
    return errorCode;
  }
}
