package com.acme.inventory.core;

/** A failure expected to clear on its own: throttling, unavailability, broken connections. */
public class TransientException extends RuntimeException {
  private final String errorCode;

  public TransientException(String message) {
    this(null, message, null);
  }

  public TransientException(String message, Throwable e) {
    this(null, message, e);
  }

  public TransientException(String errorCode, String message, Throwable e) {
    super(message, e);
    this.errorCode = errorCode;
  }

  public String getErrorCode() {
    return errorCode;
  }
}
