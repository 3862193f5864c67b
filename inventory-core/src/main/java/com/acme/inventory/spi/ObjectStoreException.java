package com.acme.inventory.spi;

/** Storage failure other than a missing key. */
public class ObjectStoreException extends RuntimeException {
  private final String key;

  public ObjectStoreException(String key, String message, Throwable cause) {
    super(message + " (key: " + key + ")", cause);
    this.key = key;
  }

  public String getKey() {
    return key;
  }
}
