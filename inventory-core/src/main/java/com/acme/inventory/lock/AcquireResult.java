package com.acme.inventory.lock;

public record AcquireResult(boolean acquired, String lockId) {

  private static final AcquireResult NOT_ACQUIRED = new AcquireResult(false, null);

  public static AcquireResult acquired(String lockId) {
    return new AcquireResult(true, lockId);
  }

  public static AcquireResult notAcquired() {
    return NOT_ACQUIRED;
  }
}
