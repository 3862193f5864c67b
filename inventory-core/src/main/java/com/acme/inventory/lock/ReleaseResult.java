package com.acme.inventory.lock;

public enum ReleaseResult {
  RELEASED,
  /** The lock object belongs to another holder and was left in place. */
  NOT_OWNER,
  NO_SUCH_LOCK,
  /** The store failed while reading or deleting the lock. */
  FAILED
}
