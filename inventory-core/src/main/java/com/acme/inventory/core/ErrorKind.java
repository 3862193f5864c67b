package com.acme.inventory.core;

/** Closed set of failure categories produced by {@link ErrorClassifier}. */
public enum ErrorKind {
  /** Rate limiting, throttling, service unavailable, connectivity. Counts toward opening a circuit. */
  TRANSIENT,
  /** Authorization, credentials, validation. Surfaced immediately, never opens a circuit. */
  PERMANENT,
  /** Not recognized. Handled like {@link #PERMANENT} unless reclassified. */
  UNKNOWN;

  public boolean countsTowardCircuit() {
    return this == TRANSIENT;
  }
}
