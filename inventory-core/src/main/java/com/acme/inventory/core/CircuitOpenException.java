package com.acme.inventory.core;

/** Thrown by a guarded call when its breaker refuses the call and no fallback is configured. */
public class CircuitOpenException extends RuntimeException {
  public static final String ERROR_CODE = "CircuitOpen";

  private final String circuitName;

  public CircuitOpenException(String circuitName) {
    super("Circuit '" + circuitName + "' is OPEN");
    this.circuitName = circuitName;
  }

  public String getCircuitName() {
    return circuitName;
  }
}
