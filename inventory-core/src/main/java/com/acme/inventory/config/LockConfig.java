package com.acme.inventory.config;

import java.time.Duration;

/**
 * Settings for the object-store lock guarding shared report objects. Pure POJO - no framework
 * dependencies.
 */
public class LockConfig {

  private Duration timeout = Duration.ofSeconds(60);
  private int maxAttempts = 5;
  private double baseBackoffSeconds = 2.0;
  private double jitterFactor = 1.0; // upper bound of the uniform jitter, in seconds
  private boolean requireConditionalWrite = false;

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    this.timeout = timeout;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(int maxAttempts) {
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
    }
    this.maxAttempts = maxAttempts;
  }

  public double getBaseBackoffSeconds() {
    return baseBackoffSeconds;
  }

  public void setBaseBackoffSeconds(double baseBackoffSeconds) {
    if (baseBackoffSeconds < 0) {
      throw new IllegalArgumentException("baseBackoffSeconds cannot be negative");
    }
    this.baseBackoffSeconds = baseBackoffSeconds;
  }

  public double getJitterFactor() {
    return jitterFactor;
  }

  public void setJitterFactor(double jitterFactor) {
    if (jitterFactor < 0) {
      throw new IllegalArgumentException("jitterFactor cannot be negative");
    }
    this.jitterFactor = jitterFactor;
  }

  public boolean isRequireConditionalWrite() {
    return requireConditionalWrite;
  }

  public void setRequireConditionalWrite(boolean requireConditionalWrite) {
    this.requireConditionalWrite = requireConditionalWrite;
  }

  @Override
  public String toString() {
    return "LockConfig{timeout="
        + timeout
        + ", maxAttempts="
        + maxAttempts
        + ", baseBackoffSeconds="
        + baseBackoffSeconds
        + ", jitterFactor="
        + jitterFactor
        + ", requireConditionalWrite="
        + requireConditionalWrite
        + '}';
  }
}
