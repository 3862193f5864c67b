package com.acme.inventory.resilience;

import java.time.Duration;

/** Thresholds for one breaker. Pure POJO, populated from configuration. */
public class CircuitBreakerSettings {

    private int failureThreshold = 5;
    private Duration recoveryTimeout = Duration.ofSeconds(30);
    private Duration resetTimeout = Duration.ofSeconds(60);

    public CircuitBreakerSettings() {}

    public CircuitBreakerSettings(int failureThreshold, Duration recoveryTimeout, Duration resetTimeout) {
        setFailureThreshold(failureThreshold);
        setRecoveryTimeout(recoveryTimeout);
        setResetTimeout(resetTimeout);
    }

    public static CircuitBreakerSettings of(int failureThreshold, Duration recoveryTimeout) {
        return new CircuitBreakerSettings(failureThreshold, recoveryTimeout, Duration.ofSeconds(60));
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive (current: " + failureThreshold + ")");
        }
        this.failureThreshold = failureThreshold;
    }

    public Duration getRecoveryTimeout() {
        return recoveryTimeout;
    }

    public void setRecoveryTimeout(Duration recoveryTimeout) {
        if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("recoveryTimeout must be zero or positive");
        }
        this.recoveryTimeout = recoveryTimeout;
    }

    public Duration getResetTimeout() {
        return resetTimeout;
    }

    public void setResetTimeout(Duration resetTimeout) {
        if (resetTimeout == null || resetTimeout.isNegative()) {
            throw new IllegalArgumentException("resetTimeout must be zero or positive");
        }
        this.resetTimeout = resetTimeout;
    }

    @Override
    public String toString() {
        return "threshold=" + failureThreshold + ", recovery=" + recoveryTimeout + ", reset=" + resetTimeout;
    }
}
