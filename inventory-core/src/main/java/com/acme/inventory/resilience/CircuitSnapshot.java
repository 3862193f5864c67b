package com.acme.inventory.resilience;

import java.time.Instant;

/** Point-in-time copy of a breaker, safe to report after the run. */
public record CircuitSnapshot(
        String name, CircuitState state, int failureCount, Instant lastFailureTime, Instant lastSuccessTime) {}
