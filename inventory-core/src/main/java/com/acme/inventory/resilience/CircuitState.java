package com.acme.inventory.resilience;

/**
 * Circuit breaker state.
 *
 * <pre>
 * CLOSED --(transient failures reach threshold)--> OPEN
 * OPEN   --(recovery timeout elapsed, next check)--> HALF_OPEN
 * HALF_OPEN --(success)--> CLOSED
 * HALF_OPEN --(transient failure)--> OPEN
 * </pre>
 */
public enum CircuitState {
    /** Calls pass; transient failures are counted. */
    CLOSED,
    /** Calls are refused until the recovery timeout elapses. */
    OPEN,
    /** A single trial call is admitted to probe whether the remote side recovered. */
    HALF_OPEN
}
