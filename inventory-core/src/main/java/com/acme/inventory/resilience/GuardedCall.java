package com.acme.inventory.resilience;

import com.acme.inventory.core.CircuitOpenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * A remote operation bound to the breaker that guards it, with an optional fallback.
 *
 * <p>{@link #execute()} is the only way remote calls are made: when the breaker refuses, the
 * fallback answers (or {@link CircuitOpenException} is thrown); otherwise the operation runs, its
 * outcome is recorded on the breaker, and its result or error reaches the caller unchanged.
 *
 * <pre>{@code
 * AccountSession session = GuardedCall.of(breakers.get("assume-role"),
 *         () -> roleAssumer.assumeRole(accountId, roleName, region))
 *     .execute();
 * }</pre>
 */
public final class GuardedCall<T> {
    private static final Logger LOG = LoggerFactory.getLogger(GuardedCall.class);

    private final CircuitBreaker breaker;
    private final RemoteOperation<T> operation;
    private final Supplier<T> fallback;

    private GuardedCall(CircuitBreaker breaker, RemoteOperation<T> operation, Supplier<T> fallback) {
        if (breaker == null) {
            throw new IllegalArgumentException("breaker cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        this.breaker = breaker;
        this.operation = operation;
        this.fallback = fallback;
    }

    public static <T> GuardedCall<T> of(CircuitBreaker breaker, RemoteOperation<T> operation) {
        return new GuardedCall<>(breaker, operation, null);
    }

    /** Same breaker and operation, answering with {@code fallback} while the circuit refuses calls. */
    public GuardedCall<T> withFallback(Supplier<T> fallback) {
        return new GuardedCall<>(breaker, operation, fallback);
    }

    public String name() {
        return breaker.getName();
    }

    public T execute() throws Exception {
        if (!breaker.allowRequest()) {
            LOG.warn("Circuit {} is {}, fast failing", breaker.getName(), breaker.getState());
            if (fallback != null) {
                return fallback.get();
            }
            throw new CircuitOpenException(breaker.getName());
        }

        T result;
        try {
            result = operation.call();
        } catch (Throwable t) {
            // errors too, or a failed HALF_OPEN trial would never release its slot
            breaker.recordFailure(t);
            throw t;
        }
        breaker.recordSuccess();
        return result;
    }
}
