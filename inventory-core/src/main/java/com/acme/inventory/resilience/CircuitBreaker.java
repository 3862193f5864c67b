package com.acme.inventory.resilience;

import com.acme.inventory.core.ErrorClassifier;
import com.acme.inventory.core.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-operation circuit breaker, shared by every worker thread that calls the same named operation.
 *
 * <p>All state lives behind one lock per instance. The OPEN to HALF_OPEN transition happens as a
 * side effect of {@link #allowRequest()}; there is no timer thread. Only failures classified as
 * {@link ErrorKind#TRANSIENT} count toward opening the circuit; anything else is remembered for
 * observability and leaves the state alone.
 *
 * <p>HALF_OPEN admits one trial call. Until that call records an outcome, further requests are
 * refused.
 */
public class CircuitBreaker {
    private static final Logger LOG = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final CircuitBreakerSettings settings;
    private final ErrorClassifier classifier;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailureTime;
    private Instant lastSuccessTime;
    private boolean trialInFlight;
    private ErrorKind lastErrorKind;

    public CircuitBreaker(String name, CircuitBreakerSettings settings, ErrorClassifier classifier) {
        this(name, settings, classifier, Clock.systemUTC());
    }

    public CircuitBreaker(String name, CircuitBreakerSettings settings, ErrorClassifier classifier, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.name = name;
        this.settings = settings;
        this.classifier = classifier;
        this.clock = clock;
        this.lastSuccessTime = clock.instant();
        LOG.info("Circuit breaker {} initialized in {} state ({})", name, state, settings);
    }

    public String getName() {
        return name;
    }

    /**
     * Decides whether a call may proceed. May clear a stale failure count while CLOSED, and flips
     * OPEN to HALF_OPEN once the recovery timeout has elapsed, admitting the calling request as the
     * trial.
     */
    public boolean allowRequest() {
        lock.lock();
        try {
            Instant now = clock.instant();

            if (state == CircuitState.CLOSED
                    && failureCount > 0
                    && elapsedSince(lastFailureTime, now).compareTo(settings.getResetTimeout()) >= 0) {
                failureCount = 0;
                LOG.debug("Circuit {}: reset failure count after {} with no failures", name, settings.getResetTimeout());
            }

            switch (state) {
                case OPEN:
                    if (elapsedSince(lastFailureTime, now).compareTo(settings.getRecoveryTimeout()) >= 0) {
                        LOG.info("Circuit {}: transitioning from OPEN to HALF_OPEN", name);
                        state = CircuitState.HALF_OPEN;
                        trialInFlight = true;
                        return true;
                    }
                    return false;
                case HALF_OPEN:
                    if (trialInFlight) {
                        return false;
                    }
                    trialInFlight = true;
                    return true;
                default:
                    return true;
            }
        } finally {
            lock.unlock();
        }
    }

    public CircuitState recordSuccess() {
        lock.lock();
        try {
            lastSuccessTime = clock.instant();
            if (state == CircuitState.HALF_OPEN) {
                LOG.info("Circuit {}: success in HALF_OPEN state, closing circuit", name);
                state = CircuitState.CLOSED;
                failureCount = 0;
                trialInFlight = false;
            }
            return state;
        } finally {
            lock.unlock();
        }
    }

    public CircuitState recordFailure(Throwable error) {
        ErrorKind kind = classifier.classify(error);
        lock.lock();
        try {
            lastErrorKind = kind;
            if (!kind.countsTowardCircuit()) {
                LOG.debug("Circuit {}: {} failure ({}) does not count toward the circuit",
                        name, kind, classifier.errorCode(error));
                if (state == CircuitState.HALF_OPEN) {
                    // the trial did not prove anything either way; let the next caller probe
                    trialInFlight = false;
                }
                return state;
            }

            lastFailureTime = clock.instant();
            failureCount++;

            if (state == CircuitState.CLOSED && failureCount >= settings.getFailureThreshold()) {
                LOG.warn("Circuit {}: threshold reached ({} failures), opening circuit", name, failureCount);
                state = CircuitState.OPEN;
            } else if (state == CircuitState.HALF_OPEN) {
                LOG.warn("Circuit {}: failed in HALF_OPEN state, reopening circuit", name);
                state = CircuitState.OPEN;
                trialInFlight = false;
            }
            return state;
        } finally {
            lock.unlock();
        }
    }

    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public int getFailureCount() {
        lock.lock();
        try {
            return failureCount;
        } finally {
            lock.unlock();
        }
    }

    /** Kind of the most recent recorded failure, counted or not; null before any failure. */
    public ErrorKind getLastErrorKind() {
        lock.lock();
        try {
            return lastErrorKind;
        } finally {
            lock.unlock();
        }
    }

    public CircuitSnapshot snapshot() {
        lock.lock();
        try {
            return new CircuitSnapshot(name, state, failureCount, lastFailureTime, lastSuccessTime);
        } finally {
            lock.unlock();
        }
    }

    /** Forces CLOSED and clears counters. Meant for manual recovery and tests. */
    public CircuitState reset() {
        lock.lock();
        try {
            state = CircuitState.CLOSED;
            failureCount = 0;
            lastFailureTime = null;
            lastSuccessTime = clock.instant();
            trialInFlight = false;
            lastErrorKind = null;
            LOG.info("Circuit {}: manually reset to {}", name, state);
            return state;
        } finally {
            lock.unlock();
        }
    }

    private static Duration elapsedSince(Instant since, Instant now) {
        if (since == null) {
            return Duration.ofSeconds(Long.MAX_VALUE);
        }
        return Duration.between(since, now);
    }
}
