package com.acme.inventory.resilience;

import com.acme.inventory.core.ErrorClassifier;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Hands out one shared breaker per operation name. Settings are resolved on first use from the
 * supplied lookup, so every thread asking for {@code "iam-detail"} gets the same instance.
 */
public class CircuitBreakerRegistry {
    private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Function<String, CircuitBreakerSettings> settingsLookup;
    private final ErrorClassifier classifier;
    private final Clock clock;

    public CircuitBreakerRegistry(Function<String, CircuitBreakerSettings> settingsLookup, ErrorClassifier classifier) {
        this(settingsLookup, classifier, Clock.systemUTC());
    }

    public CircuitBreakerRegistry(
            Function<String, CircuitBreakerSettings> settingsLookup, ErrorClassifier classifier, Clock clock) {
        this.settingsLookup = settingsLookup;
        this.classifier = classifier;
        this.clock = clock;
    }

    public CircuitBreaker get(String name) {
        return breakers.computeIfAbsent(name, n -> new CircuitBreaker(n, settingsLookup.apply(n), classifier, clock));
    }

    public ErrorClassifier classifier() {
        return classifier;
    }

    /** Snapshots of every breaker created so far, sorted by name. */
    public Map<String, CircuitSnapshot> snapshots() {
        Map<String, CircuitSnapshot> sorted = new TreeMap<>();
        breakers.forEach((name, breaker) -> sorted.put(name, breaker.snapshot()));
        return new LinkedHashMap<>(sorted);
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }
}
