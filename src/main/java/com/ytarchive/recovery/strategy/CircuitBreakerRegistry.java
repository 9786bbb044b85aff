package com.ytarchive.recovery.strategy;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Circuit breaker state per resource key. One registry belongs to one recovery manager.
 */
public class CircuitBreakerRegistry {

    private final Map<String, CircuitBreakerState> states = new ConcurrentHashMap<>();

    /**
     * Returns the state for the key, creating it with the given limits on first use. Limits of an
     * existing state are not changed.
     */
    public CircuitBreakerState stateFor(String resourceKey, int failureThreshold, Duration resetTimeout) {
        return states.computeIfAbsent(resourceKey,
                key -> new CircuitBreakerState(key, failureThreshold, resetTimeout));
    }

    public CircuitBreakerState find(String resourceKey) {
        return states.get(resourceKey);
    }

    public List<CircuitBreakerState.Snapshot> snapshots() {
        return states.values().stream().map(CircuitBreakerState::snapshot).toList();
    }
}
