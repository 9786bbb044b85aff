package com.ytarchive.recovery;

/**
 * Result cause when a circuit breaker refused an attempt without invoking the operation.
 */
public class CircuitOpenException extends RuntimeException {

    private final String resourceKey;

    public CircuitOpenException(String resourceKey) {
        super("Circuit open for " + resourceKey);
        this.resourceKey = resourceKey;
    }

    public String getResourceKey() {
        return resourceKey;
    }
}
