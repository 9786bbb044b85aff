package com.ytarchive.recovery.strategy;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Adaptive metrics per resource key. One registry belongs to one recovery manager.
 */
public class AdaptiveMetricsRegistry {

    private final Map<String, AdaptiveMetrics> metrics = new ConcurrentHashMap<>();

    public AdaptiveMetrics metricsFor(String resourceKey, int windowSize) {
        return metrics.computeIfAbsent(resourceKey, key -> new AdaptiveMetrics(windowSize));
    }

    public AdaptiveMetrics find(String resourceKey) {
        return metrics.get(resourceKey);
    }
}
