package com.ytarchive.recovery.strategy;

public enum StrategyType {
    FIXED_DELAY,
    EXPONENTIAL_BACKOFF,
    CIRCUIT_BREAKER,
    ADAPTIVE
}
