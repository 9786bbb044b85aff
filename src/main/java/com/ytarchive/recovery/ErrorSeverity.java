package com.ytarchive.recovery;

public enum ErrorSeverity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    INFO
}
