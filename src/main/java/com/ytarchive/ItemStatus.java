package com.ytarchive;

public enum ItemStatus {
    SUCCESS,
    FAILED,
    SKIPPED
}
