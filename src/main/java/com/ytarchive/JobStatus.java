package com.ytarchive;

/**
 * Job lifecycle. COMPLETED, FAILED and CANCELLED are absorbing.
 */
public enum JobStatus {
    CREATED,
    QUEUED,
    RUNNING,
    RETRYING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(JobStatus target) {
        if (target == null || isTerminal()) {
            return false;
        }
        if (target == CANCELLED) {
            return true;
        }
        return switch (this) {
            case CREATED -> target == QUEUED;
            case QUEUED -> target == RUNNING;
            case RUNNING -> target == RETRYING || target == COMPLETED || target == FAILED;
            case RETRYING -> target == RUNNING;
            default -> false;
        };
    }
}
