package com.ytarchive;

/**
 * What a failed item means for the job as a whole.
 */
public enum ItemFailurePolicy {

    /**
     * Any failed item fails the job.
     */
    FAIL_JOB,

    /**
     * The job completes with partial results; failed items go to the recovery plan.
     */
    BEST_EFFORT
}
