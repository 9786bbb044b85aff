package com.ytarchive;

/**
 * Receives a progress update after every processed chunk and on every status change.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(Job job, JobProgress progress);
}
