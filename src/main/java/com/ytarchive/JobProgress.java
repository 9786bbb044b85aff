package com.ytarchive;

/**
 * Progress of a job, refreshed once per processed chunk.
 */
public record JobProgress(int total, int succeeded, int failed, int skipped) {

    public static JobProgress of(int total) {
        return new JobProgress(total, 0, 0, 0);
    }

    public int processed() {
        return succeeded + failed + skipped;
    }

    public double percent() {
        return total == 0 ? 100.0 : processed() * 100.0 / total;
    }
}
