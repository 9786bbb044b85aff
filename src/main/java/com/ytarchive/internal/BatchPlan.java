package com.ytarchive.internal;

import com.ytarchive.JobOptions;
import com.ytarchive.config.YtArchiveProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * How a batch of items is cut into chunks and how many items of a chunk run at once.
 */
public record BatchPlan(int concurrency, int chunkSize) {

    public BatchPlan {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be >= 1");
        }
    }

    public static BatchPlan forItems(int itemCount, JobOptions options, YtArchiveProperties.Batch batch) {
        int concurrency;
        if (options != null && options.getMaxConcurrent() != null) {
            concurrency = options.getMaxConcurrent();
        } else {
            concurrency = itemCount > batch.getLargeBatchThreshold()
                    ? batch.getLargeBatchConcurrency()
                    : batch.getDefaultConcurrency();
        }
        concurrency = Math.max(1, Math.min(concurrency, batch.getMaxConcurrency()));

        int chunkSize;
        if (options != null && options.getChunkSize() != null) {
            chunkSize = options.getChunkSize();
        } else {
            int divisor = Math.max(1, batch.getChunkDivisor());
            int proportional = (itemCount + divisor - 1) / divisor;
            chunkSize = Math.max(batch.getMinChunkSize(), Math.min(proportional, batch.getMaxChunkSize()));
        }
        return new BatchPlan(concurrency, Math.max(1, chunkSize));
    }

    public <T> List<List<T>> chunks(List<T> items) {
        List<List<T>> chunks = new ArrayList<>();
        for (int start = 0; start < items.size(); start += chunkSize) {
            chunks.add(List.copyOf(items.subList(start, Math.min(items.size(), start + chunkSize))));
        }
        return chunks;
    }
}
