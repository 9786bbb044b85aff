package com.ytarchive.internal;

import com.ytarchive.recovery.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Runs a batch chunk by chunk on a shared worker pool. Inside a chunk at most
 * {@link BatchPlan#concurrency()} items run at once and the whole chunk finishes before the next
 * one is dispatched.
 */
public class BatchExecutor {

    private static final Logger log = LoggerFactory.getLogger(BatchExecutor.class);

    private static final long PERMIT_POLL_MILLIS = 100;

    private final ExecutorService workerPool;

    public BatchExecutor(ExecutorService workerPool) {
        this.workerPool = Objects.requireNonNull(workerPool, "workerPool");
    }

    /**
     * @param task runs one item; a {@code null} result drops the item (it was cancelled)
     * @param onFailure turns an exception escaping {@code task} into a result
     * @param onChunk receives the results of every finished chunk, in item order
     */
    public <T, R> BatchOutcome<R> execute(List<T> items, BatchPlan plan, Function<T, R> task,
            BiFunction<T, Throwable, R> onFailure, Consumer<List<R>> onChunk, CancellationToken cancellation) {
        List<R> results = new ArrayList<>();
        Semaphore permits = new Semaphore(plan.concurrency());
        List<Future<R>> inFlight = new CopyOnWriteArrayList<>();
        cancellation.onCancel(() -> {
            for (Future<R> future : inFlight) {
                future.cancel(true);
            }
        });

        List<List<T>> chunks = plan.chunks(items);
        for (int chunkIndex = 0; chunkIndex < chunks.size(); chunkIndex++) {
            if (cancellation.isCancelled()) {
                break;
            }
            List<T> chunk = chunks.get(chunkIndex);
            log.debug("Dispatching chunk {}/{} ({} items, concurrency {})", chunkIndex + 1, chunks.size(),
                    chunk.size(), plan.concurrency());

            List<Future<R>> futures = new ArrayList<>();
            for (T item : chunk) {
                if (!acquire(permits, cancellation)) {
                    break;
                }
                Future<R> future = submit(item, task, permits);
                if (future == null) {
                    futures.add(null);
                    continue;
                }
                futures.add(future);
                inFlight.add(future);
                if (cancellation.isCancelled()) {
                    future.cancel(true);
                }
            }

            List<R> chunkResults = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                T item = chunk.get(i);
                Future<R> future = futures.get(i);
                R result = future == null
                        ? onFailure.apply(item, new RejectedExecutionException("Worker pool rejected item"))
                        : await(item, future, onFailure, cancellation);
                if (result != null) {
                    chunkResults.add(result);
                }
            }
            inFlight.removeAll(futures);
            results.addAll(chunkResults);

            try {
                onChunk.accept(List.copyOf(chunkResults));
            } catch (RuntimeException e) {
                log.warn("Chunk callback failed after chunk {}/{}", chunkIndex + 1, chunks.size(), e);
            }
        }
        return new BatchOutcome<>(List.copyOf(results), cancellation.isCancelled());
    }

    private <T, R> Future<R> submit(T item, Function<T, R> task, Semaphore permits) {
        try {
            return workerPool.submit(() -> {
                try {
                    return task.apply(item);
                } finally {
                    permits.release();
                }
            });
        } catch (RejectedExecutionException e) {
            permits.release();
            log.warn("Worker pool rejected item {}", item);
            return null;
        }
    }

    private <T, R> R await(T item, Future<R> future, BiFunction<T, Throwable, R> onFailure,
            CancellationToken cancellation) {
        try {
            return future.get();
        } catch (CancellationException e) {
            return null;
        } catch (ExecutionException e) {
            log.error("Item {} failed unexpectedly", item, e.getCause());
            return onFailure.apply(item, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel();
            future.cancel(true);
            return null;
        }
    }

    private static boolean acquire(Semaphore permits, CancellationToken cancellation) {
        try {
            while (!cancellation.isCancelled()) {
                if (permits.tryAcquire(PERMIT_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel();
            return false;
        }
    }

    public record BatchOutcome<R>(List<R> results, boolean cancelled) {
    }
}
