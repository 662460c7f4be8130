package com.lineguard.common;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Runs independent per-item work concurrently and returns results in input order.
 * A failing item is turned into a result by onFailure and never affects its neighbours.
 */
public final class OrderedBatch {

    private OrderedBatch() {
    }

    /**
     * @throws BatchCancelledException if the calling thread is interrupted while waiting; items that have not
     *                                 started yet are cancelled, items already running finish on their own
     */
    public static <T, R> List<R> mapInOrder(List<T> inputs,
                                            Function<T, R> work,
                                            BiFunction<T, Throwable, R> onFailure,
                                            Executor executor) {
        List<CompletableFuture<R>> submitted = new ArrayList<>(inputs.size());
        List<CompletableFuture<R>> guarded = new ArrayList<>(inputs.size());
        for (T input : inputs) {
            CompletableFuture<R> future = CompletableFuture.supplyAsync(() -> work.apply(input), executor);
            submitted.add(future);
            guarded.add(future.exceptionally(ex -> onFailure.apply(input, unwrap(ex))));
        }
        List<R> results = new ArrayList<>(inputs.size());
        try {
            for (CompletableFuture<R> future : guarded) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            submitted.forEach(f -> f.cancel(false));
            Thread.currentThread().interrupt();
            throw new BatchCancelledException(results.size(), inputs.size(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Batch item failed", cause);
        }
        return results;
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Raised when the caller stops waiting for a batch.
     */
    public static class BatchCancelledException extends CancellationException {

        public BatchCancelledException(int completed, int total, InterruptedException cause) {
            super("Batch cancelled after " + completed + " of " + total + " items");
            initCause(cause);
        }
    }
}
