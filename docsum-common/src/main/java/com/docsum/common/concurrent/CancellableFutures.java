package com.docsum.common.concurrent;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Bridges {@link ExecutorService} tasks to {@link CompletableFuture}.
 *
 * <p>{@code CompletableFuture.supplyAsync} cannot interrupt a task that is already running.
 * Futures returned here do: cancelling them cancels the underlying executor task with
 * {@code mayInterruptIfRunning = true}, so a worker blocked on a rate limiter or an HTTP call
 * is woken up and abandons the work.
 */
public final class CancellableFutures {

    private CancellableFutures() {}

    public static <T> CompletableFuture<T> submit(ExecutorService executor, Callable<T> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        Future<?> submitted;
        try {
            submitted = executor.submit(() -> {
                if (result.isDone()) {
                    return;
                }
                try {
                    result.complete(task.call());
                } catch (Throwable e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
            return result;
        }

        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                submitted.cancel(true);
            }
        });
        return result;
    }
}
