package com.docsum.core.summary;

import com.docsum.llm.exception.GenerationException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Fan-in for parallel generation calls: all-or-nothing, index-ordered.
 */
final class OrderedFanOut {

    private OrderedFanOut() {}

    /**
     * Waits until every future succeeds and returns their values in list order. The first
     * failure is rethrown as soon as it happens and the remaining futures are cancelled.
     */
    static List<String> awaitAll(List<CompletableFuture<String>> calls) throws InterruptedException {
        CompletableFuture<Void> allDone = CompletableFuture.allOf(calls.toArray(new CompletableFuture[0]));
        CompletableFuture<Void> firstFailure = new CompletableFuture<>();
        for (CompletableFuture<String> call : calls) {
            call.whenComplete((value, error) -> {
                if (error != null) {
                    firstFailure.completeExceptionally(error);
                }
            });
        }

        try {
            CompletableFuture.anyOf(allDone, firstFailure).get();
        } catch (ExecutionException e) {
            cancelAll(calls);
            throw asGenerationException(e.getCause());
        } catch (InterruptedException e) {
            cancelAll(calls);
            throw e;
        }

        List<String> results = new ArrayList<>(calls.size());
        for (CompletableFuture<String> call : calls) {
            results.add(call.join());
        }
        return results;
    }

    private static void cancelAll(List<CompletableFuture<String>> calls) {
        for (CompletableFuture<String> call : calls) {
            call.cancel(true);
        }
    }

    static GenerationException asGenerationException(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
            && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof GenerationException) {
            return (GenerationException) cause;
        }
        return new GenerationException("Generation call failed: " + cause, cause);
    }
}
