package com.example.demo.factfind.client;

import org.springframework.core.task.AsyncTaskExecutor;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

/**
 * Runs a blocking call on an executor and exposes it as a {@link CompletableFuture}
 * whose {@code cancel} interrupts the worker thread, which aborts a pending HTTP exchange.
 */
public final class CancellableCalls {

    private CancellableCalls() {
    }

    public static <T> CompletableFuture<T> submit(AsyncTaskExecutor executor, Callable<T> call) {
        CompletableFuture<T> result = new CompletableFuture<>();
        Future<?> task = executor.submit(() -> {
            try {
                result.complete(call.call());
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        });
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                task.cancel(true);
            }
        });
        return result;
    }
}
