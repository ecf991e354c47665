package com.example.interview.service.util;

import com.example.interview.dto.SchedulingErrorType;
import com.example.interview.service.exception.AvailabilityGatherTimeoutException;
import com.example.interview.service.exception.ExternalLookupException;
import com.example.interview.service.exception.SchedulingException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs external reads on a bounded pool and waits at most the given timeout for them.
 */
public final class BoundedCall {

    private BoundedCall() {
    }

    public static <T> T call(Executor executor, Duration timeout, String what, Supplier<T> supplier) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(supplier, executor);
        return await(future, List.of(future), timeout, what);
    }

    public static <T> List<T> awaitAll(List<CompletableFuture<T>> futures, Duration timeout, String what) {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]));
        await(all, futures, timeout, what);
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private static <R> R await(CompletableFuture<R> future, List<? extends CompletableFuture<?>> toCancel,
                               Duration timeout, String what) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            toCancel.forEach(f -> f.cancel(true));
            throw new AvailabilityGatherTimeoutException(what + " not available within " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            toCancel.forEach(f -> f.cancel(true));
            throw new SchedulingException(SchedulingErrorType.SCHEDULING_ERROR, "Interrupted while loading " + what, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof SchedulingException se) {
                throw se;
            }
            throw new ExternalLookupException("Failed to load " + what + ": " + cause.getMessage(), cause);
        }
    }
}
