package com.cajunsystems.duo;

import com.cajunsystems.duo.data.ThrowingConsumer;
import com.cajunsystems.duo.data.ThrowingFunction;
import com.cajunsystems.duo.data.ThrowingRunnable;
import com.cajunsystems.duo.data.ThrowingSupplier;
import com.cajunsystems.duo.data.Unit;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs code that may throw and turns any {@link Exception} into a failed {@link Result}.
 *
 * <p>This is the only place in the library that catches exceptions thrown by caller
 * code. {@link Error}s are not caught.
 */
public final class Try {

    private Try() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static <T> Result<T, Exception> of(ThrowingSupplier<? extends T> supplier) {
        try {
            return Result.success(supplier.get());
        } catch (Exception e) {
            return Result.failure(e);
        }
    }

    public static Result<Unit, Exception> run(ThrowingRunnable runnable) {
        try {
            runnable.run();
            return Result.success(Unit.unit());
        } catch (Exception e) {
            return Result.failure(e);
        }
    }

    public static <A, T> Result<T, Exception> apply(A input, ThrowingFunction<? super A, ? extends T> function) {
        return of(() -> function.apply(input));
    }

    public static <A> Result<Unit, Exception> accept(A input, ThrowingConsumer<? super A> consumer) {
        return run(() -> consumer.accept(input));
    }

    /**
     * Starts an asynchronous computation and completes with its outcome as a result.
     * The returned future never completes exceptionally: a throw from {@code start}
     * and a failed stage both become a failure. A {@code null} stage counts as a
     * completed one holding {@code null}.
     */
    public static <T> CompletableFuture<Result<T, Exception>> ofAsync(
            ThrowingSupplier<? extends CompletionStage<? extends T>> start
    ) {
        CompletableFuture<? extends T> future;
        try {
            CompletionStage<? extends T> stage = start.get();
            if (stage == null) {
                return CompletableFuture.completedFuture(Result.success(null));
            }
            future = stage.toCompletableFuture();
        } catch (Exception e) {
            return CompletableFuture.completedFuture(Result.failure(e));
        }
        return future.handle(Try::<T>complete);
    }

    /**
     * Runs {@code runnable} on {@code executor} and completes with its outcome. An
     * executor that refuses the task yields a failure.
     */
    public static CompletableFuture<Result<Unit, Exception>> runAsync(ThrowingRunnable runnable, Executor executor) {
        try {
            return CompletableFuture.supplyAsync(() -> run(runnable), executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(Result.failure(e));
        }
    }

    /**
     * The message of the exception that caused {@code error}, if there is one.
     */
    public static Option<String> causeMessage(Throwable error) {
        return Option.ofNullable(error.getCause()).map(Throwable::getMessage);
    }

    private static <T> Result<T, Exception> complete(T value, Throwable error) {
        if (error == null) {
            return Result.success(value);
        }
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (cause instanceof Exception e) {
            return Result.failure(e);
        }
        if (cause instanceof Error err) {
            throw err;
        }
        return Result.failure(new RuntimeException(cause));
    }
}
