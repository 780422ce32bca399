package com.cajunsystems.duo;

import com.cajunsystems.duo.data.Unit;
import com.cajunsystems.duo.exception.ResultUnwrapErrorException;
import com.cajunsystems.duo.exception.ResultUnwrapException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The outcome of an operation that either succeeded with a value or failed with an error.
 *
 * <p>Failures flow through {@link #map} and {@link #bind} untouched, so a chain of
 * dependent steps stops at the first failure and reports it as it was produced.
 *
 * @param <T> the success type
 * @param <E> the failure type
 */
public sealed interface Result<T, E> extends Matchable<T, E> permits Result.Success, Result.Failure {

    record Success<T, E>(T value) implements Result<T, E> {
        @Override
        public <R> R match(Function<? super T, ? extends R> onSuccess, Function<? super E, ? extends R> onFailure) {
            Objects.requireNonNull(onFailure, "onFailure");
            return onSuccess.apply(value);
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failure<T, E>(E error) implements Result<T, E> {
        @Override
        public <R> R match(Function<? super T, ? extends R> onSuccess, Function<? super E, ? extends R> onFailure) {
            Objects.requireNonNull(onSuccess, "onSuccess");
            return onFailure.apply(error);
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }

    // Construction

    static <T, E> Result<T, E> success(T value) {
        return new Success<>(value);
    }

    static <T, E> Result<T, E> failure(E error) {
        return new Failure<>(error);
    }

    /**
     * Collects every success value, or every error if any element failed.
     *
     * <p>All elements are inspected; the first failure does not stop the scan. Both
     * lists keep the order of {@code results}.
     */
    static <T, E> Result<List<T>, List<E>> bindAll(List<? extends Result<? extends T, ? extends E>> results) {
        Objects.requireNonNull(results, "results");
        List<T> successes = new ArrayList<>();
        List<E> failures = new ArrayList<>();
        for (Result<? extends T, ? extends E> result : results) {
            result.effect(successes::add, failures::add);
        }
        return failures.isEmpty()
                ? success(Collections.unmodifiableList(successes))
                : failure(Collections.unmodifiableList(failures));
    }

    // Inspection

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * The success value.
     *
     * @throws ResultUnwrapException if this is a failure
     */
    default T unwrap() {
        return match(value -> value, error -> {
            throw new ResultUnwrapException();
        });
    }

    /**
     * The error.
     *
     * @throws ResultUnwrapErrorException if this is a success
     */
    default E unwrapError() {
        return match(value -> {
            throw new ResultUnwrapErrorException();
        }, error -> error);
    }

    // Transformation

    default <U> Result<U, E> map(Function<? super T, ? extends U> f) {
        Objects.requireNonNull(f, "f");
        return match(value -> success(f.apply(value)), error -> Result.<U, E>failure(error));
    }

    default <F> Result<T, F> mapError(Function<? super E, ? extends F> f) {
        Objects.requireNonNull(f, "f");
        return match(value -> Result.<T, F>success(value), error -> failure(f.apply(error)));
    }

    /**
     * Chains a step that depends on the success value. A failure is returned as is and
     * {@code f} is not called.
     */
    default <U> Result<U, E> bind(Function<? super T, ? extends Result<? extends U, E>> f) {
        Objects.requireNonNull(f, "f");
        return match(value -> narrow(f.apply(value)), error -> sameFailure());
    }

    // Reduction

    default T reduce(T alternative) {
        return match(value -> value, error -> alternative);
    }

    default T reduce(Supplier<? extends T> alternative) {
        Objects.requireNonNull(alternative, "alternative");
        return match(value -> value, error -> alternative.get());
    }

    default T reduce(Function<? super E, ? extends T> alternative) {
        Objects.requireNonNull(alternative, "alternative");
        return match(value -> value, alternative);
    }

    // Side effects

    default Result<T, E> tap(Consumer<? super T> onSuccess, Consumer<? super E> onFailure) {
        effect(onSuccess, onFailure);
        return this;
    }

    @SuppressWarnings("unchecked")
    default Result<T, E> tapSuccess(Consumer<? super T>... onSuccess) {
        effectSuccess(onSuccess);
        return this;
    }

    @SuppressWarnings("unchecked")
    default Result<T, E> tapFailure(Consumer<? super E>... onFailure) {
        effectFailure(onFailure);
        return this;
    }

    @SuppressWarnings("unchecked")
    default Unit effectSuccess(Consumer<? super T>... onSuccess) {
        List<Consumer<? super T>> consumers = List.of(onSuccess);
        return effect(value -> consumers.forEach(c -> c.accept(value)), error -> { });
    }

    @SuppressWarnings("unchecked")
    default Unit effectFailure(Consumer<? super E>... onFailure) {
        List<Consumer<? super E>> consumers = List.of(onFailure);
        return effect(value -> { }, error -> consumers.forEach(c -> c.accept(error)));
    }

    /**
     * Hands a success value to {@code actions} through {@code runner} and returns this
     * result once the run has finished. Nothing runs for a failure.
     */
    default Result<T, E> tapSuccess(
            ActionRunner runner,
            ProcessingOrder order,
            CancellationToken cancellation,
            List<? extends Action<? super T>> actions
    ) {
        Objects.requireNonNull(runner, "runner");
        effect(value -> runner.run(order, value, actions, cancellation), error -> { });
        return this;
    }

    /**
     * Hands an error to {@code actions} through {@code runner}. Nothing runs for a success.
     */
    default Result<T, E> tapFailure(
            ActionRunner runner,
            ProcessingOrder order,
            CancellationToken cancellation,
            List<? extends Action<? super E>> actions
    ) {
        Objects.requireNonNull(runner, "runner");
        effect(value -> { }, error -> runner.run(order, error, actions, cancellation));
        return this;
    }

    default CompletableFuture<Result<T, E>> tapSuccessAsync(
            ActionRunner runner,
            ProcessingOrder order,
            CancellationToken cancellation,
            List<? extends Action<? super T>> actions
    ) {
        Objects.requireNonNull(runner, "runner");
        return match(
                value -> runner.runAsync(order, value, actions, cancellation).thenApply(done -> this),
                error -> CompletableFuture.completedFuture(this)
        );
    }

    // Conversion

    default Option<T> toOption() {
        return match(Option::ofNullable, error -> Option.none());
    }

    // Only reached from the failure case, which holds no value of the success type
    @SuppressWarnings("unchecked")
    private <U> Result<U, E> sameFailure() {
        return (Result<U, E>) (Result<?, E>) this;
    }

    @SuppressWarnings("unchecked")
    private static <U, E> Result<U, E> narrow(Result<? extends U, E> result) {
        return (Result<U, E>) result;
    }
}
