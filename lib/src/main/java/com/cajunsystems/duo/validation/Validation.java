package com.cajunsystems.duo.validation;

import com.cajunsystems.duo.Matchable;
import com.cajunsystems.duo.Result;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * The outcome of checking a value, which keeps every failure message instead of
 * stopping at the first one.
 *
 * <p>Checks are chained with {@link #bind}: each step validates its own input, and the
 * chain ends {@link Valid} with the last step's value only if every step passed.
 *
 * <pre>{@code
 * Validation<User> user = Validation.valid(request)
 *         .bind(request.name(), Checks::nonBlank)
 *         .bind(request.age(), Checks::adult)
 *         .bind(request, User::from);
 * }</pre>
 *
 * @param <T> the type of a valid value
 */
public sealed interface Validation<T> extends Matchable<T, List<String>>
        permits Validation.Valid, Validation.Invalid {

    record Valid<T>(T value) implements Validation<T> {
        @Override
        public <R> R match(Function<? super T, ? extends R> onValid, Function<? super List<String>, ? extends R> onInvalid) {
            Objects.requireNonNull(onInvalid, "onInvalid");
            return onValid.apply(value);
        }
    }

    record Invalid<T>(List<String> messages) implements Validation<T> {
        public Invalid {
            messages = List.copyOf(messages);
            if (messages.isEmpty()) {
                throw new IllegalArgumentException("An invalid validation needs at least one message");
            }
        }

        @Override
        public <R> R match(Function<? super T, ? extends R> onValid, Function<? super List<String>, ? extends R> onInvalid) {
            Objects.requireNonNull(onValid, "onValid");
            return onInvalid.apply(messages);
        }
    }

    static <T> Validation<T> valid(T value) {
        return new Valid<>(value);
    }

    static <T> Validation<T> invalid(String message) {
        return new Invalid<>(List.of(message));
    }

    static <T> Validation<T> invalid(List<String> messages) {
        return new Invalid<>(messages);
    }

    default boolean isValid() {
        return match(value -> true, messages -> false);
    }

    /**
     * Validates {@code input} and folds the outcome into this chain. The validator runs
     * even if this validation already failed, so its messages are collected too.
     */
    default <A, R> Validation<R> bind(A input, Function<? super A, ? extends Validation<? extends R>> validator) {
        Objects.requireNonNull(validator, "validator");
        Validation<? extends R> next = validator.apply(input);
        return match(
                previous -> next.match(Validation::<R>valid, Validation::<R>invalid),
                earlier -> next.match(value -> invalid(earlier), later -> invalid(concat(earlier, later)))
        );
    }

    default Result<T, List<String>> toResult() {
        return match(Result::success, Result::failure);
    }

    private static List<String> concat(List<String> first, List<? extends String> second) {
        List<String> all = new ArrayList<>(first.size() + second.size());
        all.addAll(first);
        all.addAll(second);
        return all;
    }
}
