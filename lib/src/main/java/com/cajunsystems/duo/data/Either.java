package com.cajunsystems.duo.data;

import com.cajunsystems.duo.Matchable;

import java.util.Objects;
import java.util.function.Function;

/**
 * A value that is exactly one of two cases.
 *
 * <p>The interface is sealed to {@link Left} and {@link Right}, so a value can never be
 * in a third state and {@link #match} needs no fallback branch.
 *
 * @param <L> the type held by the left case
 * @param <R> the type held by the right case
 */
public sealed interface Either<L, R> extends Matchable<L, R> permits Either.Left, Either.Right {

    record Left<L, R>(L value) implements Either<L, R> {
        @Override
        public <T> T match(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight) {
            Objects.requireNonNull(onRight, "onRight");
            return onLeft.apply(value);
        }

        @Override
        public boolean isLeft() {
            return true;
        }
    }

    record Right<L, R>(R value) implements Either<L, R> {
        @Override
        public <T> T match(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight) {
            Objects.requireNonNull(onLeft, "onLeft");
            return onRight.apply(value);
        }

        @Override
        public boolean isLeft() {
            return false;
        }
    }

    static <L, R> Either<L, R> left(L value) {
        return new Left<>(value);
    }

    static <L, R> Either<L, R> right(R value) {
        return new Right<>(value);
    }

    boolean isLeft();

    default boolean isRight() {
        return !isLeft();
    }

    @Override
    default Either<L, R> toEither() {
        return this;
    }

    default <R2> Either<L, R2> map(Function<? super R, ? extends R2> f) {
        return match(Either::left, r -> right(f.apply(r)));
    }

    default Either<R, L> swap() {
        return match(Either::right, Either::left);
    }
}
