package com.cajunsystems.duo;

import com.cajunsystems.duo.data.Either;
import com.cajunsystems.duo.data.Unit;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * The shared contract of every two-case container in this library.
 *
 * <p>{@link #match} is the only abstract operation; everything else a container offers
 * is expressed through it, so the two cases are never inspected any other way.
 *
 * @param <A> the type carried by the first case
 * @param <B> the type carried by the second case
 */
public interface Matchable<A, B> {

    /**
     * Applies exactly one of the two functions, chosen by the case this value is in,
     * and returns what it produced.
     */
    <T> T match(Function<? super A, ? extends T> onFirst, Function<? super B, ? extends T> onSecond);

    /**
     * Runs exactly one of the two consumers, chosen by the case this value is in.
     */
    default Unit effect(Consumer<? super A> onFirst, Consumer<? super B> onSecond) {
        Objects.requireNonNull(onFirst, "onFirst");
        Objects.requireNonNull(onSecond, "onSecond");
        return match(
                a -> {
                    onFirst.accept(a);
                    return Unit.unit();
                },
                b -> {
                    onSecond.accept(b);
                    return Unit.unit();
                }
        );
    }

    default Either<A, B> toEither() {
        return match(Either::left, Either::right);
    }
}
