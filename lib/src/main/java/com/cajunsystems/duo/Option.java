package com.cajunsystems.duo;

import com.cajunsystems.duo.data.Unit;
import com.cajunsystems.duo.exception.OptionUnwrapException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * A value that may be absent.
 *
 * <p>Absence is its own case, {@link None}, and never a {@code null} inside {@link Some}.
 * Every transformation returns a new option; functions handed to an option are never
 * called on {@code None}.
 *
 * @param <T> the type of the contained value
 */
public sealed interface Option<T> extends Matchable<T, Unit> permits Option.Some, Option.None {

    record Some<T>(T value) implements Option<T> {
        public Some {
            Objects.requireNonNull(value, "Some cannot hold null; use Option.ofNullable");
        }

        @Override
        public <R> R match(Function<? super T, ? extends R> whenSome, Function<? super Unit, ? extends R> whenNone) {
            Objects.requireNonNull(whenNone, "whenNone");
            return whenSome.apply(value);
        }

        @Override
        public boolean isSome() {
            return true;
        }
    }

    record None<T>() implements Option<T> {
        @Override
        public <R> R match(Function<? super T, ? extends R> whenSome, Function<? super Unit, ? extends R> whenNone) {
            Objects.requireNonNull(whenSome, "whenSome");
            return whenNone.apply(Unit.unit());
        }

        @Override
        public boolean isSome() {
            return false;
        }

        @Override
        public String toString() {
            return "None";
        }
    }

    // Construction

    static <T> Option<T> some(T value) {
        return new Some<>(value);
    }

    static <T> Option<T> none() {
        return new None<>();
    }

    /**
     * {@code None} for {@code null}, otherwise {@code Some(value)}.
     */
    static <T> Option<T> ofNullable(T value) {
        return value == null ? none() : some(value);
    }

    static <T> Option<T> fromOptional(Optional<? extends T> optional) {
        return optional.<Option<T>>map(Option::some).orElseGet(Option::none);
    }

    // Inspection

    boolean isSome();

    default boolean isNone() {
        return !isSome();
    }

    /**
     * The contained value.
     *
     * @throws OptionUnwrapException if this is {@code None}
     */
    default T unwrap() {
        return match(value -> value, none -> {
            throw new OptionUnwrapException();
        });
    }

    default <R> R match(Function<? super T, ? extends R> whenSome, Supplier<? extends R> whenNone) {
        Objects.requireNonNull(whenNone, "whenNone");
        return match(whenSome, none -> whenNone.get());
    }

    // Transformation

    /**
     * Applies {@code f} to a contained value. A {@code null} from {@code f} yields {@code None}.
     */
    default <R> Option<R> map(Function<? super T, ? extends R> f) {
        Objects.requireNonNull(f, "f");
        return match(value -> ofNullable(f.apply(value)), Option::none);
    }

    default Option<T> filter(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return match(value -> predicate.test(value) ? this : none(), () -> this);
    }

    default <R> Option<R> bind(Function<? super T, ? extends Option<? extends R>> f) {
        Objects.requireNonNull(f, "f");
        return match(value -> narrow(f.apply(value)), Option::none);
    }

    // Reduction

    default T reduce(T alternative) {
        return match(value -> value, () -> alternative);
    }

    default T reduce(Supplier<? extends T> alternative) {
        Objects.requireNonNull(alternative, "alternative");
        return match(value -> value, alternative);
    }

    default T reduce(Function<? super Unit, ? extends T> alternative) {
        Objects.requireNonNull(alternative, "alternative");
        return match(value -> value, alternative);
    }

    // Side effects

    default Option<T> tap(Consumer<? super T> whenSome, Runnable whenNone) {
        effect(whenSome, whenNone);
        return this;
    }

    default Unit effect(Consumer<? super T> whenSome, Runnable whenNone) {
        Objects.requireNonNull(whenNone, "whenNone");
        return effect(whenSome, none -> whenNone.run());
    }

    @SuppressWarnings("unchecked")
    default Option<T> tapSome(Consumer<? super T>... whenSome) {
        effectSome(whenSome);
        return this;
    }

    default Option<T> tapNone(Runnable... whenNone) {
        effectNone(whenNone);
        return this;
    }

    @SuppressWarnings("unchecked")
    default Unit effectSome(Consumer<? super T>... whenSome) {
        List<Consumer<? super T>> consumers = List.of(whenSome);
        return effect(value -> consumers.forEach(c -> c.accept(value)), () -> { });
    }

    default Unit effectNone(Runnable... whenNone) {
        List<Runnable> runnables = List.of(whenNone);
        return effect(value -> { }, () -> runnables.forEach(Runnable::run));
    }

    /**
     * Hands a contained value to {@code actions} through {@code runner} and returns this
     * option once the run has finished. Nothing runs for {@code None}.
     */
    default Option<T> tapSome(
            ActionRunner runner,
            ProcessingOrder order,
            CancellationToken cancellation,
            List<? extends Action<? super T>> actions
    ) {
        Objects.requireNonNull(runner, "runner");
        effect(value -> runner.run(order, value, actions, cancellation), () -> { });
        return this;
    }

    default CompletableFuture<Option<T>> tapSomeAsync(
            ActionRunner runner,
            ProcessingOrder order,
            CancellationToken cancellation,
            List<? extends Action<? super T>> actions
    ) {
        Objects.requireNonNull(runner, "runner");
        return match(
                value -> runner.runAsync(order, value, actions, cancellation).thenApply(done -> this),
                () -> CompletableFuture.completedFuture(this)
        );
    }

    // Conversion

    default Optional<T> toOptional() {
        return match(Optional::of, Optional::empty);
    }

    default <E> Result<T, E> toResult(Supplier<? extends E> whenNone) {
        Objects.requireNonNull(whenNone, "whenNone");
        return match(Result::success, () -> Result.failure(whenNone.get()));
    }

    @SuppressWarnings("unchecked")
    private static <R> Option<R> narrow(Option<? extends R> option) {
        return (Option<R>) option;
    }
}
