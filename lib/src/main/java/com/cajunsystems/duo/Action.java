package com.cajunsystems.duo;

import com.cajunsystems.duo.data.ThrowingConsumer;
import com.cajunsystems.duo.data.ThrowingRunnable;
import com.cajunsystems.duo.data.Unit;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * An effect run by an {@link ActionRunner} against a shared input.
 *
 * <p>Every action is asynchronous in shape: it returns a stage that completes when the
 * effect is done. Synchronous code is adapted with {@link #of} or {@link #ignoringInput},
 * which do their work before returning an already-completed stage. A {@code null}
 * stage is treated as already complete.
 *
 * @param <T> the type of the input handed to the action
 */
@FunctionalInterface
public interface Action<T> {

    CompletionStage<?> execute(T input) throws Exception;

    static <T> Action<T> of(ThrowingConsumer<? super T> consumer) {
        Objects.requireNonNull(consumer, "consumer");
        return input -> {
            consumer.accept(input);
            return CompletableFuture.completedStage(Unit.unit());
        };
    }

    static <T> Action<T> ignoringInput(ThrowingRunnable runnable) {
        Objects.requireNonNull(runnable, "runnable");
        return input -> {
            runnable.run();
            return CompletableFuture.completedStage(Unit.unit());
        };
    }

    static <T> Action<T> async(Function<? super T, ? extends CompletionStage<?>> start) {
        Objects.requireNonNull(start, "start");
        return start::apply;
    }

    /**
     * Collects actions into an ordered, unmodifiable list.
     */
    @SafeVarargs
    static <T> List<Action<T>> sequence(Action<T>... actions) {
        return List.of(actions);
    }
}
