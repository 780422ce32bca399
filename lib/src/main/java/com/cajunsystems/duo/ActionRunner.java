package com.cajunsystems.duo;

import com.cajunsystems.duo.data.Unit;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs a fixed list of actions against one input, either in order or concurrently,
 * honouring a cooperative {@link CancellationToken}.
 *
 * <p>A runner keeps no state between runs. Cancellation never undoes actions that have
 * already run.
 */
public interface ActionRunner {

    /**
     * Runs the actions one after another on the calling thread. The token is checked
     * before each action; once it is cancelled the remaining actions are skipped and
     * the call returns normally. A fault from an action ends the run and is rethrown.
     */
    <T> Unit runSequential(T input, List<? extends Action<? super T>> actions, CancellationToken cancellation);

    /**
     * Runs the actions concurrently, with no ordering guarantee, and blocks until all
     * have finished or the token is cancelled. Cancellation makes the call return
     * normally even if some actions are still running. Any fault other than a
     * cancellation is rethrown.
     */
    <T> Unit runParallel(T input, List<? extends Action<? super T>> actions, CancellationToken cancellation);

    /**
     * Performs {@link #run} on {@link #executor()} and completes with its outcome.
     */
    <T> CompletableFuture<Unit> runAsync(
            ProcessingOrder order,
            T input,
            List<? extends Action<? super T>> actions,
            CancellationToken cancellation
    );

    Executor executor();

    default <T> Unit run(
            ProcessingOrder order,
            T input,
            List<? extends Action<? super T>> actions,
            CancellationToken cancellation
    ) {
        return switch (order) {
            case SEQUENTIAL -> runSequential(input, actions, cancellation);
            case PARALLEL -> runParallel(input, actions, cancellation);
        };
    }

    default <T> Unit run(ProcessingOrder order, T input, List<? extends Action<? super T>> actions) {
        return run(order, input, actions, CancellationToken.none());
    }

    default <T> Unit runSequential(T input, List<? extends Action<? super T>> actions) {
        return runSequential(input, actions, CancellationToken.none());
    }

    default <T> Unit runParallel(T input, List<? extends Action<? super T>> actions) {
        return runParallel(input, actions, CancellationToken.none());
    }

    default Unit runSequential(List<? extends Action<? super Unit>> actions, CancellationToken cancellation) {
        return runSequential(Unit.unit(), actions, cancellation);
    }

    default Unit runParallel(List<? extends Action<? super Unit>> actions, CancellationToken cancellation) {
        return runParallel(Unit.unit(), actions, cancellation);
    }
}
