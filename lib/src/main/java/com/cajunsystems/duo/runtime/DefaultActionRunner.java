package com.cajunsystems.duo.runtime;

import com.cajunsystems.duo.Action;
import com.cajunsystems.duo.ActionRunner;
import com.cajunsystems.duo.CancellationToken;
import com.cajunsystems.duo.ProcessingOrder;
import com.cajunsystems.duo.data.Unit;
import com.cajunsystems.duo.exception.ActionException;
import com.cajunsystems.duo.exception.CancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ActionRunner} backed by an {@link ExecutorService}.
 *
 * <p>Sequential runs never leave the calling thread. Parallel runs start at most
 * {@code parallelism} workers on the executor; each worker takes the next undispatched
 * action until the list is exhausted, the run is cancelled, or an action fails.
 *
 * <p>{@link #runAsync} and parallel runs share the executor, so it must be able to run
 * more than one task at a time. The default cached pool always can.
 */
public class DefaultActionRunner implements ActionRunner, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DefaultActionRunner.class);

    private final ExecutorService executor;
    private final int parallelism;

    public DefaultActionRunner(ExecutorService executor, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, was " + parallelism);
        }
        this.executor = Objects.requireNonNull(executor, "executor");
        this.parallelism = parallelism;
    }

    /**
     * A runner whose parallel runs are limited to the number of available processors.
     */
    public static DefaultActionRunner create() {
        return create(Runtime.getRuntime().availableProcessors());
    }

    public static DefaultActionRunner create(int parallelism) {
        return new DefaultActionRunner(
                Executors.newCachedThreadPool(new ActionThreadFactory()),
                parallelism
        );
    }

    public int parallelism() {
        return parallelism;
    }

    @Override
    public <T> Unit runSequential(
            T input,
            List<? extends Action<? super T>> actions,
            CancellationToken cancellation
    ) {
        Objects.requireNonNull(actions, "actions");
        Objects.requireNonNull(cancellation, "cancellation");

        int completed = 0;
        for (Action<? super T> action : actions) {
            // Checkpoint before every action
            if (cancellation.isCancelled()) {
                log.debug("Sequential run cancelled after {} of {} actions", completed, actions.size());
                return Unit.unit();
            }
            log.trace("Running action {} of {}", completed + 1, actions.size());
            await(start(action, input));
            completed++;
        }
        return Unit.unit();
    }

    @Override
    public <T> Unit runParallel(
            T input,
            List<? extends Action<? super T>> actions,
            CancellationToken cancellation
    ) {
        Objects.requireNonNull(cancellation, "cancellation");
        List<? extends Action<? super T>> snapshot = List.copyOf(actions);

        if (snapshot.isEmpty()) {
            return Unit.unit();
        }
        if (cancellation.isCancelled()) {
            log.debug("Parallel run cancelled before dispatch of {} actions", snapshot.size());
            return Unit.unit();
        }

        ParallelRun<T> run = new ParallelRun<>(input, snapshot, cancellation);
        int workers = Math.min(parallelism, snapshot.size());
        CompletableFuture<?>[] futures = new CompletableFuture<?>[workers];
        for (int i = 0; i < workers; i++) {
            futures[i] = CompletableFuture.runAsync(run::work, executor);
        }

        CompletableFuture<Void> all = CompletableFuture.allOf(futures);
        CompletableFuture<Throwable> failed = new CompletableFuture<>();
        for (CompletableFuture<?> future : futures) {
            future.whenComplete((value, error) -> {
                if (error != null && !isCancellation(unwrap(error))) {
                    failed.complete(unwrap(error));
                }
            });
        }
        CompletableFuture<Void> cancelled = new CompletableFuture<>();

        try (CancellationToken.Registration ignored = cancellation.onCancel(() -> cancelled.complete(null))) {
            CompletableFuture.anyOf(all, failed, cancelled).get();
        } catch (InterruptedException e) {
            run.stop();
            Thread.currentThread().interrupt();
            throw new CancelledException(e);
        } catch (ExecutionException e) {
            run.stop();
            Throwable cause = unwrap(e.getCause());
            if (!isCancellation(cause)) {
                throw fault(run, snapshot.size(), cause);
            }
            Throwable otherFault = failed.getNow(null);
            if (otherFault != null) {
                throw fault(run, snapshot.size(), otherFault);
            }
            log.debug("Parallel run cancelled by an action after {} of {} dispatches",
                    run.dispatched(), snapshot.size());
            return Unit.unit();
        }

        // A fault wins over a cancellation that arrived later
        Throwable firstFault = failed.getNow(null);
        if (firstFault != null) {
            run.stop();
            throw fault(run, snapshot.size(), firstFault);
        }
        if (!all.isDone()) {
            run.stop();
            log.debug("Parallel run cancelled after {} of {} dispatches", run.dispatched(), snapshot.size());
        }
        return Unit.unit();
    }

    @Override
    public <T> CompletableFuture<Unit> runAsync(
            ProcessingOrder order,
            T input,
            List<? extends Action<? super T>> actions,
            CancellationToken cancellation
    ) {
        Objects.requireNonNull(order, "order");
        return CompletableFuture.supplyAsync(() -> run(order, input, actions, cancellation), executor);
    }

    @Override
    public Executor executor() {
        return executor;
    }

    @Override
    public void close() {
        log.debug("Shutting down action runner");
        executor.shutdown();
    }

    private static <T> CompletionStage<?> start(Action<? super T> action, T input) {
        try {
            return action.execute(input);
        } catch (Exception e) {
            throw ActionException.propagate(e);
        }
    }

    private static void await(CompletionStage<?> stage) {
        if (stage == null) {
            return;
        }
        try {
            stage.toCompletableFuture().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException(e);
        } catch (ExecutionException e) {
            throw ActionException.propagate(unwrap(e.getCause()));
        }
    }

    private static RuntimeException fault(ParallelRun<?> run, int size, Throwable cause) {
        log.debug("Parallel run stopped by a failed action after {} of {} dispatches",
                run.dispatched(), size, cause);
        return ActionException.propagate(cause);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static boolean isCancellation(Throwable error) {
        return error instanceof CancelledException || error instanceof CancellationException;
    }

    /**
     * The shared cursor of one parallel run. Each worker claims indices until there are
     * none left or the run is stopped.
     */
    private static final class ParallelRun<T> {
        private final T input;
        private final List<? extends Action<? super T>> actions;
        private final CancellationToken cancellation;
        private final AtomicInteger cursor = new AtomicInteger();
        private final AtomicInteger dispatched = new AtomicInteger();
        private final AtomicBoolean stopped = new AtomicBoolean(false);

        ParallelRun(T input, List<? extends Action<? super T>> actions, CancellationToken cancellation) {
            this.input = input;
            this.actions = actions;
            this.cancellation = cancellation;
        }

        void work() {
            while (!stopped.get()) {
                int index = cursor.getAndIncrement();
                if (index >= actions.size()) {
                    return;
                }
                // Checkpoint per action chosen for dispatch
                if (cancellation.isCancelled()) {
                    stop();
                    return;
                }
                dispatched.incrementAndGet();
                log.trace("Dispatching action {} of {}", index + 1, actions.size());
                try {
                    await(start(actions.get(index), input));
                } catch (RuntimeException | Error e) {
                    stop();
                    throw e;
                }
            }
        }

        void stop() {
            stopped.set(true);
        }

        int dispatched() {
            return dispatched.get();
        }
    }

    private static final class ActionThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "duo-action-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
