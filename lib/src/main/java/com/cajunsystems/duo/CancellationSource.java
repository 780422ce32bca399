package com.cajunsystems.duo;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The write side of a cancellation signal. Cancelling a source cancels every child
 * source created from it; cancelling a child leaves its parent untouched.
 *
 * <p>A parent holds on to a child only until the child is cancelled or closed, so a
 * long-lived parent can hand out a child per unit of work:
 *
 * <pre>{@code
 * try (CancellationSource request = server.childSource()) {
 *     runner.runParallel(input, actions, request.token());
 * }
 * }</pre>
 */
public final class CancellationSource implements CancellationToken, AutoCloseable {
    private final CancellationSource parent;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<CancellationSource> children = new CopyOnWriteArrayList<>();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public CancellationSource() {
        this(null);
    }

    private CancellationSource(CancellationSource parent) {
        this.parent = parent;
    }

    /**
     * Creates a source that is cancelled together with this one.
     */
    public CancellationSource childSource() {
        CancellationSource child = new CancellationSource(this);
        children.add(child);
        if (isCancelled()) {
            child.cancel();
        }
        return child;
    }

    public CancellationToken token() {
        return this;
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get() || (parent != null && parent.isCancelled());
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            detach();
            callbacks.forEach(this::runOnce);
            children.forEach(CancellationSource::cancel);
        }
    }

    /**
     * Releases this source from its parent without cancelling it. A closed child still
     * reports the parent's cancellation through {@link #isCancelled()}, but its
     * callbacks are no longer run when the parent is cancelled.
     */
    @Override
    public void close() {
        detach();
    }

    int childCount() {
        return children.size();
    }

    @Override
    public Registration onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        callbacks.add(callback);
        if (isCancelled()) {
            runOnce(callback);
        }
        return () -> callbacks.remove(callback);
    }

    private void detach() {
        if (parent != null) {
            parent.children.remove(this);
        }
    }

    // remove() on the copy-on-write list is atomic, so a racing cancel() and
    // onCancel() cannot both run the same callback
    private void runOnce(Runnable callback) {
        if (callbacks.remove(callback)) {
            callback.run();
        }
    }
}
