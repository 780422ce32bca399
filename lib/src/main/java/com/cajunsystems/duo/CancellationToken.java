package com.cajunsystems.duo;

/**
 * The read side of a cooperative cancellation signal.
 *
 * <p>Nothing is interrupted when a token is cancelled. Code that holds the token polls
 * {@link #isCancelled()} at its own check points, or registers a callback.
 */
public interface CancellationToken {

    boolean isCancelled();

    /**
     * Registers a callback to run once when this token is cancelled. If the token is
     * already cancelled the callback runs immediately on the calling thread.
     * Callbacks must not throw.
     */
    Registration onCancel(Runnable callback);

    /**
     * A token that is never cancelled.
     */
    static CancellationToken none() {
        return Never.INSTANCE;
    }

    @FunctionalInterface
    interface Registration extends AutoCloseable {
        /**
         * Removes the callback if it has not run yet.
         */
        @Override
        void close();
    }

    enum Never implements CancellationToken {
        INSTANCE;

        @Override
        public boolean isCancelled() {
            return false;
        }

        @Override
        public Registration onCancel(Runnable callback) {
            return () -> { };
        }
    }
}
