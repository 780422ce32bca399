package com.cajunsystems.duo.exception;

/**
 * Raised when a run of actions is cancelled through its
 * {@link com.cajunsystems.duo.CancellationToken}, or when the waiting thread is interrupted.
 *
 * <p>An action may throw it to report that it observed cancellation; the runner then
 * treats the run as cancelled rather than failed.
 */
public class CancelledException extends RuntimeException {
    public CancelledException() {
        super("Action run was cancelled");
    }

    public CancelledException(InterruptedException cause) {
        super("Action run was cancelled due to interruption", cause);
    }
}
