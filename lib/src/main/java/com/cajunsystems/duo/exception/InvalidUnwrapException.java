package com.cajunsystems.duo.exception;

/**
 * Thrown when a value is unwrapped as a case it is not in.
 *
 * <p>This is a programming error, not a domain failure: check the case first with
 * {@code isSome()}, {@code isSuccess()} or {@code isFailure()}.
 */
public abstract class InvalidUnwrapException extends IllegalStateException {
    protected InvalidUnwrapException(String message) {
        super(message);
    }
}
