package com.cajunsystems.duo.exception;

public final class ResultUnwrapException extends InvalidUnwrapException {
    public ResultUnwrapException() {
        super("A result was unwrapped when it was a Failure. Check the result first with 'isSuccess'.");
    }
}
