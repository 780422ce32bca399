package com.cajunsystems.duo.exception;

public final class ResultUnwrapErrorException extends InvalidUnwrapException {
    public ResultUnwrapErrorException() {
        super("A result was unwrapped as an error when it was a Success. Check the result first with 'isFailure'.");
    }
}
