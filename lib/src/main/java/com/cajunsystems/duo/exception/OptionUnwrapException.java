package com.cajunsystems.duo.exception;

public final class OptionUnwrapException extends InvalidUnwrapException {
    public OptionUnwrapException() {
        super("An option was unwrapped when it was None. Check the option first with 'isSome'.");
    }
}
