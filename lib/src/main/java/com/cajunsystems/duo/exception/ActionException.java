package com.cajunsystems.duo.exception;

/**
 * Carries a checked exception thrown by an action out of a runner, which only
 * throws unchecked exceptions. Unchecked exceptions and errors are never wrapped.
 */
public class ActionException extends RuntimeException {
    public ActionException(Throwable cause) {
        super("Action failed: " + cause, cause);
    }

    /**
     * Returns {@code error} itself when it is a runtime exception, otherwise wraps it.
     * Errors are rethrown directly. Call as {@code throw ActionException.propagate(e)}.
     */
    public static RuntimeException propagate(Throwable error) {
        if (error instanceof Error err) {
            throw err;
        }
        if (error instanceof RuntimeException re) {
            return re;
        }
        return new ActionException(error);
    }
}
