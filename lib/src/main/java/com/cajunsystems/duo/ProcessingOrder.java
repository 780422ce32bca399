package com.cajunsystems.duo;

/**
 * How an {@link ActionRunner} schedules a list of actions.
 */
public enum ProcessingOrder {
    /**
     * One at a time, in list order. Each action completes before the next starts.
     */
    SEQUENTIAL,

    /**
     * Concurrently, with no ordering between actions.
     */
    PARALLEL;

    public static final ProcessingOrder DEFAULT = SEQUENTIAL;
}
