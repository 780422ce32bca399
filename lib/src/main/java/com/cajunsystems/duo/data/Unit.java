package com.cajunsystems.duo.data;

/**
 * The value of an operation that is run only for its side effects.
 * Every {@code Unit} is equal to every other.
 */
public record Unit() {
    private static final Unit INSTANCE = new Unit();

    public static Unit unit() {
        return INSTANCE;
    }

    @Override
    public String toString() {
        return "()";
    }
}
