package com.cajunsystems.duo.data;

@FunctionalInterface
public interface ThrowingFunction<A, B> {
    B apply(A input) throws Exception;
}
