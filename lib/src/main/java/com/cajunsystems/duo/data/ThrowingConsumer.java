package com.cajunsystems.duo.data;

@FunctionalInterface
public interface ThrowingConsumer<A> {
    void accept(A input) throws Exception;
}
