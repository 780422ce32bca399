package com.cajunsystems.duo.data;

@FunctionalInterface
public interface ThrowingSupplier<A> {
    A get() throws Exception;
}
