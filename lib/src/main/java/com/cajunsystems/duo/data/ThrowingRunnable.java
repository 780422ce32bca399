package com.cajunsystems.duo.data;

@FunctionalInterface
public interface ThrowingRunnable {
    void run() throws Exception;
}
