package com.hcltech.composable.common;

/** Wall-clock source for event timestamps; tests pass a fixed clock. */
@FunctionalInterface
public interface ITimeService {
    long currentTimeMillis();

    ITimeService real = System::currentTimeMillis;

    static ITimeService fixed(long fixedTimeMillis) {
        return () -> fixedTimeMillis;
    }
}
