package com.statementradar.common;

/**
 * Blocks the calling thread. Swapped for a recording fake in tests so backoff never sleeps for real.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
