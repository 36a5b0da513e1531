package com.phillippitts.modelorchestrator.util;

/**
 * Blocking pause used between retry attempts. Replaceable in tests to record or skip sleeps.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD_SLEEP = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
