package com.riskrails.execution;

import java.time.Duration;

/**
 * Waits between the steps of multi-order algorithms. Swapped for a no-op in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void pause(Duration duration) throws InterruptedException;
}
