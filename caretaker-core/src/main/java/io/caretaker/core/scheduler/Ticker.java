package io.caretaker.core.scheduler;

import java.time.Duration;

/**
 * Waits between scheduler ticks. Tests substitute an implementation that advances a virtual clock.
 */
@FunctionalInterface
public interface Ticker {

    void sleep(Duration duration) throws InterruptedException;

    static Ticker system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
