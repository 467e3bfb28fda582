package io.trading.perpfeed.core;

import java.time.Duration;

/**
 * Cancellation-aware delay. The lifecycle loop waits through this so tests can run many
 * retry iterations without real time passing.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    /**
     * Blocks for the given duration.
     *
     * @throws InterruptedException if the waiting thread is cancelled
     */
    void sleep(Duration duration) throws InterruptedException;
}
