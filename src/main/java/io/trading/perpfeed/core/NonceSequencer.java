package io.trading.perpfeed.core;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Produces strictly increasing update identifiers from timestamps.
 *
 * The identifier is the timestamp in microseconds. When a timestamp does not advance past
 * the last issued identifier (same microsecond burst, or a late message), the previous
 * identifier plus one is returned instead, so ordering holds across concurrent callers.
 */
public class NonceSequencer {

    private static final double MICROS_PER_SECOND = 1_000_000d;

    private final AtomicLong lastNonce = new AtomicLong(0);

    /**
     * Returns the next identifier for the given timestamp.
     *
     * @param timestampSeconds Timestamp in seconds since epoch, fractional
     * @return an identifier greater than every identifier returned before
     */
    public long next(double timestampSeconds) {
        long candidate = (long) (timestampSeconds * MICROS_PER_SECOND);
        return lastNonce.updateAndGet(last -> Math.max(candidate, last + 1));
    }

    /**
     * Returns the most recently issued identifier, or 0 if none was issued.
     */
    public long last() {
        return lastNonce.get();
    }
}
