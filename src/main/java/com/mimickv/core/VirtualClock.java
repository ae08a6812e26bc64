package com.mimickv.core;

import java.time.Duration;
import java.time.Instant;

/**
 * Clock whose business time can be pinned and moved by tests.
 * When no time is pinned it follows the wall clock. The deadline timer is always real.
 * Thread-safe.
 */
public class VirtualClock implements Clock {

    private static final long UNSET = Long.MIN_VALUE;

    private volatile long pinnedMillis = UNSET;

    @Override
    public long currentTimeMillis() {
        long pinned = pinnedMillis;
        return pinned != UNSET ? pinned : System.currentTimeMillis();
    }

    @Override
    public long nanoTime() {
        return System.nanoTime();
    }

    /**
     * Pin business time to the given instant.
     *
     * @param instant the time to report from now on
     */
    public synchronized void setTime(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("Instant cannot be null");
        }
        pinnedMillis = instant.toEpochMilli();
    }

    /**
     * Move business time forward. Pins the clock at the current wall time first
     * if nothing is pinned yet.
     *
     * @param duration how far to move, must not be negative
     */
    public synchronized void advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("Duration must be non-negative");
        }
        long base = pinnedMillis != UNSET ? pinnedMillis : System.currentTimeMillis();
        pinnedMillis = base + duration.toMillis();
    }

    /**
     * Go back to following the wall clock.
     */
    public synchronized void reset() {
        pinnedMillis = UNSET;
    }

    public boolean isPinned() {
        return pinnedMillis != UNSET;
    }
}
