package com.mimickv.core;

/**
 * Source of time for the server.
 * Business time (entry IDs, idle times) and the monotonic timer used for
 * blocking deadlines are separate so business time can be pinned in tests
 * while deadlines still elapse in real time.
 */
public interface Clock {

    /**
     * Current business time.
     *
     * @return milliseconds since the epoch
     */
    long currentTimeMillis();

    /**
     * Monotonic timer used for deadlines.
     *
     * @return nanoseconds from an arbitrary origin
     */
    long nanoTime();
}
