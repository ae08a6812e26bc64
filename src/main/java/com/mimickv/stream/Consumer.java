package com.mimickv.stream;

/**
 * A named reader inside a consumer group.
 */
public final class Consumer {

    private final String name;
    private long lastSeenMillis;

    Consumer(String name, long lastSeenMillis) {
        this.name = name;
        this.lastSeenMillis = lastSeenMillis;
    }

    public String getName() {
        return name;
    }

    public long getLastSeenMillis() {
        return lastSeenMillis;
    }

    void seen(long nowMillis) {
        this.lastSeenMillis = nowMillis;
    }
}
