package com.mimickv.client;

/**
 * Configuration for MimicKV client.
 */
public class ClientConfig {

    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 30000;
    private int database = 0;

    /**
     * Create a config builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        if (connectTimeoutMs <= 0) {
            throw new IllegalArgumentException("connectTimeoutMs must be positive, got: " + connectTimeoutMs);
        }
        this.connectTimeoutMs = connectTimeoutMs;
    }

    /**
     * Socket read timeout. 0 waits forever, which suits blocking reads without a deadline.
     */
    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        if (readTimeoutMs < 0) {
            throw new IllegalArgumentException("readTimeoutMs must be non-negative, got: " + readTimeoutMs);
        }
        this.readTimeoutMs = readTimeoutMs;
    }

    /**
     * Database selected right after connecting.
     */
    public int getDatabase() {
        return database;
    }

    public void setDatabase(int database) {
        if (database < 0) {
            throw new IllegalArgumentException("database must be non-negative, got: " + database);
        }
        this.database = database;
    }

    /**
     * Builder for ClientConfig.
     */
    public static class Builder {
        private final ClientConfig config = new ClientConfig();

        public Builder connectTimeoutMs(int timeout) {
            config.setConnectTimeoutMs(timeout);
            return this;
        }

        public Builder readTimeoutMs(int timeout) {
            config.setReadTimeoutMs(timeout);
            return this;
        }

        public Builder database(int database) {
            config.setDatabase(database);
            return this;
        }

        public ClientConfig build() {
            return config;
        }
    }
}
